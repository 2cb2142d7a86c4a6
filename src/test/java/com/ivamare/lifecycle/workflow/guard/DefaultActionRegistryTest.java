package com.ivamare.lifecycle.workflow.guard;

import com.ivamare.lifecycle.exception.ActionAlreadyRegisteredException;
import com.ivamare.lifecycle.workflow.TransitionInput;
import com.ivamare.lifecycle.workflow.TransitionResult;
import com.ivamare.lifecycle.workflow.guard.ActionRegistry.ActionKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class DefaultActionRegistryTest {

    private DefaultActionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new DefaultActionRegistry();
    }

    private static ActionInput actionInput() {
        UUID id = UUID.randomUUID();
        TransitionInput transition = TransitionInput.named(id, "page", "draft", "publish", null);
        TransitionResult result = new TransitionResult(id, "page", "publish", "draft", "published",
            Instant.now(), null, Map.of(), List.of(), List.of());
        return new ActionInput(transition, result);
    }

    @Nested
    class RegisterTests {

        @Test
        void shouldRegisterAction() {
            registry.register("Page", "Publish", input -> ActionOutput.empty());

            assertTrue(registry.hasAction("page", "publish"));
            assertEquals(List.of(new ActionKey("page", "publish")), registry.registeredActions());
        }

        @Test
        void shouldThrowOnDuplicateRegistration() {
            registry.register("page", "publish", input -> ActionOutput.empty());

            var ex = assertThrows(ActionAlreadyRegisteredException.class, () ->
                registry.register(" PAGE ", "publish", input -> ActionOutput.empty()));
            assertEquals("page", ex.getEntityType());
            assertEquals("publish", ex.getTransitionName());
        }

        @Test
        void shouldAllowSameTransitionForDifferentEntityTypes() {
            registry.register("page", "publish", input -> ActionOutput.empty());
            registry.register("block", "publish", input -> ActionOutput.empty());

            assertEquals(2, registry.registeredActions().size());
        }

        @Test
        void shouldTreatBlankEntityTypeAsWildcard() {
            registry.register("", "archive", input -> ActionOutput.empty());

            assertTrue(registry.hasAction(ActionRegistry.ANY_ENTITY_TYPE, "archive"));
        }

        @Test
        void shouldRejectBlankTransitionName() {
            assertThrows(IllegalArgumentException.class, () ->
                registry.register("page", " ", input -> ActionOutput.empty()));
        }
    }

    @Nested
    class ResolveTests {

        @Test
        void shouldPreferSpecificOverWildcard() throws Exception {
            registry.register("*", "publish", input -> ActionOutput.ofMetadata(Map.of("source", "wildcard")));
            registry.register("page", "publish", input -> ActionOutput.ofMetadata(Map.of("source", "page")));

            ActionOutput output = registry.resolve("page", "publish").orElseThrow().execute(actionInput());

            assertEquals("page", output.metadata().get("source"));
        }

        @Test
        void shouldFallBackToWildcard() throws Exception {
            registry.register("*", "publish", input -> ActionOutput.ofMetadata(Map.of("source", "wildcard")));

            ActionOutput output = registry.resolve("block", "publish").orElseThrow().execute(actionInput());

            assertEquals("wildcard", output.metadata().get("source"));
            assertFalse(registry.hasAction("block", "publish"));
        }

        @Test
        void shouldReturnEmptyWhenNotRegistered() {
            assertTrue(registry.resolve("page", "publish").isEmpty());
        }
    }

    @Nested
    class SealTests {

        @Test
        void shouldRejectRegistrationAfterSeal() {
            registry.seal();

            assertTrue(registry.isSealed());
            assertThrows(IllegalStateException.class, () ->
                registry.register("page", "publish", input -> ActionOutput.empty()));
        }

        @Test
        void shouldSealAfterSingletonsInstantiated() {
            registry.afterSingletonsInstantiated();

            assertTrue(registry.isSealed());
        }

        @Test
        void shouldStillResolveAfterSeal() {
            registry.register("page", "publish", input -> ActionOutput.empty());
            registry.seal();

            assertTrue(registry.resolve("page", "publish").isPresent());
        }
    }

    @Nested
    class RegisterBeanTests {

        @Test
        void shouldRegisterAnnotatedMethods() {
            List<ActionKey> registered = registry.registerBean(new TestHooksBean());

            assertEquals(2, registered.size());
            assertTrue(registry.hasAction("page", "publish"));
            assertTrue(registry.hasAction("*", "archive"));
        }

        @Test
        void shouldInvokeHookMethod() throws Exception {
            registry.registerBean(new TestHooksBean());

            ActionOutput output = registry.resolve("page", "publish").orElseThrow().execute(actionInput());

            assertEquals(true, output.metadata().get("indexed"));
        }

        @Test
        void shouldUnwrapHookException() {
            registry.registerBean(new FailingHooksBean());

            var action = registry.resolve("page", "publish").orElseThrow();
            var ex = assertThrows(IllegalStateException.class, () -> action.execute(actionInput()));
            assertEquals("search index down", ex.getMessage());
        }

        @Test
        void shouldThrowOnInvalidMethodSignature() {
            assertThrows(IllegalArgumentException.class, () ->
                registry.registerBean(new InvalidHooksBean()));
        }

        @Test
        void shouldSkipMethodsWithoutAnnotation() {
            registry.registerBean(new TestHooksBean());

            assertEquals(2, registry.registeredActions().size());
        }
    }

    @Nested
    class BeanPostProcessorTests {

        @Test
        void shouldScanBeanWithHooks() {
            TestHooksBean bean = new TestHooksBean();

            Object result = registry.postProcessAfterInitialization(bean, "hooks");

            assertSame(bean, result);
            assertTrue(registry.hasAction("page", "publish"));
        }

        @Test
        void shouldIgnoreBeanWithoutHooks() {
            Object bean = new Object();

            Object result = registry.postProcessAfterInitialization(bean, "plainBean");

            assertSame(bean, result);
            assertTrue(registry.registeredActions().isEmpty());
        }
    }

    public static class TestHooksBean {

        @TransitionHook(entityType = "page", transition = "publish")
        public ActionOutput onPublish(ActionInput input) {
            return ActionOutput.ofMetadata(Map.of("indexed", true));
        }

        @TransitionHook(transition = "archive")
        public ActionOutput onArchive(ActionInput input) {
            return ActionOutput.empty();
        }

        public ActionOutput notAHook(ActionInput input) {
            return ActionOutput.empty();
        }
    }

    public static class FailingHooksBean {

        @TransitionHook(entityType = "page", transition = "publish")
        public ActionOutput onPublish(ActionInput input) {
            throw new IllegalStateException("search index down");
        }
    }

    public static class InvalidHooksBean {

        @TransitionHook(entityType = "page", transition = "publish")
        public String onPublish(ActionInput input) {
            return "wrong";
        }
    }
}
