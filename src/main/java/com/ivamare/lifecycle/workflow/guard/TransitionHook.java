package com.ivamare.lifecycle.workflow.guard;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method as a transition action.
 *
 * <p>Annotated methods on Spring beans are discovered by
 * {@link DefaultActionRegistry} while the application context starts.
 * They must have the signature:
 * <pre>
 * ActionOutput onXxx(ActionInput input)
 * </pre>
 *
 * <p>Example:
 * <pre>
 * {@literal @}Component
 * public class PageHooks {
 *
 *     {@literal @}TransitionHook(entityType = "page", transition = "publish")
 *     public ActionOutput onPublish(ActionInput input) {
 *         return ActionOutput.ofMetadata(Map.of("indexed", true));
 *     }
 * }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface TransitionHook {

    /**
     * Entity type the hook applies to; {@code "*"} matches any entity type.
     *
     * @return entity type (e.g., "page")
     */
    String entityType() default ActionRegistry.ANY_ENTITY_TYPE;

    /**
     * Transition name the hook runs after.
     *
     * @return transition name (e.g., "publish")
     */
    String transition();
}
