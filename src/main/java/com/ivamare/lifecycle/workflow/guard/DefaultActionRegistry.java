package com.ivamare.lifecycle.workflow.guard;

import com.ivamare.lifecycle.exception.ActionAlreadyRegisteredException;
import com.ivamare.lifecycle.workflow.WorkflowIdentifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.beans.factory.config.BeanPostProcessor;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default implementation of ActionRegistry.
 *
 * <p>Implements BeanPostProcessor to discover {@link TransitionHook} methods on
 * Spring beans, and seals itself once all singletons are instantiated.
 */
public class DefaultActionRegistry implements ActionRegistry, BeanPostProcessor, SmartInitializingSingleton {

    private static final Logger log = LoggerFactory.getLogger(DefaultActionRegistry.class);

    private final Map<ActionKey, TransitionAction> actions = new ConcurrentHashMap<>();
    private volatile boolean sealed;

    @Override
    public synchronized void register(String entityType, String transitionName, TransitionAction action) {
        if (sealed) {
            throw new IllegalStateException("Action registry is sealed; cannot register "
                + entityType + "::" + transitionName);
        }
        if (WorkflowIdentifiers.isBlank(transitionName)) {
            throw new IllegalArgumentException("Transition name is required");
        }
        var key = keyOf(entityType, transitionName);
        if (actions.containsKey(key)) {
            throw new ActionAlreadyRegisteredException(key.entityType(), key.transitionName());
        }
        actions.put(key, action);
        log.debug("Registered action for {}", key);
    }

    @Override
    public Optional<TransitionAction> resolve(String entityType, String transitionName) {
        var action = actions.get(keyOf(entityType, transitionName));
        if (action == null) {
            action = actions.get(keyOf(ANY_ENTITY_TYPE, transitionName));
        }
        return Optional.ofNullable(action);
    }

    @Override
    public boolean hasAction(String entityType, String transitionName) {
        return actions.containsKey(keyOf(entityType, transitionName));
    }

    @Override
    public List<ActionKey> registeredActions() {
        return List.copyOf(actions.keySet());
    }

    @Override
    public List<ActionKey> registerBean(Object bean) {
        List<ActionKey> registered = new ArrayList<>();

        for (Method method : bean.getClass().getMethods()) {
            TransitionHook annotation = method.getAnnotation(TransitionHook.class);
            if (annotation == null) {
                continue;
            }

            validateHookMethod(method);

            TransitionAction action = input -> {
                try {
                    return (ActionOutput) method.invoke(bean, input);
                } catch (InvocationTargetException e) {
                    if (e.getCause() instanceof Exception cause) {
                        throw cause;
                    }
                    throw e;
                }
            };

            register(annotation.entityType(), annotation.transition(), action);
            var key = keyOf(annotation.entityType(), annotation.transition());
            registered.add(key);

            log.info("Discovered transition hook {}.{}() for {}",
                bean.getClass().getSimpleName(), method.getName(), key);
        }

        return registered;
    }

    @Override
    public void seal() {
        if (!sealed) {
            sealed = true;
            log.info("Action registry sealed with {} action(s)", actions.size());
        }
    }

    @Override
    public boolean isSealed() {
        return sealed;
    }

    /**
     * BeanPostProcessor callback - scans beans for @TransitionHook methods.
     */
    @Override
    public Object postProcessAfterInitialization(Object bean, String beanName) {
        boolean hasHooks = Arrays.stream(bean.getClass().getMethods())
            .anyMatch(m -> m.isAnnotationPresent(TransitionHook.class));

        if (hasHooks) {
            registerBean(bean);
        }

        return bean;
    }

    /**
     * Seals the registry once the application context has created every singleton.
     */
    @Override
    public void afterSingletonsInstantiated() {
        seal();
    }

    private static ActionKey keyOf(String entityType, String transitionName) {
        String type = WorkflowIdentifiers.normalize(entityType);
        return new ActionKey(type.isEmpty() ? ANY_ENTITY_TYPE : type, WorkflowIdentifiers.normalize(transitionName));
    }

    private void validateHookMethod(Method method) {
        Class<?>[] params = method.getParameterTypes();
        if (params.length != 1
            || !params[0].equals(ActionInput.class)
            || !ActionOutput.class.isAssignableFrom(method.getReturnType())) {

            throw new IllegalArgumentException(
                "Transition hook " + method.getName() + " must have signature: " +
                "ActionOutput methodName(ActionInput input)"
            );
        }
    }
}
