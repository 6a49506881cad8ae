package com.intteq.broker.rpc.internal;

import com.intteq.broker.rpc.annotation.RpcAction;
import com.intteq.broker.rpc.annotation.RpcController;
import com.intteq.broker.rpc.dispatch.ActionDispatcher;
import com.intteq.broker.rpc.dispatch.HandlerResult;
import com.intteq.broker.rpc.dispatch.Principal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.support.AopUtils;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.context.ApplicationContext;
import org.springframework.core.annotation.AnnotationUtils;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Map;

/**
 * Registers every {@link RpcAction} method of every {@link RpcController} bean with the
 * {@link ActionDispatcher}.
 *
 * <p>Runs once all singletons are initialized, before lifecycle beans (the worker)
 * are started, so no request is consumed before its handler is known.
 */
@Slf4j
@RequiredArgsConstructor
public class RpcActionRegistrar implements SmartInitializingSingleton {

    private final ApplicationContext context;
    private final ActionDispatcher dispatcher;

    // =====================================================================
    // INITIALIZATION
    // =====================================================================

    @Override
    public void afterSingletonsInstantiated() {
        log.info("Registering RPC actions...");

        context.getBeansWithAnnotation(RpcController.class)
                .values()
                .forEach(this::registerControllerBean);

        log.info("Registered {} RPC actions", dispatcher.registeredActions().size());
    }

    // =====================================================================
    // BEAN DISCOVERY
    // =====================================================================

    void registerControllerBean(Object bean) {
        Class<?> clazz = AopUtils.getTargetClass(bean);

        for (Method method : clazz.getDeclaredMethods()) {

            RpcAction action = AnnotationUtils.findAnnotation(method, RpcAction.class);
            if (action == null) {
                continue;
            }

            validateHandlerSignature(clazz, method);

            MethodActionHandler handler = new MethodActionHandler(bean, method);
            for (String version : action.versions()) {
                dispatcher.register(version, action.value(), handler, action.authenticated());
            }
        }
    }

    // =====================================================================
    // VALIDATION
    // =====================================================================

    private void validateHandlerSignature(Class<?> clazz, Method method) {
        Class<?>[] params = method.getParameterTypes();
        boolean valid = Modifier.isPublic(method.getModifiers())
                && params.length == 3
                && params[0] == Principal.class
                && params[1] == String.class
                && params[2] == Map.class
                && method.getReturnType() == HandlerResult.class;

        if (!valid) {
            throw new IllegalStateException(
                    "Invalid @RpcAction signature: "
                            + clazz.getName() + "#" + method.getName()
                            + " - expected public HandlerResult (Principal, String, Map<String, Object>)"
            );
        }
    }
}
