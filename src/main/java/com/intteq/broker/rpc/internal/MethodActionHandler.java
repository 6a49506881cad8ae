package com.intteq.broker.rpc.internal;

import com.intteq.broker.rpc.dispatch.ActionHandler;
import com.intteq.broker.rpc.dispatch.HandlerResult;
import com.intteq.broker.rpc.dispatch.Principal;
import org.springframework.lang.Nullable;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Map;

/**
 * {@link ActionHandler} invoking an {@code @RpcAction} method on its bean.
 *
 * <p>The bean is the container-managed instance (possibly a proxy), so transactional
 * and other advice applies.
 */
record MethodActionHandler(Object bean, Method method) implements ActionHandler {

    @Override
    public HandlerResult handle(@Nullable Principal principal, String version, Map<String, Object> data) {
        try {
            return (HandlerResult) method.invoke(bean, principal, version, data);
        } catch (InvocationTargetException e) {
            Throwable target = e.getTargetException();
            if (target instanceof RuntimeException) {
                throw (RuntimeException) target;
            }
            if (target instanceof Error) {
                throw (Error) target;
            }
            throw new IllegalStateException("Action method " + describe() + " failed", target);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Action method " + describe() + " is not accessible", e);
        }
    }

    private String describe() {
        return method.getDeclaringClass().getSimpleName() + "#" + method.getName();
    }
}
