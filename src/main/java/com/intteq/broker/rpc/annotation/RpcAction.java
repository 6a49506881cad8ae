package com.intteq.broker.rpc.annotation;

import java.lang.annotation.*;

/**
 * Marks a method of an {@link RpcController} as the handler of an action.
 *
 * <p>Required signature:
 * <pre>
 * {@code
 * public HandlerResult anyName(Principal principal, String version, Map<String, Object> data)
 * }
 * </pre>
 *
 * <p>Notes:
 * <ul>
 *   <li>{@link #value()} is the action name; the method is registered once per entry
 *       of {@link #versions()}.</li>
 *   <li>Returning {@code HandlerResult.error(..)} is a business error: permanent, not
 *       retried, and recorded so that repeats replay it.</li>
 *   <li>Throwing is a transient failure: the request is retried with broker delay and
 *       dead-lettered once retries are exhausted.</li>
 * </ul>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface RpcAction {

    /**
     * The action name, e.g. {@code "create_task"}.
     */
    String value();

    /**
     * API versions served by this method.
     *
     * <p>Default: {@code {"v1"}}.
     */
    String[] versions() default {"v1"};

    /**
     * Whether the request must carry a credential that resolves to a principal.
     * Unauthenticated actions receive a null principal.
     *
     * <p>Default: {@code true}.
     */
    boolean authenticated() default true;
}
