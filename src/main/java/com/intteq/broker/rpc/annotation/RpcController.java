package com.intteq.broker.rpc.annotation;

import org.springframework.stereotype.Component;

import java.lang.annotation.*;

/**
 * Marks a bean as a provider of RPC actions.
 *
 * <p>A controller class contains one or more {@link RpcAction} methods. Each of them
 * is registered with the dispatcher once all singletons are created, keyed by
 * {@code (version, action)}.
 *
 * <p>Example:
 * <pre>
 * {@code
 * @RpcController
 * public class TaskActions {
 *
 *     @RpcAction(value = "get_task", versions = {"v1", "v2"})
 *     public HandlerResult getTask(Principal principal, String version, Map<String, Object> data) {
 *         // look the task up...
 *     }
 * }
 * }
 * </pre>
 *
 * <p>The annotation is meta-annotated with {@link Component}, so controllers are picked
 * up by component scanning.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Component
public @interface RpcController {

    /**
     * Optional human-readable description for logs and documentation.
     */
    String description() default "";
}
