package com.intteq.broker.rpc.dispatch;

import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * Executes one {@code (version, action)} pair.
 *
 * <p>Implementations own their side effects and must apply them atomically: commit on
 * return, leave nothing behind when throwing. A thrown exception is treated as a
 * transient failure and the request is retried.
 */
@FunctionalInterface
public interface ActionHandler {

    /**
     * @param principal the caller, or null for unauthenticated actions
     * @param version   the requested API version
     * @param data      the request arguments
     */
    HandlerResult handle(@Nullable Principal principal, String version, Map<String, Object> data);
}
