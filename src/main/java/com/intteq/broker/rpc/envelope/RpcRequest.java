package com.intteq.broker.rpc.envelope;

import java.util.Collections;
import java.util.Map;

/**
 * Request envelope published by clients onto the requests queue.
 *
 * <p>{@code id} identifies the logical operation. Reusing an id is how a client asks
 * for an idempotent retry: the worker replays the response recorded for it instead of
 * executing the action again.
 *
 * @param id      unique operation id, echoed as the response correlation id
 * @param version API version, e.g. {@code v1}
 * @param action  action name, e.g. {@code create_task}
 * @param data    action arguments, never null
 * @param auth    opaque bearer credential, empty for unauthenticated actions
 */
public record RpcRequest(
        String id,
        String version,
        String action,
        Map<String, Object> data,
        String auth
) {

    public RpcRequest {
        data = data != null ? data : Collections.emptyMap();
        auth = auth != null ? auth : "";
    }

    /**
     * @return {@code version.action}, the form used in logs and error messages
     */
    public String route() {
        return version + "." + action;
    }
}
