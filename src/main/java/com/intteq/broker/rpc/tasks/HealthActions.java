package com.intteq.broker.rpc.tasks;

import com.intteq.broker.rpc.annotation.RpcAction;
import com.intteq.broker.rpc.annotation.RpcController;
import com.intteq.broker.rpc.dispatch.HandlerResult;
import com.intteq.broker.rpc.dispatch.Principal;

import java.util.Map;

@RpcController(description = "Liveness probe")
public class HealthActions {

    @RpcAction(value = "health_check", authenticated = false)
    public HandlerResult healthCheck(Principal principal, String version, Map<String, Object> data) {
        return HandlerResult.ok(Map.of("status", "ok"));
    }
}
