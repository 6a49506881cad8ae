package com.intteq.broker.rpc.internal;

import com.intteq.broker.rpc.annotation.RpcAction;
import com.intteq.broker.rpc.annotation.RpcController;
import com.intteq.broker.rpc.dispatch.ActionDispatcher;
import com.intteq.broker.rpc.dispatch.ActionKey;
import com.intteq.broker.rpc.dispatch.HandlerResult;
import com.intteq.broker.rpc.dispatch.Principal;
import com.intteq.broker.rpc.envelope.RpcRequest;
import com.intteq.broker.rpc.envelope.RpcResponse;

import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.Mock;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.context.ApplicationContext;

import java.util.Map;
import java.util.Set;

@ExtendWith(MockitoExtension.class)
public class RpcActionRegistrarTest {

    @Mock
    private ApplicationContext context;

    private final ActionDispatcher dispatcher = new ActionDispatcher(credential -> new Principal(1L, "u"), false);

    @RpcController
    public static class EchoActions {

        @RpcAction(value = "ping", authenticated = false)
        public HandlerResult ping(Principal principal, String version, Map<String, Object> data) {
            return HandlerResult.ok(Map.of("pong", version));
        }

        @RpcAction(value = "echo", versions = {"v1", "v2"})
        public HandlerResult echo(Principal principal, String version, Map<String, Object> data) {
            return HandlerResult.ok(data);
        }

        @RpcAction("fail")
        public HandlerResult fail(Principal principal, String version, Map<String, Object> data) {
            throw new IllegalStateException("downstream timeout");
        }

        public HandlerResult notAnAction(Principal principal, String version, Map<String, Object> data) {
            return HandlerResult.ok(null);
        }
    }

    @RpcController
    public static class BadSignature {

        @RpcAction("oops")
        public String oops(Map<String, Object> data) {
            return "no";
        }
    }

    @Test
    public void registersEveryVersionOfEveryAction() {
        when(context.getBeansWithAnnotation(RpcController.class)).thenReturn(Map.of("echo", new EchoActions()));

        new RpcActionRegistrar(context, dispatcher).afterSingletonsInstantiated();

        Assertions.assertEquals(Set.of(
                new ActionKey("v1", "ping"),
                new ActionKey("v1", "echo"),
                new ActionKey("v2", "echo"),
                new ActionKey("v1", "fail")), dispatcher.registeredActions());
    }

    @Test
    public void registeredMethodIsInvoked() {
        new RpcActionRegistrar(context, dispatcher).registerControllerBean(new EchoActions());

        RpcResponse pong = dispatcher.dispatch(new RpcRequest("1", "v1", "ping", Map.of(), ""));
        RpcResponse echo = dispatcher.dispatch(new RpcRequest("2", "v2", "echo", Map.of("a", "b"), "token"));

        Assertions.assertEquals(Map.of("pong", "v1"), pong.data());
        Assertions.assertEquals(Map.of("a", "b"), echo.data());
    }

    @Test
    public void handlerExceptionIsUnwrapped() {
        new RpcActionRegistrar(context, dispatcher).registerControllerBean(new EchoActions());

        IllegalStateException e = Assertions.assertThrows(IllegalStateException.class,
                () -> dispatcher.dispatch(new RpcRequest("3", "v1", "fail", Map.of(), "token")));
        Assertions.assertEquals("downstream timeout", e.getMessage());
    }

    @Test
    public void invalidSignatureFailsStartup() {
        RpcActionRegistrar registrar = new RpcActionRegistrar(context, dispatcher);

        Assertions.assertThrows(IllegalStateException.class,
                () -> registrar.registerControllerBean(new BadSignature()));
    }
}
