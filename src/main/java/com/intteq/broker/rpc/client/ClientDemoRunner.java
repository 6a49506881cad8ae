package com.intteq.broker.rpc.client;

import com.intteq.broker.rpc.envelope.EnvelopeCodec;
import com.intteq.broker.rpc.envelope.RpcResponse;
import com.intteq.broker.rpc.exception.RpcTimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Scripted conversation against a running worker, enabled with
 * {@code rpc.client.enabled=true} and {@code rpc.client.demo=true}.
 *
 * <p>Walks through health check, a simulated transient fault, registration, login,
 * task creation (including an idempotent repeat), listing, a v2 update and an unknown
 * action, logging every response.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "rpc.client", name = {"enabled", "demo"}, havingValue = "true")
public class ClientDemoRunner implements CommandLineRunner {

    static final String IDEMPOTENT_REQUEST_ID = "IDEMPOTENCY-DEMO-123";

    private final RpcClient client;
    private final EnvelopeCodec codec;

    @Override
    public void run(String... args) {
        show("health_check", () -> client.call("v1", "health_check", Map.of(), ""));
        show("simulated retry", () -> client.call("v1", "health_check", Map.of("simulate_temp_error", true), ""));

        String email = "student_" + UUID.randomUUID().toString().substring(0, 6) + "@example.com";
        String password = "qwerty123";

        show("register", () -> client.call("v1", "register",
                Map.of("email", email, "password", password, "full_name", "Demo Student"), ""));

        Optional<RpcResponse> login = show("login", () -> client.call("v1", "login",
                Map.of("email", email, "password", password), ""));
        String token = login.filter(RpcResponse::isOk)
                .map(r -> String.valueOf(((Map<?, ?>) r.data()).get("access_token")))
                .orElse(null);
        if (token == null) {
            log.warn("No token, stopping the demo");
            return;
        }

        Map<String, Object> first = new HashMap<>();
        first.put("title", "Buy milk");
        first.put("description", "demo task");
        first.put("due_date", null);
        Optional<RpcResponse> created = show("create_task v1", () -> client.call("v1", "create_task", first, token));

        Map<String, Object> idem = Map.of("title", "Idem task", "description", "should not duplicate");
        show("create_task (idempotent #1)", () -> client.call("v1", "create_task", idem, token,
                client.defaultTimeout(), IDEMPOTENT_REQUEST_ID));
        show("create_task (idempotent #2)", () -> client.call("v1", "create_task", idem, token,
                client.defaultTimeout(), IDEMPOTENT_REQUEST_ID));

        show("list_tasks", () -> client.call("v1", "list_tasks", Map.of(), token));

        created.filter(RpcResponse::isOk)
                .map(r -> ((Map<?, ?>) r.data()).get("id"))
                .ifPresent(taskId -> show("update_task v2", () -> client.call("v2", "update_task",
                        Map.of("task_id", taskId, "priority", "high", "status", "in_progress"), token)));

        show("unknown action", () -> client.call("v1", "abracadabra", Map.of(), token));
    }

    private Optional<RpcResponse> show(String label, Supplier<RpcResponse> call) {
        try {
            RpcResponse response = call.get();
            log.info("{}: {}", label, codec.encodeResponseAsString(response));
            return Optional.of(response);
        } catch (RpcTimeoutException e) {
            log.warn("{}: {}", label, e.getMessage());
            return Optional.empty();
        }
    }
}
