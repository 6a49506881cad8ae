package com.intteq.broker.rpc.dispatch;

import com.intteq.broker.rpc.envelope.RpcHeaders;
import com.intteq.broker.rpc.envelope.RpcRequest;
import com.intteq.broker.rpc.envelope.RpcResponse;
import com.intteq.broker.rpc.exception.AuthenticationException;
import com.intteq.broker.rpc.exception.SimulatedFaultException;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Routes a request to the handler registered for its {@code (version, action)}.
 *
 * <p>Order of checks:
 * <ol>
 *     <li>simulated fault, when enabled (throws)</li>
 *     <li>required envelope fields</li>
 *     <li>credential, unless the pair is registered as unauthenticated</li>
 *     <li>handler lookup</li>
 * </ol>
 *
 * <p>Every rejection is returned as an error response and is permanent. Exceptions
 * from the authenticator (other than {@link AuthenticationException}) and from the
 * handler propagate; the caller treats them as transient.
 */
@Slf4j
public class ActionDispatcher {

    static final String SIMULATE_FLAG = "simulate_temp_error";

    private final Authenticator authenticator;
    private final boolean simulatedFaultsEnabled;
    private final Map<ActionKey, Registration> handlers = new ConcurrentHashMap<>();

    public ActionDispatcher(Authenticator authenticator, boolean simulatedFaultsEnabled) {
        this.authenticator = authenticator;
        this.simulatedFaultsEnabled = simulatedFaultsEnabled;
    }

    /**
     * Register a handler.
     *
     * @param authenticated whether the pair requires a resolvable credential
     * @throws IllegalStateException if the pair already has a handler
     */
    public void register(String version, String action, ActionHandler handler, boolean authenticated) {
        ActionKey key = new ActionKey(version, action);
        Registration previous = handlers.putIfAbsent(key, new Registration(handler, authenticated));
        if (previous != null) {
            throw new IllegalStateException("Duplicate handler for action " + key);
        }
        log.info("Registered action {} (authenticated={})", key, authenticated);
    }

    public Set<ActionKey> registeredActions() {
        return Collections.unmodifiableSet(handlers.keySet());
    }

    public RpcResponse dispatch(RpcRequest request) {
        if (simulatedFaultsEnabled && Boolean.TRUE.equals(request.data().get(SIMULATE_FLAG))) {
            throw new SimulatedFaultException("Simulated temporary error");
        }

        String id = request.id();
        if (isBlank(id) || isBlank(request.version()) || isBlank(request.action())) {
            return RpcResponse.error(isBlank(id) ? RpcHeaders.UNKNOWN_ID : id,
                    "Missing required fields: id/version/action");
        }

        ActionKey key = new ActionKey(request.version(), request.action());
        Registration registration = handlers.get(key);

        Principal principal = null;
        if (registration == null || registration.authenticated()) {
            if (isBlank(request.auth())) {
                return RpcResponse.error(id, "auth (JWT token) required for this action");
            }
            try {
                principal = authenticator.resolve(request.auth());
            } catch (AuthenticationException e) {
                log.debug("Rejected credential for {} {}: {}", id, key, e.getMessage());
                return RpcResponse.error(id, e.getMessage());
            }
        }

        if (registration == null) {
            return RpcResponse.error(id, "Unknown action: " + key);
        }

        HandlerResult result = registration.handler().handle(principal, request.version(), request.data());
        if (result == null) {
            throw new IllegalStateException("Handler for " + key + " returned no result");
        }
        return result.toResponse(id);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record Registration(ActionHandler handler, boolean authenticated) {
    }
}
