package com.intteq.broker.rpc.exception;

/**
 * Deliberate transient failure requested through {@code data.simulate_temp_error}.
 */
public class SimulatedFaultException extends RpcException {

    public SimulatedFaultException(String message) {
        super(message);
    }
}
