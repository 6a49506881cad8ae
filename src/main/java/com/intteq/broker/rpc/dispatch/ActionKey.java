package com.intteq.broker.rpc.dispatch;

/**
 * Routing key of a handler: API version plus action name.
 */
public record ActionKey(String version, String action) {

    @Override
    public String toString() {
        return version + "." + action;
    }
}
