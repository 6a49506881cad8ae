package com.intteq.broker.rpc.dispatch;

/**
 * Authenticated caller of an action.
 *
 * @param userId id of the resolved user
 * @param name   display identity, typically the e-mail address
 */
public record Principal(long userId, String name) {
}
