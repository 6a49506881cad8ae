package com.intteq.broker.rpc.dispatch;

import com.intteq.broker.rpc.exception.AuthenticationException;

/**
 * Resolves the opaque credential of a request to a {@link Principal}.
 */
public interface Authenticator {

    /**
     * @param credential the request's {@code auth} field, never blank
     * @return the authenticated principal
     * @throws AuthenticationException if the credential is invalid, expired, or names an
     *                                 unknown user; any other exception is treated as a
     *                                 transient failure
     */
    Principal resolve(String credential);
}
