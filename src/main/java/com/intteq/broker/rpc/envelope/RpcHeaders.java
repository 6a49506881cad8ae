package com.intteq.broker.rpc.envelope;

import org.springframework.amqp.core.MessageProperties;

/**
 * Transport metadata carried in AMQP message properties rather than in the JSON body.
 */
public final class RpcHeaders {

    /** Number of transient failures a request has already gone through. */
    public static final String RETRY_COUNT = "x-retry-count";

    /** Correlation id used when a request could not even be parsed for its id. */
    public static final String UNKNOWN_ID = "unknown";

    private RpcHeaders() {
    }

    /**
     * Read the retry counter. Absent or unreadable values count as zero.
     */
    public static int retryCount(MessageProperties properties) {
        Object value = properties.getHeaders().get(RETRY_COUNT);
        if (value instanceof Number) {
            return Math.max(((Number) value).intValue(), 0);
        }
        if (value != null) {
            try {
                return Math.max(Integer.parseInt(value.toString().trim()), 0);
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }
}
