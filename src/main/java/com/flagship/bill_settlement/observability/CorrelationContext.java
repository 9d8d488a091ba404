package com.flagship.bill_settlement.observability;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Per-thread correlation id for one settlement request.
 *
 * A caller-supplied id is kept only when it is 1 to 64 letters, digits or
 * hyphens, so it can go into log lines and response headers as is. Anything
 * else is replaced by a fresh id.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String RECEIPT_ID_MDC_KEY = "receiptId";

    private static final Pattern WELL_FORMED_ID = Pattern.compile("[A-Za-z0-9-]{1,64}");

    private static final ThreadLocal<String> current = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Binds the caller's id to this thread if it is well formed, a new one otherwise.
     *
     * @return the id now bound
     */
    public static String bind(String requestedId) {
        String id = isWellFormed(requestedId) ? requestedId : newId();
        current.set(id);
        return id;
    }

    /**
     * The id bound to this thread, or null outside a request.
     */
    public static String current() {
        return current.get();
    }

    private static boolean isWellFormed(String id) {
        return id != null && WELL_FORMED_ID.matcher(id).matches();
    }

    public static void clear() {
        current.remove();
    }

    private static String newId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
