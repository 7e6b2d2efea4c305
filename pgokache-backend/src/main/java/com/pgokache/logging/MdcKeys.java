package com.pgokache.logging;

/**
 * MDC keys printed by the console pattern in {@code logback-spring.xml}.
 */
public final class MdcKeys {
    /** Per-request id, echoed in the {@code X-Request-Id} response header. */
    public static final String TRACE_ID = "trace_id";
    /** Instance being worked on, by the scheduler or an {@code /v1/instances/{id}} request. */
    public static final String INSTANCE_ID = "instance_id";

    private MdcKeys() {
    }
}
