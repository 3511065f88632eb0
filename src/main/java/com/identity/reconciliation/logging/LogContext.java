package com.identity.reconciliation.logging;

import com.identity.reconciliation.core.model.ChangeRow;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and automatically removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forRow("identities", row)) {
 *     log.info("identity_id {}/{} nothing changed", id, uuid);
 * } // MDC entries are automatically cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String RUN_ID = "runId";
    public static final String PHASE = "phase";
    public static final String LINE = "line";
    public static final String IDENTITY_ID = "identityId";

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a whole run.
     */
    public static LogContext forRun(String runId) {
        LogContext ctx = new LogContext();
        ctx.put(RUN_ID, runId);
        return ctx;
    }

    /**
     * Creates a log context for one change row of a phase.
     */
    public static LogContext forRow(String phase, ChangeRow row) {
        LogContext ctx = new LogContext();
        ctx.put(PHASE, phase);
        ctx.put(LINE, String.valueOf(row.lineNumber()));
        String identityId = row.trimmed("identity_id");
        if (!identityId.isEmpty()) {
            ctx.put(IDENTITY_ID, identityId);
        }
        return ctx;
    }

    /**
     * Generates a unique run ID.
     */
    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
