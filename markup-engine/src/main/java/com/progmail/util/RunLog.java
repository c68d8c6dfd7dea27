package com.progmail.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-run message collaborator. Everything is forwarded to {@link LoggingUtil};
 * error-level messages are also kept so they can be shown together once the
 * run has finished.
 */
public class RunLog {

    private final List<String> errors = new ArrayList<>();

    public void debug(String message) {
        LoggingUtil.debug(message);
    }

    public void info(String message) {
        LoggingUtil.info(message);
    }

    public void warn(String message) {
        LoggingUtil.warn(message);
    }

    /**
     * Log a non-fatal error and remember it for {@link #displayErrorsIfAny()}.
     */
    public void error(String message) {
        errors.add(message);
        LoggingUtil.error(message);
    }

    /**
     * Log a fatal condition. Fatal messages are not accumulated; the run stops right after.
     */
    public void fatal(String message) {
        LoggingUtil.error(message);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    /**
     * Report the accumulated errors in one block and clear them.
     *
     * @return the errors that were reported
     */
    public List<String> displayErrorsIfAny() {
        if (errors.isEmpty()) {
            return List.of();
        }
        List<String> drained = new ArrayList<>(errors);
        errors.clear();

        StringBuilder sb = new StringBuilder();
        sb.append(drained.size()).append(drained.size() == 1 ? " error" : " errors")
                .append(" reported during this run:");
        for (String error : drained) {
            sb.append(System.lineSeparator()).append("  ").append(error);
        }
        LoggingUtil.error(sb.toString());
        return drained;
    }
}
