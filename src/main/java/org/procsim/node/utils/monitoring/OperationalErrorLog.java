package org.procsim.node.utils.monitoring;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;

import org.procsim.node.api.resources.OperationalError;

/**
 * Bounded, thread-safe collection of {@link OperationalError}s.
 * <p>
 * When the capacity is exceeded the oldest errors are dropped.
 */
public class OperationalErrorLog {

    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();
    private final int maxErrors;

    public OperationalErrorLog(int maxErrors) {
        if (maxErrors <= 0) {
            throw new IllegalArgumentException("maxErrors must be positive: " + maxErrors);
        }
        this.maxErrors = maxErrors;
    }

    public void record(String code, String message, String details) {
        errors.add(new OperationalError(Instant.now(), code, message, details));
        while (errors.size() > maxErrors) {
            errors.pollFirst();
        }
    }

    public List<OperationalError> snapshot() {
        return new ArrayList<>(errors);
    }

    public void clear() {
        errors.clear();
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    public int size() {
        return errors.size();
    }
}
