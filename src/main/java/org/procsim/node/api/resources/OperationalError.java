package org.procsim.node.api.resources;

import java.time.Instant;

/**
 * A transient error recorded by a monitorable component.
 *
 * @param timestamp when the error occurred.
 * @param code      machine-readable category, e.g. {@code "STORE_FAILED"}.
 * @param message   human-readable description.
 * @param details   additional context (ids, class names, causes).
 */
public record OperationalError(Instant timestamp, String code, String message, String details) {
}
