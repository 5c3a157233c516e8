package org.procsim.node.registry;

/**
 * Thrown when the registry cannot create an instance: unknown class tag, duplicate id,
 * malformed construction arguments or a failing constructor.
 */
public class InstanceCreationException extends RuntimeException {

    public InstanceCreationException(String message) {
        super(message);
    }

    public InstanceCreationException(String message, Throwable cause) {
        super(message, cause);
    }
}
