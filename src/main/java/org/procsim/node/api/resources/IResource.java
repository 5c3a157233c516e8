package org.procsim.node.api.resources;

/**
 * Base interface for all resources managed by the node (record stores and similar
 * shared infrastructure).
 * <p>
 * Implementations must provide a public constructor with the signature
 * {@code (String name, com.typesafe.config.Config options)} so that the node can
 * instantiate them from configuration.
 */
public interface IResource {

    /**
     * Returns the configured name of this resource instance.
     *
     * @return the resource name, never {@code null}.
     */
    String getResourceName();
}
