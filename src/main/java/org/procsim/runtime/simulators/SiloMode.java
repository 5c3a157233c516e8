package org.procsim.runtime.simulators;

/**
 * Phase of the silo fill cycle.
 */
public enum SiloMode {
    EMPTYING,
    REFILLING
}
