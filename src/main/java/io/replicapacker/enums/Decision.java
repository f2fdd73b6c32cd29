package io.replicapacker.enums;

/**
 * Placement decision result.
 */
public enum Decision {
    YES, NO
}
