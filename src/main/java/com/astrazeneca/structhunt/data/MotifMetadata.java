package com.astrazeneca.structhunt.data;

/**
 * Class specific values attached to a motif candidate.
 */
public interface MotifMetadata {
    /**
     * @return values of the class specific output columns, in print order
     */
    Object[] columns();
}
