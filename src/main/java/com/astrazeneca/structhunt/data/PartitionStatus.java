package com.astrazeneca.structhunt.data;

/**
 * Advisory progress state of one predictor run, derived from its artifact files.
 */
public enum PartitionStatus {
    STARTING,
    COMPUTING,
    COMPLETED
}
