package com.astrazeneca.structhunt.data;

import java.util.Objects;

/**
 * Entry of the failure list reported after aggregation.
 */
public class PartitionFailure {
    public final String partitionId;
    public final String errorText;

    public PartitionFailure(String partitionId, String errorText) {
        this.partitionId = partitionId;
        this.errorText = errorText;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PartitionFailure that = (PartitionFailure) o;
        return Objects.equals(partitionId, that.partitionId) &&
                Objects.equals(errorText, that.errorText);
    }

    @Override
    public int hashCode() {
        return Objects.hash(partitionId, errorText);
    }

    @Override
    public String toString() {
        return partitionId + ": " + errorText;
    }
}
