package com.astrazeneca.structhunt.data;

import com.astrazeneca.structhunt.exception.ConfigurationException;

import java.util.Arrays;

/**
 * Column layout of the predictor final output. Lines are whitespace separated, columns are 0-based indexes.
 * The layout differs between predictor builds, so every column is configurable.
 */
public class PredictorOutputFormat {
    /**
     * Layout of "position score1 score2 qualityMetric [sequenceText]"
     */
    public static final PredictorOutputFormat DEFAULT = new PredictorOutputFormat(0, 3, new int[]{1, 2}, 4,
            4, 5, true, 12);

    public final int positionColumn;
    public final int metricColumn;
    public final int[] auxColumns;

    /**
     * Column with the window bases, -1 when the layout has none
     */
    public final int sequenceColumn;
    public final int minColumns;
    public final int maxColumns;

    /**
     * Positions in the file start from 1 and are shifted to 0-based on parse
     */
    public final boolean oneBasedPositions;

    /**
     * Span assigned to a record without sequence text
     */
    public final int windowLength;

    public PredictorOutputFormat(int positionColumn, int metricColumn, int[] auxColumns, int sequenceColumn,
                                 int minColumns, int maxColumns, boolean oneBasedPositions, int windowLength) {
        this.positionColumn = positionColumn;
        this.metricColumn = metricColumn;
        this.auxColumns = auxColumns.clone();
        this.sequenceColumn = sequenceColumn;
        this.minColumns = minColumns;
        this.maxColumns = maxColumns;
        this.oneBasedPositions = oneBasedPositions;
        this.windowLength = windowLength;
    }

    public boolean hasSequenceColumn() {
        return sequenceColumn >= 0;
    }

    /**
     * Checks that every declared column fits into the accepted column count range.
     * @throws ConfigurationException if the layout is inconsistent
     */
    public void validate() {
        if (positionColumn < 0 || metricColumn < 0) {
            throw new ConfigurationException("predictor columns", "position and metric columns must be set");
        }
        if (minColumns < 1 || maxColumns < minColumns) {
            throw new ConfigurationException("predictor columns", "column count range " + minColumns + "-"
                    + maxColumns + " is empty");
        }
        int required = Math.max(positionColumn, metricColumn);
        for (int aux : auxColumns) {
            if (aux < 0) {
                throw new ConfigurationException("predictor columns", "negative aux column " + aux);
            }
            required = Math.max(required, aux);
        }
        if (required >= minColumns) {
            throw new ConfigurationException("predictor columns", "column " + (required + 1)
                    + " is required but lines may have only " + minColumns + " columns");
        }
        if (sequenceColumn >= maxColumns) {
            throw new ConfigurationException("predictor columns", "sequence column " + (sequenceColumn + 1)
                    + " is after the last accepted column " + maxColumns);
        }
        if (windowLength < 1) {
            throw new ConfigurationException("predictor window", "must be positive, got " + windowLength);
        }
    }

    @Override
    public String toString() {
        return "PredictorOutputFormat [position=" + positionColumn + ", metric=" + metricColumn
                + ", aux=" + Arrays.toString(auxColumns) + ", sequence=" + sequenceColumn
                + ", columns=" + minColumns + "-" + maxColumns + ", oneBased=" + oneBasedPositions
                + ", window=" + windowLength + "]";
    }
}
