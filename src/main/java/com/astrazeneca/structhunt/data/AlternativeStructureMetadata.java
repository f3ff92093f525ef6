package com.astrazeneca.structhunt.data;

import java.util.Arrays;
import java.util.Objects;

public class AlternativeStructureMetadata implements MotifMetadata {
    /**
     * Quality metric the predictor output was filtered on (Z-score)
     */
    public final double qualityScore;

    /**
     * Remaining numeric columns of the predictor line, in file order
     */
    public final double[] auxScores;

    public AlternativeStructureMetadata(double qualityScore, double[] auxScores) {
        this.qualityScore = qualityScore;
        this.auxScores = auxScores.clone();
    }

    @Override
    public Object[] columns() {
        Object[] columns = new Object[auxScores.length + 1];
        columns[0] = qualityScore;
        for (int i = 0; i < auxScores.length; i++) {
            columns[i + 1] = auxScores[i];
        }
        return columns;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AlternativeStructureMetadata that = (AlternativeStructureMetadata) o;
        return Double.compare(that.qualityScore, qualityScore) == 0 &&
                Arrays.equals(auxScores, that.auxScores);
    }

    @Override
    public int hashCode() {
        return Objects.hash(qualityScore) * 31 + Arrays.hashCode(auxScores);
    }

    @Override
    public String toString() {
        return "AlternativeStructureMetadata [qualityScore=" + qualityScore + ", auxScores=" + Arrays.toString(auxScores) + "]";
    }
}
