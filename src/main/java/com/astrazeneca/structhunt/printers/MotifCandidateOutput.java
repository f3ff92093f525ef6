package com.astrazeneca.structhunt.printers;

import com.astrazeneca.structhunt.data.MotifCandidate;
import com.astrazeneca.structhunt.data.MotifClass;

import static com.astrazeneca.structhunt.Utils.getRoundedValueToPrint;
import static com.astrazeneca.structhunt.Utils.join;

/**
 * Motif candidate table row: sequenceId start end length score sequenceText classFields...
 */
public class MotifCandidateOutput extends OutputRecord {
    private final MotifCandidate candidate;

    public MotifCandidateOutput(MotifCandidate candidate) {
        this.candidate = candidate;
    }

    /**
     * @param motifClass class of the table
     * @param auxScores number of aux score columns of predicted structures
     */
    public static String header(MotifClass motifClass, int auxScores) {
        StringBuilder header = new StringBuilder(join("\t", "SequenceId", "Start", "End", "Length", "Score", "Sequence"));
        if (motifClass == MotifClass.QUADRUPLEX_REPEAT) {
            header.append("\t").append(join("\t", "GRunLength", "GContent", "GCContent"));
        } else {
            header.append("\tQualityScore");
            for (int i = 1; i <= auxScores; i++) {
                header.append("\tAuxScore").append(i);
            }
        }
        return header.toString();
    }

    @Override
    public String toString() {
        StringBuilder row = new StringBuilder(join(delimiter,
                candidate.sequenceId,
                candidate.start,
                candidate.end,
                candidate.length(),
                getRoundedValueToPrint("0.00", candidate.score),
                candidate.matchedText.isEmpty() ? "." : candidate.matchedText));
        for (Object field : candidate.metadata.columns()) {
            row.append(delimiter).append(field instanceof Double
                    ? getRoundedValueToPrint("0.0000", (Double) field)
                    : field);
        }
        return row.toString();
    }
}
