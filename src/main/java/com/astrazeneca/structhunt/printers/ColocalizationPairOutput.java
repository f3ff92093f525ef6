package com.astrazeneca.structhunt.printers;

import com.astrazeneca.structhunt.data.ColocalizationPair;
import com.astrazeneca.structhunt.data.MotifCandidate;

import static com.astrazeneca.structhunt.Utils.getRoundedValueToPrint;
import static com.astrazeneca.structhunt.Utils.join;

/**
 * Colocalization table row: sequenceId positionA positionB distance sequenceTextA sequenceTextB auxScoreB
 */
public class ColocalizationPairOutput extends OutputRecord {
    public static final String HEADER = join("\t", "SequenceId", "PositionA", "PositionB", "Distance",
            "SequenceA", "SequenceB", "ScoreB");

    private final ColocalizationPair<MotifCandidate, MotifCandidate> pair;

    public ColocalizationPairOutput(ColocalizationPair<MotifCandidate, MotifCandidate> pair) {
        this.pair = pair;
    }

    @Override
    public String toString() {
        return join(delimiter,
                pair.sequenceId,
                pair.positionA,
                pair.positionB,
                pair.distance,
                text(pair.refA),
                text(pair.refB),
                getRoundedValueToPrint("0.00", pair.refB.score));
    }

    private static String text(MotifCandidate candidate) {
        return candidate.matchedText.isEmpty() ? "." : candidate.matchedText;
    }
}
