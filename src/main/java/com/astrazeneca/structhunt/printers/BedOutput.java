package com.astrazeneca.structhunt.printers;

import com.astrazeneca.structhunt.data.MotifCandidate;
import com.astrazeneca.structhunt.data.MotifClass;

import static com.astrazeneca.structhunt.Utils.getRoundedValueToPrint;
import static com.astrazeneca.structhunt.Utils.join;

/**
 * BED6 row of a candidate. Quadruplex repeats are searched on the given strand only, predicted structures
 * have no strand.
 */
public class BedOutput extends OutputRecord {
    private final MotifCandidate candidate;

    public BedOutput(MotifCandidate candidate) {
        this.candidate = candidate;
    }

    @Override
    public String toString() {
        return join(delimiter,
                candidate.sequenceId,
                candidate.start,
                candidate.end,
                candidate.motifClass.label,
                getRoundedValueToPrint("0.00", candidate.score),
                candidate.motifClass == MotifClass.QUADRUPLEX_REPEAT ? "+" : ".");
    }
}
