package com.astrazeneca.structhunt.modules;

import com.astrazeneca.structhunt.data.MotifCandidate;
import com.astrazeneca.structhunt.data.MotifClass;
import com.astrazeneca.structhunt.data.Patterns;
import com.astrazeneca.structhunt.data.QuadruplexMetadata;
import com.astrazeneca.structhunt.data.Sequence;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Finds and scores quadruplex forming tandem repeats in a sequence. Stateless: one instance may be shared
 * between threads scanning different partitions.
 */
public class SequenceScanner {
    public static final char DEFAULT_REPEAT_BASE = 'G';

    /**
     * Runs needed for a quadruplex
     */
    static final int RUNS_IN_MOTIF = 4;

    /**
     * Average stretch length between runs above which the score is penalized
     */
    static final double LONG_LOOP_LENGTH = 5;
    static final double LONG_LOOP_PENALTY = 0.8;

    private final char repeatBase;

    public SequenceScanner() {
        this(DEFAULT_REPEAT_BASE);
    }

    public SequenceScanner(char repeatBase) {
        this.repeatBase = Character.toUpperCase(repeatBase);
    }

    /**
     * Scans the sequence once per run-length class k in [minRunLength, maxRunLength). Inside a class matches are
     * leftmost-first and non-overlapping; classes scan independently, so their candidates may overlap.
     * @param sequence sequence to scan, any case
     * @param minRunLength smallest run-length class
     * @param maxRunLength first run-length class not scanned
     * @param maxLoopLength maximal loop length between runs
     * @param minScore candidates scored below are dropped
     * @return candidates grouped by class, in match order inside a class
     */
    public List<MotifCandidate> scan(Sequence sequence, int minRunLength, int maxRunLength, int maxLoopLength,
                                     double minScore) {
        List<MotifCandidate> candidates = new ArrayList<>();
        if (sequence.bases.isEmpty()) {
            return candidates;
        }
        String bases = sequence.bases.toUpperCase(Locale.ROOT);

        for (int runLength = minRunLength; runLength < maxRunLength; runLength++) {
            // four runs and three loops of at least one base
            if (bases.length() < RUNS_IN_MOTIF * runLength + RUNS_IN_MOTIF - 1) {
                break;
            }
            jregex.Matcher matcher = Patterns.tandemRepeat(repeatBase, runLength, maxLoopLength).matcher(bases);
            while (matcher.find()) {
                int start = matcher.start();
                int end = matcher.end();
                String matched = bases.substring(start, end);
                double score = score(matched);
                if (score < minScore) {
                    continue;
                }
                candidates.add(new MotifCandidate(sequence.id, start, end, matched, MotifClass.QUADRUPLEX_REPEAT,
                        score, new QuadruplexMetadata(runLength, content(matched, repeatBase),
                        gcContent(matched))));
            }
        }
        return candidates;
    }

    /**
     * Scores a matched span: repeat base percentage, plus 10 per run and 5 per base of average run length when
     * there are at least four runs, times 0.8 if the stretches between runs average more than 5 bases.
     * Rounded half-even to 2 decimals.
     * @param text upper case matched text
     * @return motif score
     */
    public double score(String text) {
        if (text.isEmpty()) {
            return 0;
        }
        int repeatCount = 0;
        int runs = 0;
        int runBases = 0;
        int stretches = 0;
        int stretchBases = 0;
        char previous = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            boolean isRepeat = c == repeatBase;
            if (isRepeat) {
                repeatCount++;
                runBases++;
                if (i == 0 || previous != repeatBase) {
                    runs++;
                }
            } else {
                stretchBases++;
                if (i == 0 || previous == repeatBase) {
                    stretches++;
                }
            }
            previous = c;
        }

        double score = 100.0 * repeatCount / text.length();
        if (runs >= RUNS_IN_MOTIF) {
            score += 10.0 * runs + 5.0 * ((double) runBases / runs);
        }
        if (stretches > 0 && (double) stretchBases / stretches > LONG_LOOP_LENGTH) {
            score *= LONG_LOOP_PENALTY;
        }
        return new BigDecimal(score).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }

    static double content(String text, char base) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == base) {
                count++;
            }
        }
        return (double) count / text.length();
    }

    static double gcContent(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == 'G' || c == 'C') {
                count++;
            }
        }
        return (double) count / text.length();
    }
}
