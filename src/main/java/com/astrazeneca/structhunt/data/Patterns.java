package com.astrazeneca.structhunt.data;

import java.util.regex.Pattern;

/**
 * Regex Patterns from all classes of StructHunt stored in one place.
 */
public class Patterns {
    /**
     * Nucleotides allowed inside quadruplex loops, ambiguity code included
     */
    public static final String LOOP_BASES = "ACGTN";

    //Predictor output patterns
    public static final Pattern WHITESPACES = Pattern.compile("\\s+");

    //Annotation patterns
    public static final Pattern TAB = Pattern.compile("\t");
    public static final Pattern GENE_ID_ATTRIBUTE = Pattern.compile("gene_id\\s+\"([^\"]*)\"");
    public static final Pattern GENE_NAME_ATTRIBUTE = Pattern.compile("gene_name\\s+\"([^\"]*)\"");
    public static final Pattern INTEGER_ONLY = Pattern.compile("^\\d+$");

    //Command line patterns
    public static final Pattern COLUMN_RANGE = Pattern.compile("^(\\d+)(?:-(\\d+))?$");

    /**
     * Builds the tandem repeat pattern for one run-length class: four runs of the repeat base, each at least
     * runLength long, separated by three loops of 1..maxLoopLength nucleotides.
     * @param repeatBase upper case repeat nucleotide
     * @param runLength minimum length of each run
     * @param maxLoopLength maximum length of each loop
     * @return compiled pattern
     */
    public static jregex.Pattern tandemRepeat(char repeatBase, int runLength, int maxLoopLength) {
        String run = repeatBase + "{" + runLength + ",}";
        String loop = "[" + LOOP_BASES + "]{1," + maxLoopLength + "}";
        return new jregex.Pattern(run + loop + run + loop + run + loop + run);
    }
}
