package com.astrazeneca.structhunt.data;

/**
 * Classes of secondary structure motifs handled by the pipeline.
 */
public enum MotifClass {
    /**
     * Four G runs separated by short loops, found by the sequence scanner
     */
    QUADRUPLEX_REPEAT("G4"),
    /**
     * Z-DNA like windows reported by the external predictor
     */
    ALTERNATIVE_STRUCTURE("ZDNA");

    public final String label;

    MotifClass(String label) {
        this.label = label;
    }
}
