package com.astrazeneca.structhunt.printers;

import com.astrazeneca.structhunt.data.ColocalizationPair;
import com.astrazeneca.structhunt.data.GenomicInterval;
import htsjdk.samtools.util.Locatable;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Writes the distinct genes hit by overlap pairs, one id per line.
 */
public class GeneListWriter {

    public static SortedSet<String> geneIds(Collection<? extends ColocalizationPair<? extends Locatable, GenomicInterval>> pairs) {
        SortedSet<String> ids = new TreeSet<>();
        for (ColocalizationPair<? extends Locatable, GenomicInterval> pair : pairs) {
            ids.add(pair.refB.name);
        }
        return ids;
    }

    public static void write(Path file, Collection<? extends ColocalizationPair<? extends Locatable, GenomicInterval>> pairs)
            throws IOException {
        Files.write(file, new ArrayList<>(geneIds(pairs)), StandardCharsets.UTF_8);
    }
}
