package com.astrazeneca.structhunt.modules;

import com.astrazeneca.structhunt.data.ColocalizationPair;
import com.astrazeneca.structhunt.data.GeneAnnotation;
import com.astrazeneca.structhunt.data.GenomicInterval;
import com.astrazeneca.structhunt.data.MotifCandidate;
import com.astrazeneca.structhunt.data.MotifClass;
import com.astrazeneca.structhunt.data.QuadruplexMetadata;
import com.astrazeneca.structhunt.data.Strand;
import com.astrazeneca.structhunt.exception.MalformedLineException;
import com.astrazeneca.structhunt.exception.WrongInputException;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNull;

public class AnnotationReaderTest {

    @Test
    public void testTranscriptsAreRead() throws IOException {
        Path gtf = Files.createTempFile("annotation", ".gtf");
        Files.write(gtf, Arrays.asList(
                "#!genome-build GRCh38",
                "chr1\tHAVANA\tgene\t11869\t14409\t.\t+\t.\tgene_id \"ENSG01\"; gene_name \"DDX11L1\";",
                "chr1\tHAVANA\ttranscript\t11869\t14409\t.\t+\t.\tgene_id \"ENSG01\"; transcript_id \"T1\"; gene_name \"DDX11L1\";",
                "chr1\tHAVANA\ttranscript\t14404\t29570\t.\t-\t.\tgene_id \"ENSG02\"; transcript_id \"T2\";",
                "chr1\tHAVANA\ttranscript\t100\t200\t.\t.\t.\tgene_id \"ENSG03\";",
                "chr1\tHAVANA\ttranscript\t100\t200\t.\t+\t.\ttranscript_id \"T4\";",
                "chr1\tHAVANA\ttranscript\tstart\t200\t.\t+\t.\tgene_id \"ENSG05\";",
                "chr1\tHAVANA\ttranscript\t300"), StandardCharsets.US_ASCII);
        try {
            List<GeneAnnotation> annotations = new AnnotationReader().read(gtf);

            assertEquals(annotations.size(), 2);
            assertEquals(annotations.get(0),
                    new GeneAnnotation("chr1", 11868, 14409, Strand.FORWARD, "ENSG01", "DDX11L1"));
            assertEquals(annotations.get(1).strand, Strand.REVERSE);
            assertEquals(annotations.get(1).geneName, "ENSG02");
            assertEquals(annotations.get(1).transcriptionStartSite(), 29569);
        } finally {
            Files.delete(gtf);
        }
    }

    @Test
    public void testFirstBaseOfGeneAndPromoterOverlaps() {
        GeneAnnotation gene = new AnnotationReader().parseLine(
                "chr1\tsrc\ttranscript\t101\t200\t.\t+\t.\tgene_id \"G1\";", 1, "a.gtf");
        MotifCandidate touchingFirstBase = new MotifCandidate("chr1", 80, 101, "", MotifClass.QUADRUPLEX_REPEAT, 90,
                new QuadruplexMetadata(3, 0.8, 0.8));
        MotifCandidate beforeGene = new MotifCandidate("chr1", 70, 100, "", MotifClass.QUADRUPLEX_REPEAT, 90,
                new QuadruplexMetadata(3, 0.8, 0.8));
        ColocalizationEngine engine = new ColocalizationEngine();

        assertEquals(gene.start, 100);
        assertEquals(gene.end, 200);
        List<ColocalizationPair<MotifCandidate, GenomicInterval>> genes = engine.findOverlapping(
                Arrays.asList(touchingFirstBase, beforeGene), Collections.singletonList(gene.toInterval()));
        assertEquals(genes.size(), 1);
        assertEquals(genes.get(0).refA, touchingFirstBase);
        assertEquals(genes.get(0).distance, 1);

        // start site at 0-based 100, promoter [90, 106)
        GenomicInterval promoter = new PromoterBuilder(10, 5).promoter(gene);
        assertEquals(promoter, new GenomicInterval("chr1", 90, 106, "G1"));
        MotifCandidate promoterFirstBase = new MotifCandidate("chr1", 60, 91, "", MotifClass.QUADRUPLEX_REPEAT, 90,
                new QuadruplexMetadata(3, 0.8, 0.8));
        MotifCandidate beforePromoter = new MotifCandidate("chr1", 60, 90, "", MotifClass.QUADRUPLEX_REPEAT, 90,
                new QuadruplexMetadata(3, 0.8, 0.8));
        assertEquals(engine.findOverlapping(Arrays.asList(promoterFirstBase, beforePromoter),
                Collections.singletonList(promoter)).size(), 1);
    }

    @Test(expectedExceptions = MalformedLineException.class)
    public void testZeroStartIsMalformed() {
        new AnnotationReader().parseLine("chr1\tsrc\ttranscript\t0\t10\t.\t+\t.\tgene_id \"G\";", 1, "a.gtf");
    }

    @Test
    public void testOtherFeatureTypeIsIgnored() {
        assertNull(new AnnotationReader().parseLine("chr1\tsrc\texon\t1\t10\t.\t+\t.\tgene_id \"G\";", 1, "a.gtf"));
    }

    @Test(expectedExceptions = WrongInputException.class)
    public void testMissingFile() {
        new AnnotationReader().read(Paths.get("does", "not", "exist.gtf"));
    }
}
