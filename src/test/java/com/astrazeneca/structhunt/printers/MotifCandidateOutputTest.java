package com.astrazeneca.structhunt.printers;

import com.astrazeneca.structhunt.data.AlternativeStructureMetadata;
import com.astrazeneca.structhunt.data.ColocalizationPair;
import com.astrazeneca.structhunt.data.GenomicInterval;
import com.astrazeneca.structhunt.data.MotifCandidate;
import com.astrazeneca.structhunt.data.MotifClass;
import com.astrazeneca.structhunt.data.QuadruplexMetadata;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;

import static org.testng.Assert.assertEquals;

public class MotifCandidateOutputTest {
    private RecordPrinter printer = new SystemOutRecordPrinter();
    private ByteArrayOutputStream outContent;

    @BeforeMethod
    public void setUpStreams() {
        outContent = new ByteArrayOutputStream();
        printer.setOut(new PrintStream(outContent));
    }

    @AfterMethod
    public void cleanUpStreams() throws IOException {
        outContent.close();
    }

    private String printed() {
        return outContent.toString().trim();
    }

    @Test
    public void testQuadruplexColumns() {
        MotifCandidate candidate = new MotifCandidate("chr1", 10, 31, "GGGAAAGGGAAAGGGAAAGGG",
                MotifClass.QUADRUPLEX_REPEAT, 112.142857, new QuadruplexMetadata(3, 0.5714, 0.5714));

        printer.print(new MotifCandidateOutput(candidate));

        assertEquals(printed(), "chr1\t10\t31\t21\t112.14\tGGGAAAGGGAAAGGGAAAGGG\t3\t0.5714\t0.5714");
        assertEquals(MotifCandidateOutput.header(MotifClass.QUADRUPLEX_REPEAT, 2).split("\t").length,
                printed().split("\t").length);
    }

    @Test
    public void testStructureColumns() {
        MotifCandidate candidate = new MotifCandidate("chr2", 100, 112, "", MotifClass.ALTERNATIVE_STRUCTURE,
                350.5, new AlternativeStructureMetadata(350.5, new double[]{12.25, 3}));

        printer.print(new MotifCandidateOutput(candidate));

        assertEquals(printed(), "chr2\t100\t112\t12\t350.5\t.\t350.5\t12.25\t3");
        assertEquals(MotifCandidateOutput.header(MotifClass.ALTERNATIVE_STRUCTURE, 2).split("\t").length,
                printed().split("\t").length);
    }

    @Test
    public void testBedRow() {
        MotifCandidate candidate = new MotifCandidate("chr2", 100, 112, "", MotifClass.ALTERNATIVE_STRUCTURE,
                350, new AlternativeStructureMetadata(350, new double[0]));

        printer.print(new BedOutput(candidate));

        assertEquals(printed(), "chr2\t100\t112\tZDNA\t350\t.");
    }

    @Test
    public void testPairRows() {
        MotifCandidate quadruplex = new MotifCandidate("chr1", 1000, 1015, "", MotifClass.QUADRUPLEX_REPEAT, 90,
                new QuadruplexMetadata(3, 0.8, 0.8));
        MotifCandidate structure = new MotifCandidate("chr1", 1400, 1404, "CGCG", MotifClass.ALTERNATIVE_STRUCTURE,
                320.75, new AlternativeStructureMetadata(320.75, new double[0]));
        GenomicInterval gene = new GenomicInterval("chr1", 990, 5000, "ENSG01");

        OutputRecord pair = new ColocalizationPairOutput(new ColocalizationPair<>("chr1", 1000, 1400, 400,
                quadruplex, structure));
        pair.setDelimiter(",");
        printer.print(pair);
        printer.print(new RegionOverlapOutput(new ColocalizationPair<>("chr1", 1000, 990, 15, quadruplex, gene)));

        String[] lines = printed().split("\n");
        assertEquals(lines[0].trim(), "chr1,1000,1400,400,.,CGCG,320.75");
        assertEquals(lines[1].trim(), "chr1\t1000\t1015\tENSG01\t990\t5000\t15");
        assertEquals(ColocalizationPairOutput.HEADER.split("\t").length, 7);
        assertEquals(RegionOverlapOutput.HEADER.split("\t").length, 7);
    }
}
