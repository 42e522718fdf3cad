package com.seqflow.pipelines;

import com.seqflow.core.ConfigurationException;
import com.seqflow.core.graph.TaskGraph;
import com.seqflow.core.target.LocalTarget;
import com.seqflow.core.target.Target;
import com.seqflow.core.task.ContainerTask;
import com.seqflow.core.task.DefaultTaskContext;
import com.seqflow.core.task.Task;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.seqflow.pipelines.PipelineFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class FetchPatricWorkflowTest {

    @TempDir
    Path dir;

    @Nested
    @DisplayName("graph")
    class Graph {

        private TaskGraph graph;

        @BeforeEach
        void build() {
            graph = factory(dir).fetchPatric(new FetchPatricWorkflow.Settings("s3://b/patric", null))
                    .build(sheet("83332.12", "83332.12", "511145.12", "511145.12"));
        }

        @Test
        void twoTransfersPerGenomeAndTwoSummaries() {
            assertEquals(6, graph.size());
            assertEquals(Set.of("extract_all_16S", "extract_all_annotations"),
                    Set.copyOf(names(graph.terminalTasks())));
        }

        @Test
        void transfersFetchFromTheGenomeFolder() {
            ContainerTask transcripts = container(graph, "fetch_patric_transcripts_83332.12");

            assertEquals("ftp://ftp.patricbrc.org/genomes/83332.12/83332.12.PATRIC.frn",
                    ((TransferFtpFile) transcripts).parameters().getString("ftp_url"));
            assertEquals("s3://b/patric/83332.12/transcripts.frn",
                    transcripts.outputs().get(TransferFtpFile.OUT_FILE).uri().toString());
            assertEquals("fetch_patric_transcripts_83332_12", transcripts.jobName());
            assertEquals(1000, transcripts.resources().memoryMb());
            assertEquals(List.of("wget", "-O", "/out/t.frn", "ftp://x/t.frn"), transcripts.command().render(Map.of(
                    "out_file", List.of("/out/t.frn"),
                    "ftp_url", List.of("ftp://x/t.frn"))));
        }

        @Test
        void annotationsPairWithTranscriptsInSheetOrder() {
            Task extract = task(graph, "extract_all_annotations");

            assertEquals(List.of("s3://b/patric/83332.12/transcripts.frn", "s3://b/patric/511145.12/transcripts.frn"),
                    inputUris(graph, extract, ExtractAnnotations.IN_TRANSCRIPTS));
            assertEquals(List.of("s3://b/patric/83332.12/annotation.tsv", "s3://b/patric/511145.12/annotation.tsv"),
                    inputUris(graph, extract, ExtractAnnotations.IN_ANNOTATIONS));
            assertEquals("s3://b/patric/annotations.tsv",
                    extract.outputs().get(ExtractAnnotations.OUT_TSV).uri().toString());
        }
    }

    @Test
    void customFtpRootDropsTrailingSlash() {
        var settings = new FetchPatricWorkflow.Settings("s3://b/patric", "ftp://mirror.example.org/patric/");

        assertEquals("ftp://mirror.example.org/patric", settings.ftpRoot());
        assertThrows(ConfigurationException.class,
                () -> new FetchPatricWorkflow.Settings("s3://b/patric", "https://example.org"));
    }

    @Nested
    @DisplayName("16S extraction")
    class SmallSubunits {

        @Test
        void keepsOnly16SRecordsKeyedByFirstHeaderToken() throws Exception {
            Target first = fasta("a.frn", """
                    >fig|83332.12.rna.1 16S ribosomal RNA
                    ACGT
                    ACGT
                    >fig|83332.12.rna.2 23S ribosomal RNA
                    TTTT
                    """);
            Target second = fasta("b.frn", """
                    >fig|511145.12.rna.7 SSU rRNA
                    GGCC
                    """);
            var task = new Extract16S("extract_all_16S", new LocalTarget(dir.resolve("transcripts.fasta")));

            task.run(context(task, Map.of(Extract16S.IN_TRANSCRIPTS, List.of(first, second))));

            assertEquals(">fig|83332.12.rna.1\nACGTACGT\n>fig|511145.12.rna.7\nGGCC\n",
                    Files.readString(dir.resolve("transcripts.fasta")));
        }

        @Test
        void duplicatedTranscriptIdFailsWithoutOutput() throws Exception {
            Target first = fasta("a.frn", ">rna.1 16S rRNA\nACGT\n");
            Target second = fasta("b.frn", ">rna.1 16S rRNA\nGGCC\n");
            var task = new Extract16S("extract_all_16S", new LocalTarget(dir.resolve("transcripts.fasta")));

            var e = assertThrows(InvalidGenomeDataException.class,
                    () -> task.run(context(task, Map.of(Extract16S.IN_TRANSCRIPTS, List.of(first, second)))));
            assertTrue(e.getMessage().contains("rna.1"));
            assertFalse(Files.exists(dir.resolve("transcripts.fasta")));
        }
    }

    @Nested
    @DisplayName("annotation matrix")
    class Annotations {

        @Test
        void everyTranscriptCarriesItsGenomeProductCounts() throws Exception {
            Target transcriptsA = fasta("a.frn", ">a.1 16S rRNA\nAC\n>a.2 16S rRNA\nAC\n>a.3 tRNA\nAC\n");
            Target transcriptsB = fasta("b.frn", ">b.1 SSU x\nGG\n");
            Target annotationsA = fasta("a.tsv", "genome_id\tproduct\n"
                    + "a\tDNA gyrase\n" + "a\tDNA gyrase\n" + "a\tRecA\n");
            Target annotationsB = fasta("b.tsv", "genome_id\tproduct\n" + "b\tFtsZ \"cell division\"\n");
            var task = new ExtractAnnotations("extract_all_annotations", new LocalTarget(dir.resolve("annotations.tsv")));

            task.run(context(task, Map.of(
                    ExtractAnnotations.IN_TRANSCRIPTS, List.of(transcriptsA, transcriptsB),
                    ExtractAnnotations.IN_ANNOTATIONS, List.of(annotationsA, annotationsB))));

            List<String> lines = Files.readAllLines(dir.resolve("annotations.tsv"));
            assertEquals(4, lines.size());
            assertTrue(lines.get(0).startsWith("transcript_id\tDNA gyrase\t"));
            assertTrue(lines.get(0).endsWith("\tRecA"));
            assertEquals("a.1\t2\t0\t1", lines.get(1));
            assertEquals("a.2\t2\t0\t1", lines.get(2));
            assertEquals("b.1\t0\t1\t0", lines.get(3));
        }

        @Test
        void missingProductColumnIsRejected() throws Exception {
            Target transcripts = fasta("a.frn", ">a.1 16S rRNA\nAC\n");
            Target annotations = fasta("a.tsv", "genome_id\tpathway\na\tglycolysis\n");
            var task = new ExtractAnnotations("extract_all_annotations", new LocalTarget(dir.resolve("annotations.tsv")));

            var e = assertThrows(InvalidGenomeDataException.class, () -> task.run(context(task, Map.of(
                    ExtractAnnotations.IN_TRANSCRIPTS, List.of(transcripts),
                    ExtractAnnotations.IN_ANNOTATIONS, List.of(annotations)))));
            assertTrue(e.getMessage().contains("'product'"));
        }

        @Test
        void unpairedInputsAreRejected() throws Exception {
            Target transcripts = fasta("a.frn", ">a.1 16S rRNA\nAC\n");
            var task = new ExtractAnnotations("extract_all_annotations", new LocalTarget(dir.resolve("annotations.tsv")));

            assertThrows(InvalidGenomeDataException.class, () -> task.run(context(task, Map.of(
                    ExtractAnnotations.IN_TRANSCRIPTS, List.of(transcripts),
                    ExtractAnnotations.IN_ANNOTATIONS, List.of()))));
        }
    }

    private Target fasta(String name, String content) throws Exception {
        return new LocalTarget(Files.writeString(dir.resolve(name), content));
    }

    private static DefaultTaskContext context(Task task, Map<String, List<Target>> inputs) {
        return new DefaultTaskContext("run-1", task, inputs);
    }
}
