package com.seqflow.core.command;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CommandTemplateTest {

    @Test
    void builderCollectsPlaceholdersInOrder() {
        CommandTemplate template = CommandTemplate.builder("run_metaspades.py")
                .placeholder("--input", "in_fastq")
                .option("--threads", "4")
                .placeholder("--output-path", "out_fasta")
                .placeholder("--again", "in_fastq")
                .build();

        assertEquals(List.of("in_fastq", "out_fasta"), List.copyOf(template.placeholders()));
        assertEquals("run_metaspades.py --input {in_fastq} --threads 4 --output-path {out_fasta} --again {in_fastq}",
                template.toString());
    }

    @Test
    void wholeArgumentPlaceholderExpandsToEveryValue() {
        CommandTemplate template = CommandTemplate.of("integrate", "--gff", "{in_gff_list}", "--out", "{out}");

        List<String> argv = template.render(Map.of(
                "in_gff_list", List.of("/a.gff", "/b.gff"),
                "out", List.of("/o.fasta")));

        assertEquals(List.of("integrate", "--gff", "/a.gff", "/b.gff", "--out", "/o.fasta"), argv);
    }

    @Test
    void embeddedPlaceholderIsJoinedWithCommas() {
        CommandTemplate template = CommandTemplate.of("tool", "--inputs={in}", "--tmp={scratch}/x");

        List<String> argv = template.render(Map.of(
                "in", List.of("a", "b"),
                "scratch", List.of("/work")));

        assertEquals(List.of("tool", "--inputs=a,b", "--tmp=/work/x"), argv);
    }

    @Test
    void valuesAreNotReinterpreted() {
        CommandTemplate template = CommandTemplate.of("echo", "{msg}");

        assertEquals(List.of("echo", "$HOME; rm -rf {x}"), template.render(Map.of("msg", List.of("$HOME; rm -rf {x}"))));
    }

    @Test
    void missingBindingsAreReportedTogether() {
        CommandTemplate template = CommandTemplate.of("tool", "{a}", "{b}", "{c}");

        var e = assertThrows(UnresolvedPlaceholderException.class,
                () -> template.render(Map.of("b", List.of("1"))));
        assertEquals(Set.of("a", "c"), e.placeholders());
    }

    @Test
    void emptyTemplateIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> CommandTemplate.of(List.of()));
    }
}
