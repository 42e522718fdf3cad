package com.seqflow.pipelines;

import com.seqflow.core.dataset.DatasetValidationException;
import com.seqflow.core.dataset.SampleRow;
import com.seqflow.core.dataset.SampleSheet;
import com.seqflow.core.graph.TaskGraph;
import com.seqflow.core.target.TargetFactory;
import com.seqflow.core.task.ExternalFileTask;
import com.seqflow.core.task.OutputRef;

import java.util.ArrayList;

/**
 * Adds the task that makes one sample's reads available, either an existing
 * file or an SRA download.
 */
final class SampleReads {

    private SampleReads() {
    }

    /**
     * Rejects the sheet unless every row names an SRA run accession.
     */
    static void requireAccessions(SampleSheet sheet) {
        var problems = new ArrayList<String>();
        for (SampleRow row : sheet.rows()) {
            if (!row.source().startsWith("SRR")) {
                problems.add("row " + (row.index() + 1) + ": '" + row.source() + "' is not an SRA run accession");
            }
        }
        if (!problems.isEmpty()) {
            throw new DatasetValidationException(sheet.source(), problems);
        }
    }

    static OutputRef add(SampleRow row, InputLocation source, String baseFolder, int sraMemoryMb,
                         TargetFactory targets, ContainerDefaults containers, TaskGraph.Builder builder) {
        String sample = row.sampleId();
        if (source == InputLocation.SRA) {
            var download = builder.add(new ImportSraFastq("download_from_SRA_" + sample, targets, row.source(),
                    baseFolder, containers.images().getGetSra(),
                    containers.spec("get_sra_" + sample, 1, sraMemoryMb)));
            return download.ref(ImportSraFastq.OUT_FASTQ);
        }
        var load = builder.add(new LoadFile("load_from_s3_" + sample, targets.of(row.source())));
        return load.ref(ExternalFileTask.OUT_FILE);
    }
}
