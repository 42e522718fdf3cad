package com.seqflow.pipelines;

import com.seqflow.core.target.Target;
import com.seqflow.core.task.ExternalFileTask;

/**
 * An input file supplied by the user, such as a FASTQ listed in the sample sheet.
 */
public class LoadFile extends ExternalFileTask {

    public LoadFile(String name, Target file) {
        super(name, file);
    }
}
