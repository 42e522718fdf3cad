package com.seqflow.core.task;

import com.seqflow.core.target.Target;

import java.util.Map;

/**
 * Wraps a file that exists before the run, exposed through the {@code out_file} slot.
 * The task never runs; a missing file fails it.
 */
public class ExternalFileTask extends AbstractTask {

    public static final String OUT_FILE = "out_file";

    private final Target file;

    public ExternalFileTask(String name, Target file) {
        super(name, Parameters.builder().put("path", file.uri().toString()).build());
        this.file = file;
    }

    public Target file() {
        return file;
    }

    @Override
    public Map<String, Target> outputs() {
        return Map.of(OUT_FILE, file);
    }

    @Override
    public TaskKind kind() {
        return TaskKind.EXTERNAL;
    }
}
