package com.seqflow.core.workflow;

import com.seqflow.core.dataset.SampleRow;
import com.seqflow.core.dataset.SampleSheet;
import com.seqflow.core.graph.TaskGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Template for workflows that fan out one branch per sample and fan in over
 * the ordered list of branches.
 *
 * @param <B> the per-sample branch handle passed to {@link #buildAggregates}
 */
public abstract class SampleWorkflow<B> {

    private static final Logger log = LoggerFactory.getLogger(SampleWorkflow.class);

    public abstract String name();

    /**
     * Builds the task graph for a sheet. A sheet with no rows yields an empty graph.
     */
    public TaskGraph build(SampleSheet sheet) {
        if (sheet.isEmpty()) {
            log.warn("Sample sheet {} has no rows, workflow {} has nothing to run", sheet.source(), name());
            return TaskGraph.empty();
        }
        validate(sheet);

        TaskGraph.Builder builder = TaskGraph.builder();
        List<B> branches = new ArrayList<>(sheet.size());
        for (SampleRow row : sheet.rows()) {
            branches.add(buildSampleBranch(row, builder));
        }
        buildAggregates(branches, builder);

        TaskGraph graph = builder.build();
        log.info("Workflow {}: {} samples, {} tasks, {} terminal",
                name(), sheet.size(), graph.size(), graph.terminalTasks().size());
        return graph;
    }

    /**
     * Checks workflow-specific row constraints before any task is created.
     */
    protected void validate(SampleSheet sheet) {
    }

    protected abstract B buildSampleBranch(SampleRow row, TaskGraph.Builder builder);

    /**
     * Adds fan-in tasks. Branches arrive in row order.
     */
    protected void buildAggregates(List<B> branches, TaskGraph.Builder builder) {
    }
}
