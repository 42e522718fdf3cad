package com.seqflow.pipelines;

import com.seqflow.core.dataset.SampleSheet;
import com.seqflow.core.graph.TaskGraph;
import com.seqflow.core.target.StorageConfig;
import com.seqflow.core.target.StorageProperties;
import com.seqflow.core.target.TargetFactory;
import com.seqflow.core.task.ContainerTask;
import com.seqflow.core.task.Task;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Shared helpers for workflow tests; {@code s3://} is served from a local mirror.
 */
final class PipelineFixtures {

    private PipelineFixtures() {
    }

    static TargetFactory targets(Path mirrorRoot) {
        var properties = new StorageProperties();
        properties.setMirrorRoot(mirrorRoot.toString());
        return new StorageConfig().targetFactory(new StorageConfig().objectStoreRegistry(properties));
    }

    static WorkflowFactory factory(Path mirrorRoot) {
        return new WorkflowFactory(targets(mirrorRoot), new PipelineProperties());
    }

    static SampleSheet sheet(String... pairs) {
        var records = new ArrayList<Map<String, String>>();
        for (int i = 0; i < pairs.length; i += 2) {
            records.add(Map.of("sample", pairs[i], "path", pairs[i + 1]));
        }
        return SampleSheet.of("samples.csv", List.of("sample", "path"), records, "sample", "path");
    }

    static Task task(TaskGraph graph, String name) {
        return graph.tasks().stream()
                .filter(t -> t.name().equals(name))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no task " + name + " in " + graph.tasks()));
    }

    static ContainerTask container(TaskGraph graph, String name) {
        return (ContainerTask) task(graph, name);
    }

    static List<String> names(List<? extends Task> tasks) {
        return tasks.stream().map(Task::name).toList();
    }

    static List<String> inputUris(TaskGraph graph, Task task, String slot) {
        return graph.inputsOf(task.id()).get(slot).stream().map(t -> t.uri().toString()).toList();
    }
}
