package com.seqflow.core.graph;

import com.seqflow.core.command.UnresolvedPlaceholderException;
import com.seqflow.core.target.Target;
import com.seqflow.core.task.AggregateTask;
import com.seqflow.core.task.ContainerTask;
import com.seqflow.core.task.InputSlot;
import com.seqflow.core.task.OutputRef;
import com.seqflow.core.task.Task;
import com.seqflow.core.task.TaskId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Validated, acyclic graph of tasks joined by typed edges.
 *
 * <p>Instances are immutable and built with {@link Builder}. Input targets are
 * resolved once at build time by following the edge list.
 */
public final class TaskGraph {

    private static final TaskGraph EMPTY = new TaskGraph(Map.of(), List.of(), List.of(), Map.of());

    private final Map<TaskId, Task> tasks;
    private final List<Edge> edges;
    private final List<Task> topologicalOrder;
    private final Map<TaskId, Map<String, List<Target>>> inputs;
    private final Map<TaskId, Set<TaskId>> producers = new HashMap<>();
    private final Map<TaskId, Set<TaskId>> consumers = new HashMap<>();

    private TaskGraph(Map<TaskId, Task> tasks, List<Edge> edges, List<Task> topologicalOrder,
                      Map<TaskId, Map<String, List<Target>>> inputs) {
        this.tasks = Collections.unmodifiableMap(tasks);
        this.edges = List.copyOf(edges);
        this.topologicalOrder = List.copyOf(topologicalOrder);
        this.inputs = inputs;
        for (TaskId id : tasks.keySet()) {
            producers.put(id, new LinkedHashSet<>());
            consumers.put(id, new LinkedHashSet<>());
        }
        for (Edge edge : edges) {
            producers.get(edge.consumer()).add(edge.producer());
            consumers.get(edge.producer()).add(edge.consumer());
        }
    }

    public static TaskGraph empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return tasks.isEmpty();
    }

    public int size() {
        return tasks.size();
    }

    /** Tasks in insertion order. */
    public List<Task> tasks() {
        return List.copyOf(tasks.values());
    }

    public Task task(TaskId id) {
        Task task = tasks.get(id);
        if (task == null) {
            throw new IllegalArgumentException("Task not in graph: " + id);
        }
        return task;
    }

    public List<Edge> edges() {
        return edges;
    }

    public List<Task> topologicalOrder() {
        return topologicalOrder;
    }

    public Set<TaskId> producersOf(TaskId id) {
        return Collections.unmodifiableSet(producers.getOrDefault(id, Set.of()));
    }

    public Set<TaskId> consumersOf(TaskId id) {
        return Collections.unmodifiableSet(consumers.getOrDefault(id, Set.of()));
    }

    /**
     * Tasks with no consumer in this graph: the build targets of a run.
     */
    public List<Task> terminalTasks() {
        return topologicalOrder.stream()
                .filter(t -> consumers.get(t.id()).isEmpty())
                .toList();
    }

    /**
     * Every task reachable from {@code id} along producer to consumer edges.
     */
    public Set<TaskId> descendantsOf(TaskId id) {
        var seen = new LinkedHashSet<TaskId>();
        Deque<TaskId> pending = new ArrayDeque<>(consumersOf(id));
        while (!pending.isEmpty()) {
            TaskId next = pending.poll();
            if (seen.add(next)) {
                pending.addAll(consumersOf(next));
            }
        }
        return seen;
    }

    /**
     * Resolved input targets by slot, in binding order.
     */
    public Map<String, List<Target>> inputsOf(TaskId id) {
        return inputs.getOrDefault(id, Map.of());
    }

    public static final class Builder {

        private static final Logger log = LoggerFactory.getLogger(Builder.class);

        private final Map<TaskId, Task> tasks = new LinkedHashMap<>();
        private final Map<String, TaskId> byName = new HashMap<>();
        private final List<Edge> edges = new ArrayList<>();

        private Builder() {
        }

        /**
         * Adds a task. Adding a task with an identity already present returns
         * the existing instance.
         *
         * @throws GraphConfigurationException when a different task already uses the name
         */
        @SuppressWarnings("unchecked")
        public <T extends Task> T add(T task) {
            Task existing = tasks.get(task.id());
            if (existing != null) {
                return (T) existing;
            }
            TaskId clash = byName.get(task.name());
            if (clash != null) {
                throw new GraphConfigurationException("Task name '" + task.name()
                        + "' is used by two different tasks: " + clash.type() + " " + clash.parameters()
                        + " and " + task.id().type() + " " + task.id().parameters());
            }
            tasks.put(task.id(), task);
            byName.put(task.name(), task.id());
            return task;
        }

        public Builder bind(Task consumer, String inputSlot, OutputRef source) {
            Task c = add(consumer);
            Task p = add(source.producer());
            edges.add(new Edge(c.id(), inputSlot, p.id(), source.slot()));
            return this;
        }

        public Builder bind(Task consumer, String inputSlot, Task producer, String outputSlot) {
            return bind(consumer, inputSlot, producer.ref(outputSlot));
        }

        /** Binds a multi-valued slot to several outputs, keeping their order. */
        public Builder bindAll(Task consumer, String inputSlot, List<OutputRef> sources) {
            for (OutputRef source : sources) {
                bind(consumer, inputSlot, source);
            }
            return this;
        }

        public TaskGraph build() {
            validateEdges();
            validateBindings();
            validatePlaceholders();
            List<Task> order = sort();
            Map<TaskId, Map<String, List<Target>>> inputs = resolveInputs();
            log.debug("Built task graph: {} tasks, {} edges", tasks.size(), edges.size());
            return new TaskGraph(new LinkedHashMap<>(tasks), edges, order, inputs);
        }

        private void validateEdges() {
            for (Edge edge : edges) {
                Task consumer = tasks.get(edge.consumer());
                Task producer = tasks.get(edge.producer());
                if (slot(consumer, edge.inputSlot()) == null) {
                    throw new GraphConfigurationException("Task " + consumer.name()
                            + " has no input slot '" + edge.inputSlot() + "'");
                }
                if (!producer.outputs().containsKey(edge.outputSlot())) {
                    throw new GraphConfigurationException("Task " + producer.name()
                            + " has no output slot '" + edge.outputSlot() + "' (bound to "
                            + consumer.name() + "." + edge.inputSlot() + ")");
                }
            }
        }

        private void validateBindings() {
            for (Task task : tasks.values()) {
                if (task instanceof AggregateTask && task.inputSlots().stream().noneMatch(InputSlot::multiple)) {
                    throw new GraphConfigurationException("Aggregate task " + task.name()
                            + " declares no multi-valued input slot");
                }
                for (InputSlot slot : task.inputSlots()) {
                    long count = edges.stream()
                            .filter(e -> e.consumer().equals(task.id()) && e.inputSlot().equals(slot.name()))
                            .count();
                    if (slot.required() && count == 0) {
                        throw new GraphConfigurationException("Required input '" + slot.name()
                                + "' of task " + task.name() + " is not bound");
                    }
                    if (!slot.multiple() && count > 1) {
                        throw new GraphConfigurationException("Input '" + slot.name() + "' of task "
                                + task.name() + " accepts one binding but has " + count);
                    }
                    if (task.outputs().containsKey(slot.name())) {
                        throw new GraphConfigurationException("Task " + task.name()
                                + " uses '" + slot.name() + "' as both input and output slot");
                    }
                }
            }
        }

        private void validatePlaceholders() {
            for (Task task : tasks.values()) {
                if (!(task instanceof ContainerTask container)) {
                    continue;
                }
                Set<String> known = new HashSet<>();
                container.inputSlots().forEach(s -> known.add(s.name()));
                known.addAll(container.outputs().keySet());
                known.addAll(container.parameters().names());
                known.add(ContainerTask.SCRATCH_PLACEHOLDER);

                Set<String> missing = new TreeSet<>(container.command().placeholders());
                missing.removeAll(known);
                if (!missing.isEmpty()) {
                    throw new UnresolvedPlaceholderException("Command of task " + task.name()
                            + " references unknown placeholders " + missing, missing);
                }
            }
        }

        /** Kahn's algorithm; ties keep insertion order. */
        private List<Task> sort() {
            Map<TaskId, Integer> inDegree = new LinkedHashMap<>();
            Map<TaskId, Set<TaskId>> downstream = new HashMap<>();
            for (TaskId id : tasks.keySet()) {
                inDegree.put(id, 0);
                downstream.put(id, new LinkedHashSet<>());
            }
            for (Edge edge : edges) {
                if (downstream.get(edge.producer()).add(edge.consumer())) {
                    inDegree.merge(edge.consumer(), 1, Integer::sum);
                }
            }

            Deque<TaskId> ready = new ArrayDeque<>();
            inDegree.forEach((id, degree) -> {
                if (degree == 0) ready.add(id);
            });

            var order = new ArrayList<Task>(tasks.size());
            while (!ready.isEmpty()) {
                TaskId id = ready.poll();
                order.add(tasks.get(id));
                for (TaskId next : downstream.get(id)) {
                    if (inDegree.merge(next, -1, Integer::sum) == 0) {
                        ready.add(next);
                    }
                }
            }

            if (order.size() != tasks.size()) {
                List<String> cyclic = inDegree.entrySet().stream()
                        .filter(e -> e.getValue() > 0)
                        .map(e -> e.getKey().name())
                        .toList();
                throw new CyclicDependencyException(cyclic);
            }
            return order;
        }

        private Map<TaskId, Map<String, List<Target>>> resolveInputs() {
            Map<TaskId, Map<String, List<Target>>> resolved = new HashMap<>();
            for (Edge edge : edges) {
                Target target = tasks.get(edge.producer()).outputs().get(edge.outputSlot());
                resolved.computeIfAbsent(edge.consumer(), k -> new LinkedHashMap<>())
                        .computeIfAbsent(edge.inputSlot(), k -> new ArrayList<>())
                        .add(target);
            }
            Map<TaskId, Map<String, List<Target>>> frozen = new HashMap<>();
            resolved.forEach((id, slots) -> {
                Map<String, List<Target>> copy = new LinkedHashMap<>();
                slots.forEach((slot, targets) -> copy.put(slot, List.copyOf(targets)));
                frozen.put(id, Collections.unmodifiableMap(copy));
            });
            return frozen;
        }

        private static InputSlot slot(Task task, String name) {
            for (InputSlot slot : task.inputSlots()) {
                if (slot.name().equals(name)) {
                    return slot;
                }
            }
            return null;
        }
    }
}
