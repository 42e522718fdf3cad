package com.seqflow.testing;

import com.seqflow.core.command.CommandTemplate;
import com.seqflow.core.target.LocalTarget;
import com.seqflow.core.target.Target;
import com.seqflow.core.task.ContainerSpec;
import com.seqflow.core.task.ContainerTask;
import com.seqflow.core.task.InputSlot;
import com.seqflow.core.task.LocalTask;
import com.seqflow.core.task.Parameters;
import com.seqflow.core.task.TaskContext;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Small in-process tasks for graph and scheduler tests.
 */
public final class TestTasks {

    public static final String IN = "in";
    public static final String OUT = "out";

    private TestTasks() {
    }

    /**
     * Writes its name to {@code out} and joins its inputs' content before it.
     * Fails the first {@code failures} times it runs.
     */
    public static class Step extends LocalTask {

        private final Target output;
        private final List<InputSlot> slots;
        private final AtomicInteger runs = new AtomicInteger();
        private volatile int failures;
        private volatile long delayMs;

        public Step(String name, Path output, InputSlot... slots) {
            super(name, Parameters.builder().put("output", output).build());
            this.output = new LocalTarget(output);
            this.slots = List.of(slots);
        }

        public static Step source(String name, Path output) {
            return new Step(name, output);
        }

        public static Step consuming(String name, Path output) {
            return new Step(name, output, InputSlot.many(IN));
        }

        public Step failing(int times) {
            this.failures = times;
            return this;
        }

        public Step slow(long millis) {
            this.delayMs = millis;
            return this;
        }

        public int runs() {
            return runs.get();
        }

        public Target output() {
            return output;
        }

        @Override
        public List<InputSlot> inputSlots() {
            return slots;
        }

        @Override
        public Map<String, Target> outputs() {
            return Map.of(OUT, output);
        }

        @Override
        public void run(TaskContext context) throws Exception {
            int run = runs.incrementAndGet();
            if (delayMs > 0) {
                Thread.sleep(delayMs);
            }
            if (run <= failures) {
                throw new IllegalStateException(name() + " failed on run " + run);
            }
            var content = new StringBuilder();
            for (InputSlot slot : slots) {
                for (Target input : context.inputs(slot.name())) {
                    content.append(read(input)).append('+');
                }
            }
            content.append(name());
            context.output(OUT).write(out -> out.write(content.toString().getBytes(StandardCharsets.UTF_8)));
        }
    }

    /**
     * Container task with configurable slots and command.
     */
    public static class Tool extends ContainerTask {

        private final List<InputSlot> slots;
        private final Map<String, Target> outputs;
        private final CommandTemplate command;

        public Tool(String name, Parameters parameters, List<InputSlot> slots, Map<String, Target> outputs,
                    CommandTemplate command, ContainerSpec spec) {
            super(name, parameters, spec);
            this.slots = slots;
            this.outputs = outputs;
            this.command = command;
        }

        public Tool(String name, List<InputSlot> slots, Map<String, Target> outputs, CommandTemplate command) {
            this(name, Parameters.empty(), slots, outputs, command, null);
        }

        @Override
        public String image() {
            return "example/tool:1.0";
        }

        @Override
        public CommandTemplate command() {
            return command;
        }

        @Override
        public List<InputSlot> inputSlots() {
            return slots;
        }

        @Override
        public Map<String, Target> outputs() {
            return outputs;
        }
    }

    public static String read(Target target) throws IOException {
        try (InputStream in = target.openForRead()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
