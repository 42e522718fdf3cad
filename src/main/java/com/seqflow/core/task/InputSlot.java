package com.seqflow.core.task;

/**
 * A named input of a task.
 *
 * @param name     slot name, also usable as a command placeholder
 * @param required whether the graph must bind at least one producer
 * @param multiple whether more than one producer may be bound (fan-in)
 */
public record InputSlot(String name, boolean required, boolean multiple) {

    public static InputSlot one(String name) {
        return new InputSlot(name, true, false);
    }

    public static InputSlot many(String name) {
        return new InputSlot(name, true, true);
    }

    public static InputSlot optional(String name) {
        return new InputSlot(name, false, false);
    }
}
