package io.querymesh.storage;

import io.querymesh.model.TaskStatus;

public final class TaskTransitionException extends IllegalStateException {
    private final String taskId;
    private final TaskStatus current;
    private final TaskStatus requested;

    public TaskTransitionException(String taskId, TaskStatus current, TaskStatus requested) {
        super("Invalid task transition for " + taskId + ": " + current + " -> " + requested);
        this.taskId = taskId;
        this.current = current;
        this.requested = requested;
    }

    public String taskId() {
        return taskId;
    }

    public TaskStatus current() {
        return current;
    }

    public TaskStatus requested() {
        return requested;
    }
}
