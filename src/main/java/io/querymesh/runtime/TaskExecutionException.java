package io.querymesh.runtime;

/**
 * A whole task could not run: the input file was unreadable or the engine was unavailable.
 * Per-query failures never surface as this exception; they become failed result rows.
 */
public final class TaskExecutionException extends Exception {
    private final String taskId;

    public TaskExecutionException(String taskId, String message, Throwable cause) {
        super(message, cause);
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }
}
