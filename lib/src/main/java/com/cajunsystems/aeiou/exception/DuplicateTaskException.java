package com.cajunsystems.aeiou.exception;

public class DuplicateTaskException extends RuntimeException {
    private final Object taskId;

    public DuplicateTaskException(Object taskId) {
        super("Task already running: " + taskId);
        this.taskId = taskId;
    }

    public Object taskId() {
        return taskId;
    }
}
