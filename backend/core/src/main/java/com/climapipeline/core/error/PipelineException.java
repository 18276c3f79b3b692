package com.climapipeline.core.error;

public abstract class PipelineException extends RuntimeException {
    private final ErrorKind kind;

    protected PipelineException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected PipelineException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
