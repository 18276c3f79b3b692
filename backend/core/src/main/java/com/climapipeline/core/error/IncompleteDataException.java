package com.climapipeline.core.error;

public class IncompleteDataException extends PipelineException {
    public IncompleteDataException(String message) {
        super(ErrorKind.INCOMPLETE_DATA, message);
    }

    public IncompleteDataException(String message, Throwable cause) {
        super(ErrorKind.INCOMPLETE_DATA, message, cause);
    }
}
