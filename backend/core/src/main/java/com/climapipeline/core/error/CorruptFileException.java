package com.climapipeline.core.error;

public class CorruptFileException extends PipelineException {
    public CorruptFileException(String message) {
        super(ErrorKind.CORRUPT_FILE, message);
    }

    public CorruptFileException(String message, Throwable cause) {
        super(ErrorKind.CORRUPT_FILE, message, cause);
    }
}
