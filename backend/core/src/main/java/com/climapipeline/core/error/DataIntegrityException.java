package com.climapipeline.core.error;

public class DataIntegrityException extends PipelineException {
    public DataIntegrityException(String message) {
        super(ErrorKind.DATA_INTEGRITY, message);
    }

    public DataIntegrityException(String message, Throwable cause) {
        super(ErrorKind.DATA_INTEGRITY, message, cause);
    }
}
