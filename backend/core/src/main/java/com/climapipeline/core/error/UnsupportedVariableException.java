package com.climapipeline.core.error;

public class UnsupportedVariableException extends PipelineException {
    public UnsupportedVariableException(String message) {
        super(ErrorKind.UNSUPPORTED_VARIABLE, message);
    }

    public UnsupportedVariableException(String message, Throwable cause) {
        super(ErrorKind.UNSUPPORTED_VARIABLE, message, cause);
    }
}
