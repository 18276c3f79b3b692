package com.climapipeline.core.error;

public class MalformedResponseException extends PipelineException {
    public MalformedResponseException(String message) {
        super(ErrorKind.MALFORMED_RESPONSE, message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(ErrorKind.MALFORMED_RESPONSE, message, cause);
    }
}
