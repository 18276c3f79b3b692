package com.climapipeline.core.error;

public class NetworkException extends PipelineException {
    public NetworkException(String message) {
        super(ErrorKind.NETWORK, message);
    }

    public NetworkException(String message, Throwable cause) {
        super(ErrorKind.NETWORK, message, cause);
    }
}
