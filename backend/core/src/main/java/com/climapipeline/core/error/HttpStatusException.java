package com.climapipeline.core.error;

public class HttpStatusException extends PipelineException {
    private final int statusCode;

    public HttpStatusException(int statusCode, String message) {
        super(ErrorKind.HTTP_STATUS, message);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }

    public boolean isServerError() {
        return statusCode >= 500;
    }
}
