package com.climapipeline.core.error;

public class StorageException extends PipelineException {
    public enum Reason {
        UNWRITABLE_PATH,
        DISK_FULL,
        CONCURRENT_MODIFICATION,
        IO_FAILURE
    }

    private final Reason reason;

    public StorageException(Reason reason, String message) {
        super(ErrorKind.STORAGE, message);
        this.reason = reason;
    }

    public StorageException(Reason reason, String message, Throwable cause) {
        super(ErrorKind.STORAGE, message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
