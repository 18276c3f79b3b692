package com.climapipeline.core.error;

public enum ErrorKind {
    VALIDATION,
    UNSUPPORTED_VARIABLE,
    NETWORK,
    HTTP_STATUS,
    MALFORMED_RESPONSE,
    INCOMPLETE_DATA,
    DATA_INTEGRITY,
    STORAGE,
    CORRUPT_FILE
}
