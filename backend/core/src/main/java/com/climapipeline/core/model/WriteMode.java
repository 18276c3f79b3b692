package com.climapipeline.core.model;

import com.climapipeline.core.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum WriteMode {
    OVERWRITE,
    APPEND;

    @JsonCreator
    public static WriteMode parse(String value) {
        if (value != null) {
            switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "overwrite":
                    return OVERWRITE;
                case "append":
                    return APPEND;
                default:
                    break;
            }
        }
        throw new ValidationException("Write mode must be 'overwrite' or 'append', got " + value);
    }
}
