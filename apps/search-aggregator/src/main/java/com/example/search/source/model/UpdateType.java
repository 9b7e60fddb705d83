package com.example.search.source.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum UpdateType {
    CREATED,
    MODIFIED,
    SHARED,
    COMMENTED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
