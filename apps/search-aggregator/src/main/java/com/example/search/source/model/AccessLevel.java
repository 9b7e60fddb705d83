package com.example.search.source.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AccessLevel {
    OWNER,
    EDITOR,
    VIEWER,
    RESTRICTED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
