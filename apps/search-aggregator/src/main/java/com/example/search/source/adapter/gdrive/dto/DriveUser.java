package com.example.search.source.adapter.gdrive.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DriveUser(
        String displayName,
        String emailAddress,
        Boolean me
) {
    public boolean isMe() {
        return Boolean.TRUE.equals(me);
    }
}
