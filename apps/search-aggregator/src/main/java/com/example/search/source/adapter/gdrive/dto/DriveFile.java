package com.example.search.source.adapter.gdrive.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Subset of the Drive v3 {@code File} resource requested through the {@code fields} parameter.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DriveFile(
        String id,
        String name,
        String description,
        String webViewLink,
        String mimeType,
        String createdTime,
        String modifiedTime,
        List<DriveUser> owners,
        DriveUser lastModifyingUser
) {
    public DriveFile {
        owners = owners == null ? List.of() : List.copyOf(owners);
    }

    public String ownerName() {
        return owners.isEmpty() || owners.get(0).displayName() == null
                ? "Unknown"
                : owners.get(0).displayName();
    }

    public boolean ownedByCaller() {
        return owners.stream().anyMatch(DriveUser::isMe);
    }
}
