package com.example.search.source.adapter.gdrive.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DriveFileList(
        List<DriveFile> files,
        String nextPageToken
) {
    public DriveFileList {
        files = files == null ? List.of() : List.copyOf(files);
    }
}
