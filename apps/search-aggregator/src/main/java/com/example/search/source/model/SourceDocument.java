package com.example.search.source.model;

public record SourceDocument(String id, String title, SourceId source) {

    public static SourceDocument from(DocumentContent document) {
        return new SourceDocument(document.id(), document.title(), document.source());
    }
}
