package com.example.search.aggregation.exception;

import com.example.search.source.model.SourceId;

public class DocumentAccessDeniedException extends RuntimeException {

    private final SourceId source;
    private final String documentId;

    public DocumentAccessDeniedException(SourceId source, String documentId) {
        super(String.format("Access denied to document %s in %s", documentId, source));
        this.source = source;
        this.documentId = documentId;
    }

    public SourceId getSource() {
        return source;
    }

    public String getDocumentId() {
        return documentId;
    }
}
