package com.example.search.aggregation.exception;

import com.example.search.source.model.SourceId;

public class DocumentNotFoundException extends RuntimeException {

    private final SourceId source;
    private final String documentId;

    public DocumentNotFoundException(SourceId source, String documentId) {
        super(String.format("Document %s not found in %s", documentId, source));
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
