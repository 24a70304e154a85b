package com.promptvector.search.exception;

import lombok.Getter;

@Getter
public class DocumentNotFoundException extends VectorSearchException {

    private final String documentId;

    public DocumentNotFoundException(String documentId) {
        super("Document not found: " + documentId);
        this.documentId = documentId;
    }
}
