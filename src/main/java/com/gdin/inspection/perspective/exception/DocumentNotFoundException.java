package com.gdin.inspection.perspective.exception;

import lombok.Getter;

/**
 * 单文档查找未命中，调用方可跳过。
 */
@Getter
public class DocumentNotFoundException extends PerspectiveException {

    private final String documentId;

    public DocumentNotFoundException(String documentId) {
        super("document not found: " + documentId);
        this.documentId = documentId;
    }
}
