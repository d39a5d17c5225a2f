package com.gdin.inspection.perspective.exception;

import lombok.Getter;

/**
 * 同一个文档 id 带着不同的正文写入同一个库。
 */
@Getter
public class DocumentConflictException extends PerspectiveException {

    private final String documentId;

    public DocumentConflictException(String documentId) {
        super("document " + documentId + " already exists with different text");
        this.documentId = documentId;
    }
}
