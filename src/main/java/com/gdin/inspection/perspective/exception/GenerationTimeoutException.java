package com.gdin.inspection.perspective.exception;

import lombok.Getter;

@Getter
public class GenerationTimeoutException extends GenerationException {

    private final long timeoutMillis;

    public GenerationTimeoutException(String memoryId, long timeoutMillis) {
        super("generation [" + memoryId + "] timed out after " + timeoutMillis + " ms");
        this.timeoutMillis = timeoutMillis;
    }
}
