package com.gdin.inspection.perspective.exception;

/**
 * 文本生成服务调用失败（可重试）。
 */
public class GenerationException extends PerspectiveException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
