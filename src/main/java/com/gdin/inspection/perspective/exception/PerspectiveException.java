package com.gdin.inspection.perspective.exception;

/**
 * 摘要流程中所有业务异常的基类。失败始终限定在单个查询内。
 */
public class PerspectiveException extends RuntimeException {

    public PerspectiveException(String message) {
        super(message);
    }

    public PerspectiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
