package com.gdin.inspection.originality.exception;

/**
 * 模型输出无法解析，不重试，直接走兜底
 */
public class MalformedResponseException extends RuntimeException {
    public MalformedResponseException(String message) {
        super(message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
