package com.gdin.inspection.originality.exception;

import lombok.Getter;

/**
 * 外部协作方（嵌入、向量检索、文本生成）不可用
 */
@Getter
public class SubsystemUnavailableException extends RuntimeException {

    public enum Reason {
        TIMEOUT(true),
        RATE_LIMITED(true),
        UNREACHABLE(true),
        AUTHENTICATION(false),
        EMPTY_INDEX(false),
        INTERRUPTED(false);

        private final boolean retryable;

        Reason(boolean retryable) {
            this.retryable = retryable;
        }

        public boolean isRetryable() {
            return retryable;
        }
    }

    private final Reason reason;

    public SubsystemUnavailableException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public SubsystemUnavailableException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public boolean isRetryable() {
        return reason.isRetryable();
    }
}
