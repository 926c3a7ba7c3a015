package com.gdin.inspection.originality.exception;

/**
 * 提交中没有任何可分析的单元，唯一会抛给调用方的错误
 */
public class NoAnalyzableContentException extends RuntimeException {
    public NoAnalyzableContentException(String message) {
        super(message);
    }
}
