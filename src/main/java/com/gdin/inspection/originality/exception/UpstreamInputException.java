package com.gdin.inspection.originality.exception;

/**
 * 上游抽取出的文本不可用（空文本、全空白等），该单元不参与评分
 */
public class UpstreamInputException extends RuntimeException {
    public UpstreamInputException(String message) {
        super(message);
    }
}
