package com.gdin.inspection.originality.exception;

/**
 * 代码结构骨架无法生成
 */
public class StructureParseException extends RuntimeException {
    public StructureParseException(String message) {
        super(message);
    }
}
