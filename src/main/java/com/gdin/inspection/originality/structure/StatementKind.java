package com.gdin.inspection.originality.structure;

public enum StatementKind {
    FUNCTION,
    CLASS,
    IF,
    ELSE,
    LOOP,
    RETURN,
    TRY,
    CATCH,
    FINALLY,
    IMPORT,
    THROW,
    JUMP,
    SWITCH,
    CASE,
    DECLARATION,
    ASSIGNMENT,
    CALL,
    EXPRESSION
}
