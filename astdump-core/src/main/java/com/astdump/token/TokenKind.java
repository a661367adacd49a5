package com.astdump.token;

public enum TokenKind {
    IDENTIFIER,
    NUMBER,
    STRING,
    CHARACTER,
    PUNCTUATOR
}
