package com.claro.script.parser;

public enum TokenType {
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACKET, RIGHT_BRACKET, LEFT_BRACE, RIGHT_BRACE,
    COMMA, COLON,

    PLUS, MINUS, STAR, DOUBLE_STAR, SLASH, DOUBLE_SLASH, PERCENT,
    BANG, BANG_EQUAL, EQUAL_EQUAL,
    LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,
    AND_AND, OR_OR,

    IDENTIFIER, STRING, INTEGER, FLOAT,

    AND, OR, NOT, IN, TRUE, FALSE, NONE,

    EOF
}
