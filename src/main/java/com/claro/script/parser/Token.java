package com.claro.script.parser;

public class Token {
    final TokenType type;
    public final String lexeme;
    final Object literal;
    /** Character offset inside the expression text. */
    public final int position;

    Token(TokenType type, String lexeme, Object literal, int position) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.position = position;
    }

    public TokenType getType() {
        return type;
    }

    @Override
    public String toString() {
        return type + " '" + lexeme + "'";
    }
}
