package com.claro.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Tokenizer for a single expression. Word operators and literals are case-insensitive. */
public class Lexer {
    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("and", TokenType.AND);
        map.put("or", TokenType.OR);
        map.put("not", TokenType.NOT);
        map.put("in", TokenType.IN);
        map.put("true", TokenType.TRUE);
        map.put("false", TokenType.FALSE);
        map.put("none", TokenType.NONE);
        map.put("null", TokenType.NONE);
        keywords = Collections.unmodifiableMap(map);
    }

    public Lexer(String source) {
        this.source = source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", null, current));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case ',': addToken(TokenType.COMMA); break;
            case ':': addToken(TokenType.COLON); break;
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case '%': addToken(TokenType.PERCENT); break;
            case '*': addToken(match('*') ? TokenType.DOUBLE_STAR : TokenType.STAR); break;
            case '/': addToken(match('/') ? TokenType.DOUBLE_SLASH : TokenType.SLASH); break;
            case '!': addToken(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG); break;
            case '<': addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS); break;
            case '>': addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER); break;
            case '=':
                if (match('=')) addToken(TokenType.EQUAL_EQUAL);
                else throw error("Unexpected '=' (use '==' to compare)");
                break;
            case '&':
                if (match('&')) addToken(TokenType.AND_AND);
                else throw error("Unexpected '&'");
                break;
            case '|':
                if (match('|')) addToken(TokenType.OR_OR);
                else throw error("Unexpected '|'");
                break;
            case ' ': case '\r': case '\t': case '\n':
                break;
            case '"':
            case '\'':
                string(c);
                break;
            default:
                if (isDigit(c)) number();
                else if (c == '.' && isDigit(peek())) number();
                else if (isAlpha(c)) identifier();
                else throw error("Unexpected character: " + c);
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = keywords.getOrDefault(text.toLowerCase(), TokenType.IDENTIFIER);
        addToken(type);
    }

    private void number() {
        boolean fractional = source.charAt(start) == '.';
        while (isDigit(peek())) advance();
        if (!fractional && peek() == '.' && isDigit(peekNext())) {
            fractional = true;
            advance();
            while (isDigit(peek())) advance();
        }
        if (peek() == 'e' || peek() == 'E') {
            int mark = current;
            advance();
            if (peek() == '+' || peek() == '-') advance();
            if (isDigit(peek())) {
                fractional = true;
                while (isDigit(peek())) advance();
            } else {
                current = mark;
            }
        }
        String text = source.substring(start, current);
        if (fractional) {
            addToken(TokenType.FLOAT, Double.parseDouble(text));
        } else {
            try {
                addToken(TokenType.INTEGER, Long.parseLong(text));
            } catch (NumberFormatException e) {
                throw error("Integer literal out of range: " + text);
            }
        }
    }

    private void string(char quote) {
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && peek() != quote) {
            char c = advance();
            if (c == '\\' && !isAtEnd()) {
                char esc = advance();
                switch (esc) {
                    case 'n': sb.append('\n'); break;
                    case 't': sb.append('\t'); break;
                    case 'r': sb.append('\r'); break;
                    case '\\': sb.append('\\'); break;
                    case '\'': sb.append('\''); break;
                    case '"': sb.append('"'); break;
                    default: sb.append('\\').append(esc);
                }
            } else {
                sb.append(c);
            }
        }
        if (isAtEnd()) throw error("Unterminated string");
        advance();
        addToken(TokenType.STRING, sb.toString());
    }

    private boolean isAtEnd() { return current >= source.length(); }
    private char advance() { return source.charAt(current++); }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }
    private char peekNext() { return (current + 1 >= source.length()) ? '\0' : source.charAt(current + 1); }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }
    private boolean isAlphaNumeric(char c) { return isAlpha(c) || isDigit(c); }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, start));
    }

    private ExpressionException error(String msg) {
        return new ExpressionException(source, "[col " + (start + 1) + "] " + msg);
    }
}
