package com.claro.script.exec;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/** Statement keywords, matched case-insensitively on the first token of a line. */
public enum StatementKind {
    PRINT("PRINT"),
    VARIABLE("VARIABLE", "SET"),
    STRING("STRING"),
    LIST("LIST"),
    DICT("DICT"),
    IF("IF"),
    ELSE("ELSE"),
    WHILE("WHILE"),
    FOR("FOR"),
    FUNC("FUNC", "FUNCTION"),
    CALL("CALL"),
    RETURN("RETURN"),
    TRY("TRY"),
    EXCEPT("EXCEPT", "CATCH"),
    FINALLY("FINALLY"),
    BREAK("BREAK"),
    CONTINUE("CONTINUE"),
    INPUT("INPUT"),
    REPEAT("REPEAT"),
    TRACE("TRACE"),
    STACK("STACK"),
    DEBUG("DEBUG"),
    GET("GET"),
    CONCAT("CONCAT"),
    HELP("HELP"),
    EXIT("EXIT"),
    COMMENT("COMMENT", "REM"),
    END("END");

    private static final Map<String, StatementKind> byKeyword;
    static {
        Map<String, StatementKind> map = new HashMap<>();
        for (StatementKind kind : values()) {
            for (String k : kind.keywords) map.put(k, kind);
        }
        byKeyword = Collections.unmodifiableMap(map);
    }

    private final String[] keywords;

    StatementKind(String... keywords) {
        this.keywords = keywords;
    }

    /** IF, WHILE, FOR, FUNC and TRY each need a matching END. */
    public boolean opensBlock() {
        switch (this) {
            case IF:
            case WHILE:
            case FOR:
            case FUNC:
            case TRY:
                return true;
            default:
                return false;
        }
    }

    /** Lines that only make sense as part of an enclosing block. */
    public boolean isBlockClause() {
        return this == ELSE || this == EXCEPT || this == FINALLY || this == END;
    }

    /** Upper-case keyword to kind, null when unknown. */
    public static StatementKind lookup(String upperKeyword) {
        return byKeyword.get(upperKeyword);
    }
}
