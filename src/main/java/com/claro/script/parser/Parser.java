package com.claro.script.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

import com.claro.script.parser.Expr.Binary;
import com.claro.script.parser.Expr.Call;
import com.claro.script.parser.Expr.DictLiteral;
import com.claro.script.parser.Expr.ExprInterface;
import com.claro.script.parser.Expr.Index;
import com.claro.script.parser.Expr.ListLiteral;
import com.claro.script.parser.Expr.Literal;
import com.claro.script.parser.Expr.Logical;
import com.claro.script.parser.Expr.Unary;
import com.claro.script.parser.Expr.Variable;

/**
 * Recursive-descent parser for one expression.
 *
 * Precedence, loosest first: or, and, not, comparison/in, + -, * / // %, unary - + !, **, postfix.
 */
public class Parser {
    private final String source;
    private final List<Token> tokens;
    private int current = 0;

    public Parser(String source, List<Token> tokens) {
        this.source = source;
        this.tokens = tokens;
    }

    public ExprInterface parse() {
        if (isAtEnd()) throw error(peek(), "Expect expression.");
        ExprInterface expr = expression();
        if (!isAtEnd()) throw error(peek(), "Unexpected '" + peek().lexeme + "' after expression.");
        return expr;
    }

    private ExprInterface expression() { return or(); }

    private ExprInterface or() {
        ExprInterface expr = and();
        while (match(TokenType.OR, TokenType.OR_OR)) {
            Token op = previous();
            ExprInterface right = and();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private ExprInterface and() {
        ExprInterface expr = not();
        while (match(TokenType.AND, TokenType.AND_AND)) {
            Token op = previous();
            ExprInterface right = not();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private ExprInterface not() {
        if (match(TokenType.NOT)) {
            Token op = previous();
            return new Unary(op, not());
        }
        return comparison();
    }

    private ExprInterface comparison() {
        ExprInterface expr = term();
        while (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL,
                TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL,
                TokenType.IN)) {
            Token op = previous();
            ExprInterface right = term();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private ExprInterface term() {
        ExprInterface expr = factor();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            ExprInterface right = factor();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private ExprInterface factor() {
        ExprInterface expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.DOUBLE_SLASH, TokenType.PERCENT)) {
            Token op = previous();
            ExprInterface right = unary();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private ExprInterface unary() {
        if (match(TokenType.BANG, TokenType.MINUS, TokenType.PLUS)) {
            Token op = previous();
            ExprInterface right = unary();
            return new Unary(op, right);
        }
        return power();
    }

    // right-associative, binds tighter than unary minus on its left: -2 ** 2 == -4
    private ExprInterface power() {
        ExprInterface expr = postfix();
        if (match(TokenType.DOUBLE_STAR)) {
            Token op = previous();
            ExprInterface right = unary();
            return new Binary(expr, op, right);
        }
        return expr;
    }

    private ExprInterface postfix() {
        ExprInterface expr = primary();
        while (true) {
            if (match(TokenType.LEFT_BRACKET)) {
                Token bracket = previous();
                ExprInterface index = expression();
                consume(TokenType.RIGHT_BRACKET, "Expect ']' after index.");
                expr = new Index(expr, index, bracket);
            } else if (check(TokenType.LEFT_PAREN) && expr instanceof Variable) {
                advance();
                expr = finishCall(((Variable) expr).name);
            } else {
                break;
            }
        }
        return expr;
    }

    private ExprInterface finishCall(Token name) {
        List<ExprInterface> arguments = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                arguments.add(expression());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expect ')' after arguments.");
        return new Call(name, arguments);
    }

    private ExprInterface primary() {
        if (match(TokenType.FALSE)) return new Literal(Value.bool(false));
        if (match(TokenType.TRUE)) return new Literal(Value.bool(true));
        if (match(TokenType.NONE)) return new Literal(Value.none());
        if (match(TokenType.INTEGER)) return new Literal(Value.integer((Long) previous().literal));
        if (match(TokenType.FLOAT)) return new Literal(Value.floating((Double) previous().literal));
        if (match(TokenType.STRING)) return new Literal(Value.string((String) previous().literal));
        if (match(TokenType.IDENTIFIER)) return new Variable(previous());

        if (match(TokenType.LEFT_PAREN)) {
            ExprInterface expr = expression();
            consume(TokenType.RIGHT_PAREN, "Expect ')' after expression.");
            return expr;
        }

        if (match(TokenType.LEFT_BRACKET)) {
            List<ExprInterface> items = new ArrayList<>();
            if (!check(TokenType.RIGHT_BRACKET)) {
                do {
                    if (check(TokenType.RIGHT_BRACKET)) break; // trailing comma
                    items.add(expression());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RIGHT_BRACKET, "Expect ']' after list literal.");
            return new ListLiteral(items);
        }

        // Dict literal; bare identifiers are string keys
        if (match(TokenType.LEFT_BRACE)) {
            LinkedHashMap<String, ExprInterface> entries = new LinkedHashMap<>();
            if (!check(TokenType.RIGHT_BRACE)) {
                do {
                    if (check(TokenType.RIGHT_BRACE)) break;
                    String key;
                    if (match(TokenType.STRING)) {
                        key = (String) previous().literal;
                    } else if (match(TokenType.IDENTIFIER, TokenType.INTEGER)) {
                        key = previous().lexeme;
                    } else {
                        throw error(peek(), "Expect dict key (string or identifier).");
                    }
                    consume(TokenType.COLON, "Expect ':' after dict key.");
                    entries.put(key, expression());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RIGHT_BRACE, "Expect '}' after dict literal.");
            return new DictLiteral(entries);
        }

        throw error(peek(), "Expect expression.");
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private ExpressionException error(Token token, String message) {
        return new ExpressionException(source, "[col " + (token.position + 1) + "] " + message);
    }
}
