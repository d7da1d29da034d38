package com.claro.script.parser;

import java.util.LinkedHashMap;
import java.util.List;

public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
    }

    public interface ExprVisitor<R> {
        R visitBinaryExpr(Binary expr);
        R visitUnaryExpr(Unary expr);
        R visitLogicalExpr(Logical expr);
        R visitLiteralExpr(Literal expr);
        R visitListLiteralExpr(ListLiteral expr);
        R visitDictLiteralExpr(DictLiteral expr);
        R visitVariableExpr(Variable expr);
        R visitCallExpr(Call expr);
        R visitIndexExpr(Index expr);
    }

    public static final class Binary implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Binary(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }
    }

    public static final class Unary implements ExprInterface {
        public final Token operator;
        public final ExprInterface right;

        public Unary(Token operator, ExprInterface right) {
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }
    }

    /** Short-circuit and/or. */
    public static final class Logical implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Logical(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLogicalExpr(this);
        }
    }

    public static final class Literal implements ExprInterface {
        public final Value value;

        public Literal(Value value) {
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }
    }

    public static final class ListLiteral implements ExprInterface {
        public final List<ExprInterface> items;

        public ListLiteral(List<ExprInterface> items) {
            this.items = items;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitListLiteralExpr(this);
        }
    }

    public static final class DictLiteral implements ExprInterface {
        public final LinkedHashMap<String, ExprInterface> entries; // deterministic order

        public DictLiteral(LinkedHashMap<String, ExprInterface> entries) {
            this.entries = entries;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitDictLiteralExpr(this);
        }
    }

    public static final class Variable implements ExprInterface {
        public final Token name;

        public Variable(Token name) {
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVariableExpr(this);
        }
    }

    /** Call of a builtin function: name(args...). */
    public static final class Call implements ExprInterface {
        public final Token name;
        public final List<ExprInterface> arguments;

        public Call(Token name, List<ExprInterface> arguments) {
            this.name = name;
            this.arguments = arguments;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }
    }

    public static final class Index implements ExprInterface {
        public final ExprInterface target;
        public final ExprInterface index;
        public final Token bracket;

        public Index(ExprInterface target, ExprInterface index, Token bracket) {
            this.target = target;
            this.index = index;
            this.bracket = bracket;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIndexExpr(this);
        }
    }
}
