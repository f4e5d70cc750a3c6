package dev.flows.condition;

import java.util.ArrayList;
import java.util.List;

/**
 * Syntax tree of a condition expression. Each node evaluates itself against a scope.
 */
sealed interface Expr {

    Object evaluate(Scope scope);

    record Literal(Object value) implements Expr {
        @Override
        public Object evaluate(Scope scope) {
            return value;
        }
    }

    record Identifier(String name) implements Expr {
        @Override
        public Object evaluate(Scope scope) {
            return scope.lookup(name);
        }
    }

    record Member(Expr target, String name, boolean optional) implements Expr {
        @Override
        public Object evaluate(Scope scope) {
            return Values.member(target.evaluate(scope), name, optional);
        }
    }

    record Index(Expr target, Expr key, boolean optional) implements Expr {
        @Override
        public Object evaluate(Scope scope) {
            Object base = target.evaluate(scope);
            return Values.index(base, key.evaluate(scope), optional);
        }
    }

    record Call(Expr target, String method, List<Expr> args, boolean optional) implements Expr {
        @Override
        public Object evaluate(Scope scope) {
            Object base = target.evaluate(scope);
            List<Object> values = new ArrayList<>(args.size());
            for (Expr arg : args) {
                values.add(arg.evaluate(scope));
            }
            return Values.invoke(base, method, values, optional);
        }
    }

    record Unary(TokenType operator, Expr operand) implements Expr {
        @Override
        public Object evaluate(Scope scope) {
            Object value = operand.evaluate(scope);
            return operator == TokenType.BANG ? !Values.truthy(value) : -Values.toNumber(value);
        }
    }

    record Binary(TokenType operator, Expr left, Expr right) implements Expr {
        @Override
        public Object evaluate(Scope scope) {
            Object a = left.evaluate(scope);
            Object b = right.evaluate(scope);
            return switch (operator) {
                case STRICT_EQUAL -> Values.strictEquals(a, b);
                case STRICT_NOT_EQUAL -> !Values.strictEquals(a, b);
                case EQUAL_EQUAL -> Values.looseEquals(a, b);
                case BANG_EQUAL -> !Values.looseEquals(a, b);
                case LESS -> Values.compare("<", a, b);
                case LESS_EQUAL -> Values.compare("<=", a, b);
                case GREATER -> Values.compare(">", a, b);
                case GREATER_EQUAL -> Values.compare(">=", a, b);
                case PLUS -> Values.arithmetic("+", a, b);
                case MINUS -> Values.arithmetic("-", a, b);
                case STAR -> Values.arithmetic("*", a, b);
                case SLASH -> Values.arithmetic("/", a, b);
                case PERCENT -> Values.arithmetic("%", a, b);
                default -> throw new IllegalStateException("Unsupported binary operator: " + operator);
            };
        }
    }

    /** {@code &&} and {@code ||}: short-circuit and yield an operand, not a boolean. */
    record Logical(TokenType operator, Expr left, Expr right) implements Expr {
        @Override
        public Object evaluate(Scope scope) {
            Object a = left.evaluate(scope);
            if (operator == TokenType.AND_AND) {
                return Values.truthy(a) ? right.evaluate(scope) : a;
            }
            return Values.truthy(a) ? a : right.evaluate(scope);
        }
    }

    record Conditional(Expr test, Expr whenTrue, Expr whenFalse) implements Expr {
        @Override
        public Object evaluate(Scope scope) {
            return Values.truthy(test.evaluate(scope)) ? whenTrue.evaluate(scope) : whenFalse.evaluate(scope);
        }
    }

    record ArrayLiteral(List<Expr> elements) implements Expr {
        @Override
        public Object evaluate(Scope scope) {
            List<Object> values = new ArrayList<>(elements.size());
            for (Expr element : elements) {
                values.add(element.evaluate(scope));
            }
            return values;
        }
    }

    record Lambda(String parameter, Expr body) implements Expr {
        @Override
        public Object evaluate(Scope scope) {
            return (ScriptFunction) argument -> body.evaluate(scope.child(parameter, argument));
        }
    }
}
