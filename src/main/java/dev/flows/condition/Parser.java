package dev.flows.condition;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for the condition language.
 *
 * <pre>
 * expression     := logicalOr ( "?" expression ":" expression )?
 * logicalOr      := logicalAnd ( "||" logicalAnd )*
 * logicalAnd     := equality ( "&&" equality )*
 * equality       := relational ( ( "===" | "!==" | "==" | "!=" ) relational )*
 * relational     := additive ( ( "<" | "<=" | ">" | ">=" ) additive )*
 * additive       := multiplicative ( ( "+" | "-" ) multiplicative )*
 * multiplicative := unary ( ( "*" | "/" | "%" ) unary )*
 * unary          := ( "!" | "-" ) unary | postfix
 * postfix        := primary ( "." name | "?." name | "[" expression "]" | "(" arguments ")" )*
 * primary        := number | string | true | false | null | undefined
 *                 | name "=>" expression | "(" name ")" "=>" expression
 *                 | name | "(" expression ")" | "[" ( expression ( "," expression )* )? "]"
 * </pre>
 *
 * Calls are only allowed as method calls on a value ({@code list.every(x => x)}).
 */
final class Parser {

    private final List<Token> tokens;
    private int current;

    private Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    static Expr parse(String source) {
        var parser = new Parser(new Lexer(source).tokenize());
        Expr expr = parser.expression();
        if (!parser.check(TokenType.EOF)) {
            throw parser.error("Unexpected token '" + parser.peek().text() + "'");
        }
        return expr;
    }

    private Expr expression() {
        Expr test = logicalOr();
        if (match(TokenType.QUESTION)) {
            Expr whenTrue = expression();
            consume(TokenType.COLON, "Expected ':' in conditional expression");
            Expr whenFalse = expression();
            return new Expr.Conditional(test, whenTrue, whenFalse);
        }
        return test;
    }

    private Expr logicalOr() {
        Expr expr = logicalAnd();
        while (match(TokenType.OR_OR)) {
            expr = new Expr.Logical(TokenType.OR_OR, expr, logicalAnd());
        }
        return expr;
    }

    private Expr logicalAnd() {
        Expr expr = equality();
        while (match(TokenType.AND_AND)) {
            expr = new Expr.Logical(TokenType.AND_AND, expr, equality());
        }
        return expr;
    }

    private Expr equality() {
        Expr expr = relational();
        while (check(TokenType.STRICT_EQUAL) || check(TokenType.STRICT_NOT_EQUAL)
            || check(TokenType.EQUAL_EQUAL) || check(TokenType.BANG_EQUAL)) {
            TokenType op = advance().type();
            expr = new Expr.Binary(op, expr, relational());
        }
        return expr;
    }

    private Expr relational() {
        Expr expr = additive();
        while (check(TokenType.LESS) || check(TokenType.LESS_EQUAL)
            || check(TokenType.GREATER) || check(TokenType.GREATER_EQUAL)) {
            TokenType op = advance().type();
            expr = new Expr.Binary(op, expr, additive());
        }
        return expr;
    }

    private Expr additive() {
        Expr expr = multiplicative();
        while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            TokenType op = advance().type();
            expr = new Expr.Binary(op, expr, multiplicative());
        }
        return expr;
    }

    private Expr multiplicative() {
        Expr expr = unary();
        while (check(TokenType.STAR) || check(TokenType.SLASH) || check(TokenType.PERCENT)) {
            TokenType op = advance().type();
            expr = new Expr.Binary(op, expr, unary());
        }
        return expr;
    }

    private Expr unary() {
        if (check(TokenType.BANG) || check(TokenType.MINUS)) {
            TokenType op = advance().type();
            return new Expr.Unary(op, unary());
        }
        return postfix();
    }

    private Expr postfix() {
        Expr expr = primary();
        while (true) {
            if (match(TokenType.DOT)) {
                expr = new Expr.Member(expr, name("Expected property name after '.'"), false);
            } else if (match(TokenType.OPTIONAL_DOT)) {
                if (match(TokenType.LEFT_BRACKET)) {
                    Expr key = expression();
                    consume(TokenType.RIGHT_BRACKET, "Expected ']'");
                    expr = new Expr.Index(expr, key, true);
                } else {
                    expr = new Expr.Member(expr, name("Expected property name after '?.'"), true);
                }
            } else if (match(TokenType.LEFT_BRACKET)) {
                Expr key = expression();
                consume(TokenType.RIGHT_BRACKET, "Expected ']'");
                expr = new Expr.Index(expr, key, false);
            } else if (check(TokenType.LEFT_PAREN)) {
                if (!(expr instanceof Expr.Member member)) {
                    throw error("Only method calls are allowed");
                }
                advance();
                expr = new Expr.Call(member.target(), member.name(), arguments(), member.optional());
            } else {
                return expr;
            }
        }
    }

    private List<Expr> arguments() {
        List<Expr> args = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                args.add(expression());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expected ')' after arguments");
        return args;
    }

    private Expr primary() {
        Token token = peek();
        switch (token.type()) {
            case NUMBER, STRING -> {
                advance();
                return new Expr.Literal(token.literal());
            }
            case IDENTIFIER -> {
                advance();
                if (match(TokenType.ARROW)) {
                    return new Expr.Lambda(token.text(), expression());
                }
                return switch (token.text()) {
                    case "true" -> new Expr.Literal(Boolean.TRUE);
                    case "false" -> new Expr.Literal(Boolean.FALSE);
                    case "null" -> new Expr.Literal(null);
                    case "undefined" -> new Expr.Literal(Values.UNDEFINED);
                    default -> new Expr.Identifier(token.text());
                };
            }
            case LEFT_PAREN -> {
                advance();
                if (check(TokenType.IDENTIFIER) && peekAt(1).is(TokenType.RIGHT_PAREN) && peekAt(2).is(TokenType.ARROW)) {
                    String parameter = advance().text();
                    advance();
                    advance();
                    return new Expr.Lambda(parameter, expression());
                }
                Expr inner = expression();
                consume(TokenType.RIGHT_PAREN, "Expected ')'");
                return inner;
            }
            case LEFT_BRACKET -> {
                advance();
                List<Expr> elements = new ArrayList<>();
                if (!check(TokenType.RIGHT_BRACKET)) {
                    do {
                        elements.add(expression());
                    } while (match(TokenType.COMMA));
                }
                consume(TokenType.RIGHT_BRACKET, "Expected ']' after array elements");
                return new Expr.ArrayLiteral(elements);
            }
            case EOF -> throw error("Unexpected end of expression");
            default -> throw error("Unexpected token '" + token.text() + "'");
        }
    }

    private String name(String message) {
        if (!check(TokenType.IDENTIFIER)) {
            throw error(message);
        }
        return advance().text();
    }

    private void consume(TokenType type, String message) {
        if (!check(type)) {
            throw error(message);
        }
        advance();
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().is(type);
    }

    private Token advance() {
        Token token = tokens.get(current);
        if (!token.is(TokenType.EOF)) {
            current++;
        }
        return token;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token peekAt(int offset) {
        return tokens.get(Math.min(current + offset, tokens.size() - 1));
    }

    private ConditionSyntaxException error(String message) {
        return new ConditionSyntaxException(message, peek().position());
    }
}
