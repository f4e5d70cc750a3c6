package dev.flows.condition;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits condition text into tokens.
 */
final class Lexer {

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start;
    private int current;

    Lexer(String source) {
        this.source = source;
    }

    List<Token> tokenize() {
        while (!atEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", null, current));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case ' ', '\t', '\r', '\n' -> { }
            case '(' -> add(TokenType.LEFT_PAREN);
            case ')' -> add(TokenType.RIGHT_PAREN);
            case '[' -> add(TokenType.LEFT_BRACKET);
            case ']' -> add(TokenType.RIGHT_BRACKET);
            case ',' -> add(TokenType.COMMA);
            case ':' -> add(TokenType.COLON);
            case '+' -> add(TokenType.PLUS);
            case '-' -> add(TokenType.MINUS);
            case '*' -> add(TokenType.STAR);
            case '/' -> add(TokenType.SLASH);
            case '%' -> add(TokenType.PERCENT);
            case '.' -> {
                if (isDigit(peek())) {
                    number();
                } else {
                    add(TokenType.DOT);
                }
            }
            case '?' -> {
                // "?." is optional chaining unless a digit follows ("a ?.5 : b")
                if (peek() == '.' && !isDigit(peekNext())) {
                    current++;
                    add(TokenType.OPTIONAL_DOT);
                } else {
                    add(TokenType.QUESTION);
                }
            }
            case '!' -> {
                if (match('=')) {
                    add(match('=') ? TokenType.STRICT_NOT_EQUAL : TokenType.BANG_EQUAL);
                } else {
                    add(TokenType.BANG);
                }
            }
            case '=' -> {
                if (match('>')) {
                    add(TokenType.ARROW);
                } else if (match('=')) {
                    add(match('=') ? TokenType.STRICT_EQUAL : TokenType.EQUAL_EQUAL);
                } else {
                    throw new ConditionSyntaxException("Assignment is not allowed in conditions", start);
                }
            }
            case '<' -> add(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS);
            case '>' -> add(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER);
            case '&' -> {
                if (!match('&')) {
                    throw new ConditionSyntaxException("Unexpected character '&'", start);
                }
                add(TokenType.AND_AND);
            }
            case '|' -> {
                if (!match('|')) {
                    throw new ConditionSyntaxException("Unexpected character '|'", start);
                }
                add(TokenType.OR_OR);
            }
            case '\'', '"' -> string(c);
            default -> {
                if (isDigit(c)) {
                    number();
                } else if (isIdentifierStart(c)) {
                    identifier();
                } else {
                    throw new ConditionSyntaxException("Unexpected character '" + c + "'", start);
                }
            }
        }
    }

    private void string(char quote) {
        var sb = new StringBuilder();
        while (!atEnd() && peek() != quote) {
            char c = advance();
            if (c == '\\') {
                if (atEnd()) {
                    break;
                }
                char escaped = advance();
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    default -> sb.append(escaped);
                }
            } else {
                sb.append(c);
            }
        }
        if (atEnd()) {
            throw new ConditionSyntaxException("Unterminated string", start);
        }
        current++; // closing quote
        tokens.add(new Token(TokenType.STRING, source.substring(start, current), sb.toString(), start));
    }

    private void number() {
        while (isDigit(peek())) {
            current++;
        }
        if (peek() == '.' && isDigit(peekNext())) {
            current++;
            while (isDigit(peek())) {
                current++;
            }
        }
        String text = source.substring(start, current);
        tokens.add(new Token(TokenType.NUMBER, text, Double.parseDouble(text), start));
    }

    private void identifier() {
        while (isIdentifierPart(peek())) {
            current++;
        }
        add(TokenType.IDENTIFIER);
    }

    private void add(TokenType type) {
        tokens.add(new Token(type, source.substring(start, current), null, start));
    }

    private boolean match(char expected) {
        if (atEnd() || source.charAt(current) != expected) {
            return false;
        }
        current++;
        return true;
    }

    private char advance() {
        return source.charAt(current++);
    }

    private char peek() {
        return atEnd() ? '\0' : source.charAt(current);
    }

    private char peekNext() {
        return current + 1 >= source.length() ? '\0' : source.charAt(current + 1);
    }

    private boolean atEnd() {
        return current >= source.length();
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}
