package dev.flows.condition;

enum TokenType {
    NUMBER, STRING, IDENTIFIER,
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACKET, RIGHT_BRACKET,
    COMMA, DOT, OPTIONAL_DOT, QUESTION, COLON, ARROW,
    BANG, MINUS, PLUS, STAR, SLASH, PERCENT,
    LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,
    EQUAL_EQUAL, BANG_EQUAL, STRICT_EQUAL, STRICT_NOT_EQUAL,
    AND_AND, OR_OR,
    EOF
}
