package dev.flows.condition;

record Token(TokenType type, String text, Object literal, int position) {

    boolean is(TokenType other) {
        return type == other;
    }
}
