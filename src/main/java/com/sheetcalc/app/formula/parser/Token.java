package com.sheetcalc.app.formula.parser;

/**
 * A lexical token. For STRING and SHEET tokens the text is the unescaped
 * content; for everything else it is the source text.
 */
final class Token {
    private final TokenType type;
    private final String text;
    private final int position;

    Token(TokenType type, String text, int position) {
        this.type = type;
        this.text = text;
        this.position = position;
    }

    TokenType getType() {
        return type;
    }

    String getText() {
        return text;
    }

    /** Offset of the token's first character in the formula text. */
    int getPosition() {
        return position;
    }

    boolean is(TokenType other) {
        return type == other;
    }

    @Override
    public String toString() {
        return type == TokenType.EOF ? "end of formula" : "'" + text + "'";
    }
}
