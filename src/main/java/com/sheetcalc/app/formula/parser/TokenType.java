package com.sheetcalc.app.formula.parser;

enum TokenType {
    NUMBER,
    STRING,
    ERROR,
    IDENT,
    SHEET,
    PLUS,
    MINUS,
    STAR,
    SLASH,
    CARET,
    AMPERSAND,
    PERCENT,
    EQ,
    NE,
    LT,
    LE,
    GT,
    GE,
    LPAREN,
    RPAREN,
    COMMA,
    COLON,
    EOF
}
