package com.sheetcalc.app.formula.parser;

import com.sheetcalc.app.exceptions.FormulaParseException;
import com.sheetcalc.app.models.ErrorKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Splits formula text into tokens. Positions are offsets into the full
 * input, so errors point at the character the user typed.
 */
final class Tokenizer {
    private final String input;
    private int index;

    Tokenizer(String input, int start) {
        this.input = input;
        this.index = start;
    }

    List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = next();
            tokens.add(token);
        } while (!token.is(TokenType.EOF));
        return tokens;
    }

    private Token next() {
        skipWhitespace();
        if (index >= input.length()) {
            return new Token(TokenType.EOF, "", index);
        }
        char current = input.charAt(index);
        if (isDigitAt(index) || (current == '.' && isDigitAt(index + 1))) {
            return readNumber();
        }
        if (current == '"') {
            return readString();
        }
        if (current == '\'') {
            return readQuotedSheet();
        }
        if (current == '#') {
            return readError();
        }
        if (Character.isLetter(current) || current == '_' || current == '$') {
            return readIdentifier();
        }
        int start = index;
        if (current == '<' && peek('=')) {
            index += 2;
            return new Token(TokenType.LE, "<=", start);
        }
        if (current == '<' && peek('>')) {
            index += 2;
            return new Token(TokenType.NE, "<>", start);
        }
        if (current == '>' && peek('=')) {
            index += 2;
            return new Token(TokenType.GE, ">=", start);
        }
        index++;
        switch (current) {
            case '+':
                return new Token(TokenType.PLUS, "+", start);
            case '-':
                return new Token(TokenType.MINUS, "-", start);
            case '*':
                return new Token(TokenType.STAR, "*", start);
            case '/':
                return new Token(TokenType.SLASH, "/", start);
            case '^':
                return new Token(TokenType.CARET, "^", start);
            case '&':
                return new Token(TokenType.AMPERSAND, "&", start);
            case '%':
                return new Token(TokenType.PERCENT, "%", start);
            case '=':
                return new Token(TokenType.EQ, "=", start);
            case '<':
                return new Token(TokenType.LT, "<", start);
            case '>':
                return new Token(TokenType.GT, ">", start);
            case '(':
                return new Token(TokenType.LPAREN, "(", start);
            case ')':
                return new Token(TokenType.RPAREN, ")", start);
            case ',':
                return new Token(TokenType.COMMA, ",", start);
            case ':':
                return new Token(TokenType.COLON, ":", start);
            default:
                throw new FormulaParseException("Unexpected character '" + current + "'", start);
        }
    }

    private Token readNumber() {
        int start = index;
        while (isDigitAt(index)) {
            index++;
        }
        if (index < input.length() && input.charAt(index) == '.') {
            index++;
            while (isDigitAt(index)) {
                index++;
            }
        }
        if (index < input.length() && (input.charAt(index) == 'e' || input.charAt(index) == 'E')) {
            int mark = index;
            index++;
            if (index < input.length() && (input.charAt(index) == '+' || input.charAt(index) == '-')) {
                index++;
            }
            if (isDigitAt(index)) {
                while (isDigitAt(index)) {
                    index++;
                }
            } else {
                // not an exponent after all, e.g. "2E" followed by something else
                index = mark;
            }
        }
        return new Token(TokenType.NUMBER, input.substring(start, index), start);
    }

    private Token readString() {
        int start = index;
        index++;
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (index >= input.length()) {
                throw new FormulaParseException("Unterminated string", start);
            }
            char c = input.charAt(index);
            if (c == '"') {
                if (peek('"')) {
                    sb.append('"');
                    index += 2;
                    continue;
                }
                index++;
                return new Token(TokenType.STRING, sb.toString(), start);
            }
            sb.append(c);
            index++;
        }
    }

    private Token readQuotedSheet() {
        int start = index;
        index++;
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (index >= input.length()) {
                throw new FormulaParseException("Unterminated sheet name", start);
            }
            char c = input.charAt(index);
            if (c == '\'') {
                if (peek('\'')) {
                    sb.append('\'');
                    index += 2;
                    continue;
                }
                index++;
                break;
            }
            sb.append(c);
            index++;
        }
        if (index >= input.length() || input.charAt(index) != '!') {
            throw new FormulaParseException("Expected '!' after sheet name", index);
        }
        index++;
        if (sb.length() == 0) {
            throw new FormulaParseException("Empty sheet name", start);
        }
        return new Token(TokenType.SHEET, sb.toString(), start);
    }

    private Token readError() {
        int start = index;
        String rest = input.substring(index).toUpperCase(Locale.ROOT);
        for (ErrorKind kind : ErrorKind.values()) {
            if (rest.startsWith(kind.getCode())) {
                index += kind.getCode().length();
                return new Token(TokenType.ERROR, kind.getCode(), start);
            }
        }
        throw new FormulaParseException("Unknown error literal", start);
    }

    private Token readIdentifier() {
        int start = index;
        index++;
        while (index < input.length()) {
            char c = input.charAt(index);
            if (!Character.isLetterOrDigit(c) && c != '_' && c != '.' && c != '$') {
                break;
            }
            index++;
        }
        String word = input.substring(start, index);
        if (index < input.length() && input.charAt(index) == '!') {
            if (word.indexOf('$') >= 0) {
                throw new FormulaParseException("Invalid sheet name '" + word + "'", start);
            }
            index++;
            return new Token(TokenType.SHEET, word, start);
        }
        return new Token(TokenType.IDENT, word, start);
    }

    private void skipWhitespace() {
        while (index < input.length() && Character.isWhitespace(input.charAt(index))) {
            index++;
        }
    }

    private boolean peek(char expected) {
        return index + 1 < input.length() && input.charAt(index + 1) == expected;
    }

    private boolean isDigitAt(int i) {
        return i < input.length() && input.charAt(i) >= '0' && input.charAt(i) <= '9';
    }
}
