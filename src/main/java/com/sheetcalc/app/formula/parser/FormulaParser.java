package com.sheetcalc.app.formula.parser;

import com.sheetcalc.app.exceptions.FormulaParseException;
import com.sheetcalc.app.formula.ast.*;
import com.sheetcalc.app.models.CellAddress;
import com.sheetcalc.app.models.ErrorKind;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recursive-descent parser for spreadsheet formulas.
 *
 * Precedence, lowest first:
 * comparison, '&', '+'/'-', '*'/'/', '^', unary '-'/'+', postfix '%', primary.
 * All binary levels are left associative.
 */
public final class FormulaParser {

    private static final Pattern CELL_REF = Pattern.compile("^(\\$?)([A-Za-z]{1,3})(\\$?)([0-9]+)$");
    private static final Pattern FUNCTION_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_.]*$");

    private final List<Token> tokens;
    private int current;

    private FormulaParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses formula text into an AST. A single leading '=' is optional.
     *
     * @throws FormulaParseException with the offending position on any syntax error
     */
    public static AstNode parse(String text) {
        if (text == null) {
            throw new FormulaParseException("Empty expression", 0);
        }
        int start = 0;
        while (start < text.length() && Character.isWhitespace(text.charAt(start))) {
            start++;
        }
        if (start < text.length() && text.charAt(start) == '=') {
            start++;
        }
        FormulaParser parser = new FormulaParser(new Tokenizer(text, start).tokenize());
        if (parser.peek().is(TokenType.EOF)) {
            throw new FormulaParseException("Empty expression", parser.peek().getPosition());
        }
        AstNode node = parser.parseComparison();
        Token trailing = parser.peek();
        if (!trailing.is(TokenType.EOF)) {
            if (trailing.is(TokenType.RPAREN)) {
                throw new FormulaParseException("Unbalanced parentheses: unexpected ')'", trailing.getPosition());
            }
            throw new FormulaParseException("Unexpected token " + trailing, trailing.getPosition());
        }
        return node;
    }

    private AstNode parseComparison() {
        AstNode expr = parseConcat();
        while (true) {
            BinaryOperator op = comparisonOperator(peek().getType());
            if (op == null) {
                return expr;
            }
            advance();
            expr = new BinaryOp(op, expr, parseConcat());
        }
    }

    private static BinaryOperator comparisonOperator(TokenType type) {
        switch (type) {
            case EQ:
                return BinaryOperator.EQUAL;
            case NE:
                return BinaryOperator.NOT_EQUAL;
            case LT:
                return BinaryOperator.LESS;
            case LE:
                return BinaryOperator.LESS_OR_EQUAL;
            case GT:
                return BinaryOperator.GREATER;
            case GE:
                return BinaryOperator.GREATER_OR_EQUAL;
            default:
                return null;
        }
    }

    private AstNode parseConcat() {
        AstNode expr = parseAdditive();
        while (match(TokenType.AMPERSAND)) {
            expr = new BinaryOp(BinaryOperator.CONCAT, expr, parseAdditive());
        }
        return expr;
    }

    private AstNode parseAdditive() {
        AstNode expr = parseMultiplicative();
        while (true) {
            if (match(TokenType.PLUS)) {
                expr = new BinaryOp(BinaryOperator.ADD, expr, parseMultiplicative());
            } else if (match(TokenType.MINUS)) {
                expr = new BinaryOp(BinaryOperator.SUBTRACT, expr, parseMultiplicative());
            } else {
                return expr;
            }
        }
    }

    private AstNode parseMultiplicative() {
        AstNode expr = parsePower();
        while (true) {
            if (match(TokenType.STAR)) {
                expr = new BinaryOp(BinaryOperator.MULTIPLY, expr, parsePower());
            } else if (match(TokenType.SLASH)) {
                expr = new BinaryOp(BinaryOperator.DIVIDE, expr, parsePower());
            } else {
                return expr;
            }
        }
    }

    private AstNode parsePower() {
        AstNode expr = parseUnary();
        while (match(TokenType.CARET)) {
            expr = new BinaryOp(BinaryOperator.POWER, expr, parseUnary());
        }
        return expr;
    }

    private AstNode parseUnary() {
        if (match(TokenType.MINUS)) {
            return new UnaryOp(UnaryOperator.NEGATE, parseUnary());
        }
        if (match(TokenType.PLUS)) {
            return new UnaryOp(UnaryOperator.PLUS, parseUnary());
        }
        return parsePostfix();
    }

    private AstNode parsePostfix() {
        AstNode expr = parsePrimary();
        while (match(TokenType.PERCENT)) {
            expr = new UnaryOp(UnaryOperator.PERCENT, expr);
        }
        return expr;
    }

    private AstNode parsePrimary() {
        Token token = peek();
        switch (token.getType()) {
            case NUMBER:
                advance();
                return Literal.number(parseNumber(token));
            case STRING:
                advance();
                return Literal.text(token.getText());
            case ERROR:
                advance();
                return new ErrorLiteral(ErrorKind.fromCode(token.getText()));
            case LPAREN:
                advance();
                AstNode inner = parseComparison();
                expectClosingParen();
                return inner;
            case SHEET:
                advance();
                return parseReference(token.getText(), expectReferenceToken());
            case IDENT:
                advance();
                if (peek().is(TokenType.LPAREN)) {
                    return parseFunctionCall(token);
                }
                if ("TRUE".equalsIgnoreCase(token.getText())) {
                    return Literal.bool(true);
                }
                if ("FALSE".equalsIgnoreCase(token.getText())) {
                    return Literal.bool(false);
                }
                if (CELL_REF.matcher(token.getText()).matches()) {
                    return parseReference(null, token);
                }
                throw new FormulaParseException("Unknown identifier '" + token.getText() + "'", token.getPosition());
            case RPAREN:
                throw new FormulaParseException("Unbalanced parentheses: unexpected ')'", token.getPosition());
            case EOF:
                throw new FormulaParseException("Unexpected end of formula", token.getPosition());
            default:
                throw new FormulaParseException("Unexpected token " + token, token.getPosition());
        }
    }

    private AstNode parseFunctionCall(Token name) {
        if (!FUNCTION_NAME.matcher(name.getText()).matches()) {
            throw new FormulaParseException("Invalid function name '" + name.getText() + "'", name.getPosition());
        }
        advance(); // '('
        List<AstNode> args = new ArrayList<>();
        if (!peek().is(TokenType.RPAREN)) {
            do {
                args.add(parseComparison());
            } while (match(TokenType.COMMA));
        }
        expectClosingParen();
        return new FunctionCall(name.getText(), args);
    }

    /**
     * Parses a cell reference (already consumed as refToken) and an optional
     * ":ref" tail making it a range.
     */
    private AstNode parseReference(String sheet, Token refToken) {
        CellRef start = toCellRef(sheet, refToken);
        if (!match(TokenType.COLON)) {
            return start;
        }
        Token next = peek();
        String endSheet = null;
        if (next.is(TokenType.SHEET)) {
            advance();
            endSheet = next.getText();
            if (sheet == null || !sheet.equalsIgnoreCase(endSheet)) {
                throw new FormulaParseException("A range must stay on a single sheet", next.getPosition());
            }
        }
        CellRef end = toCellRef(endSheet, expectReferenceToken());
        return new RangeRef(start, end);
    }

    private Token expectReferenceToken() {
        Token token = peek();
        if (!token.is(TokenType.IDENT) || !CELL_REF.matcher(token.getText()).matches()) {
            throw new FormulaParseException("Expected a cell reference but found " + token, token.getPosition());
        }
        advance();
        return token;
    }

    private static CellRef toCellRef(String sheet, Token token) {
        Matcher m = CELL_REF.matcher(token.getText());
        if (!m.matches()) {
            throw new FormulaParseException("Invalid cell reference '" + token.getText() + "'", token.getPosition());
        }
        int col = CellAddress.columnNameToNumber(m.group(2));
        long row = m.group(4).length() > 7 ? Long.MAX_VALUE : Long.parseLong(m.group(4));
        if (col > CellAddress.MAX_COLUMNS || row < 1 || row > CellAddress.MAX_ROWS) {
            throw new FormulaParseException("Cell reference out of range '" + token.getText() + "'", token.getPosition());
        }
        return new CellRef(sheet, col, (int) row, !m.group(1).isEmpty(), !m.group(3).isEmpty());
    }

    private static double parseNumber(Token token) {
        double value;
        try {
            value = Double.parseDouble(token.getText());
        } catch (NumberFormatException e) {
            throw new FormulaParseException("Invalid number '" + token.getText() + "'", token.getPosition());
        }
        if (Double.isInfinite(value)) {
            throw new FormulaParseException("Number out of range '" + token.getText() + "'", token.getPosition());
        }
        return value;
    }

    private void expectClosingParen() {
        Token token = peek();
        if (!token.is(TokenType.RPAREN)) {
            throw new FormulaParseException("Unbalanced parentheses: expected ')' but found " + token, token.getPosition());
        }
        advance();
    }

    private Token peek() {
        return tokens.get(current);
    }

    private void advance() {
        if (current < tokens.size() - 1) {
            current++;
        }
    }

    private boolean match(TokenType type) {
        if (peek().is(type)) {
            advance();
            return true;
        }
        return false;
    }
}
