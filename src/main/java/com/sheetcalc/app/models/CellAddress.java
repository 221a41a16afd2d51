package com.sheetcalc.app.models;

import java.util.Comparator;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Coordinates of a cell: sheet name plus 1-based row and column.
 * Ordered ascending by sheet name, then row, then column.
 */
public final class CellAddress implements Comparable<CellAddress> {

    public static final int MAX_ROWS = 1_048_576;
    public static final int MAX_COLUMNS = 16_384;

    private static final Pattern A1_PATTERN = Pattern.compile("^\\$?([A-Za-z]{1,3})\\$?(\\d{1,7})$");

    private static final Comparator<CellAddress> ORDER = Comparator
            .comparing(CellAddress::getSheet)
            .thenComparingInt(CellAddress::getRow)
            .thenComparingInt(CellAddress::getCol);

    private final String sheet;
    private final int row;
    private final int col;

    public CellAddress(String sheet, int row, int col) {
        this.sheet = Objects.requireNonNull(sheet);
        this.row = row;
        this.col = col;
    }

    /**
     * Parses an A1-style reference ("B7", "$B$7") on the given sheet.
     * Returns null if the text is not a valid in-bounds reference.
     */
    public static CellAddress parse(String sheet, String a1) {
        Matcher matcher = A1_PATTERN.matcher(a1.trim());
        if (!matcher.matches()) {
            return null;
        }
        int col = columnNameToNumber(matcher.group(1));
        long row = Long.parseLong(matcher.group(2));
        if (col < 1 || col > MAX_COLUMNS || row < 1 || row > MAX_ROWS) {
            return null;
        }
        return new CellAddress(sheet, (int) row, col);
    }

    /** "A" -> 1, "Z" -> 26, "AA" -> 27. Case-insensitive. */
    public static int columnNameToNumber(String name) {
        int result = 0;
        for (int i = 0; i < name.length(); i++) {
            char c = Character.toUpperCase(name.charAt(i));
            if (c < 'A' || c > 'Z') {
                throw new IllegalArgumentException("Invalid column name: " + name);
            }
            result = result * 26 + (c - 'A' + 1);
        }
        return result;
    }

    /** 1 -> "A", 27 -> "AA". */
    public static String columnNumberToName(int number) {
        if (number < 1) {
            throw new IllegalArgumentException("Invalid column number: " + number);
        }
        StringBuilder sb = new StringBuilder();
        int n = number;
        while (n > 0) {
            int rem = (n - 1) % 26;
            sb.append((char) ('A' + rem));
            n = (n - 1) / 26;
        }
        return sb.reverse().toString();
    }

    public String getSheet() {
        return sheet;
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    /** "B7", without the sheet. */
    public String toA1() {
        return columnNumberToName(col) + row;
    }

    @Override
    public int compareTo(CellAddress other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellAddress)) {
            return false;
        }
        CellAddress that = (CellAddress) o;
        return row == that.row && col == that.col && sheet.equals(that.sheet);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sheet, row, col);
    }

    @Override
    public String toString() {
        return sheet + "!" + toA1();
    }
}
