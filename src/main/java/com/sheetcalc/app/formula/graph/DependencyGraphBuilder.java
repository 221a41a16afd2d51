package com.sheetcalc.app.formula.graph;

import com.sheetcalc.app.formula.ast.*;
import com.sheetcalc.app.models.CellAddress;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the {@link DependencyGraph} of a workbook's formula cells from their
 * parsed formulas. Only references to other formula cells become edges;
 * plain values never need ordering.
 */
public final class DependencyGraphBuilder {

    private DependencyGraphBuilder() {
    }

    /**
     * @param formulas   parsed formula of every formula cell, by address
     * @param sheetNames the workbook's sheets, for resolving sheet prefixes
     */
    public static DependencyGraph build(Map<CellAddress, AstNode> formulas, List<String> sheetNames) {
        DependencyGraph graph = new DependencyGraph();
        Map<String, List<CellAddress>> formulasBySheet = new HashMap<>();
        for (CellAddress cell : formulas.keySet()) {
            graph.addNode(cell);
            formulasBySheet.computeIfAbsent(cell.getSheet(), k -> new ArrayList<>()).add(cell);
        }

        for (Map.Entry<CellAddress, AstNode> entry : formulas.entrySet()) {
            CellAddress cell = entry.getKey();
            for (AstNode ref : collectReferences(entry.getValue())) {
                if (ref instanceof CellRef) {
                    CellRef cellRef = (CellRef) ref;
                    String sheet = resolveSheet(cellRef.getSheet(), cell.getSheet(), sheetNames);
                    if (sheet == null) {
                        continue;
                    }
                    CellAddress target = new CellAddress(sheet, cellRef.getRow(), cellRef.getCol());
                    if (graph.contains(target)) {
                        graph.addEdge(target, cell);
                    }
                } else {
                    RangeRef range = (RangeRef) ref;
                    String sheet = resolveSheet(range.getSheet(), cell.getSheet(), sheetNames);
                    if (sheet == null) {
                        continue;
                    }
                    for (CellAddress target : formulaCellsIn(range, sheet, graph, formulasBySheet)) {
                        graph.addEdge(target, cell);
                    }
                }
            }
        }
        return graph;
    }

    /**
     * Formula cells inside a range. Small ranges are enumerated; ranges
     * larger than the sheet's formula count are matched by containment.
     */
    private static List<CellAddress> formulaCellsIn(RangeRef range, String sheet, DependencyGraph graph,
                                                    Map<String, List<CellAddress>> formulasBySheet) {
        List<CellAddress> sheetFormulas = formulasBySheet.get(sheet);
        List<CellAddress> result = new ArrayList<>();
        if (sheetFormulas == null) {
            return result;
        }
        long area = (long) range.getRowCount() * range.getColCount();
        if (area <= sheetFormulas.size()) {
            for (int row = range.getFirstRow(); row <= range.getLastRow(); row++) {
                for (int col = range.getFirstCol(); col <= range.getLastCol(); col++) {
                    CellAddress target = new CellAddress(sheet, row, col);
                    if (graph.contains(target)) {
                        result.add(target);
                    }
                }
            }
        } else {
            for (CellAddress candidate : sheetFormulas) {
                if (candidate.getRow() >= range.getFirstRow() && candidate.getRow() <= range.getLastRow()
                        && candidate.getCol() >= range.getFirstCol() && candidate.getCol() <= range.getLastCol()) {
                    result.add(candidate);
                }
            }
        }
        return result;
    }

    private static String resolveSheet(String referenced, String current, List<String> sheetNames) {
        String name = referenced == null ? current : referenced;
        for (String sheet : sheetNames) {
            if (sheet.equalsIgnoreCase(name)) {
                return sheet;
            }
        }
        return null;
    }

    /**
     * Every {@link CellRef} and {@link RangeRef} in the expression, in
     * left-to-right order.
     */
    public static List<AstNode> collectReferences(AstNode node) {
        List<AstNode> refs = new ArrayList<>();
        collect(node, refs);
        return refs;
    }

    private static void collect(AstNode node, List<AstNode> refs) {
        if (node instanceof CellRef || node instanceof RangeRef) {
            refs.add(node);
        } else if (node instanceof UnaryOp) {
            collect(((UnaryOp) node).getOperand(), refs);
        } else if (node instanceof BinaryOp) {
            collect(((BinaryOp) node).getLhs(), refs);
            collect(((BinaryOp) node).getRhs(), refs);
        } else if (node instanceof FunctionCall) {
            for (AstNode arg : ((FunctionCall) node).getArgs()) {
                collect(arg, refs);
            }
        }
    }
}
