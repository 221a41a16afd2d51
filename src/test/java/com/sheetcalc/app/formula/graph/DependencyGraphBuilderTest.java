package com.sheetcalc.app.formula.graph;

import com.sheetcalc.app.formula.ast.AstNode;
import com.sheetcalc.app.formula.parser.FormulaParser;
import com.sheetcalc.app.models.CellAddress;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for DependencyGraphBuilder.
 */
class DependencyGraphBuilderTest {

    private static final List<String> SHEETS = Arrays.asList("Sheet1", "Data");

    private Map<CellAddress, AstNode> formulas;

    @BeforeEach
    void setUp() {
        formulas = new LinkedHashMap<>();
    }

    private static CellAddress cell(String a1) {
        return CellAddress.parse("Sheet1", a1);
    }

    private void formula(CellAddress address, String text) {
        formulas.put(address, FormulaParser.parse(text));
    }

    /**
     * Only references to other formula cells become edges.
     */
    @Test
    void testEdgesOnlyBetweenFormulaCells() {
        formula(cell("A1"), "=B1+C1");
        formula(cell("B1"), "=D1*2");

        DependencyGraph graph = DependencyGraphBuilder.build(formulas, SHEETS);

        assertEquals(2, graph.size());
        assertEquals(Collections.singleton(cell("B1")), graph.getPrecedents(cell("A1")));
        assertTrue(graph.getPrecedents(cell("B1")).isEmpty());
        assertEquals(Collections.singleton(cell("A1")), graph.getDependents(cell("B1")));
        assertEquals(1, graph.edgeCount());
    }

    @Test
    void testSmallRangeIsEnumerated() {
        formula(cell("A1"), "=1");
        formula(cell("A2"), "=2");
        formula(cell("A3"), "=3");
        formula(cell("B1"), "=SUM(A1:A2)");

        DependencyGraph graph = DependencyGraphBuilder.build(formulas, SHEETS);

        assertEquals(2, graph.getPrecedents(cell("B1")).size());
        assertFalse(graph.getPrecedents(cell("B1")).contains(cell("A3")));
    }

    /**
     * A range far larger than the sheet's formula count is matched by containment.
     */
    @Test
    void testLargeRangeIsMatchedByContainment() {
        formula(cell("C500"), "=1");
        formula(cell("Z1"), "=SUM(A1:D1000)");

        DependencyGraph graph = DependencyGraphBuilder.build(formulas, SHEETS);

        assertEquals(Collections.singleton(cell("C500")), graph.getPrecedents(cell("Z1")));
        assertTrue(graph.getPrecedents(cell("C500")).isEmpty());
    }

    @Test
    void testCrossSheetReferences() {
        CellAddress data = CellAddress.parse("Data", "A1");
        formula(data, "=5");
        formula(cell("A1"), "=data!A1+'Data'!A1:A3");
        formula(cell("A2"), "=Unknown!A1");

        DependencyGraph graph = DependencyGraphBuilder.build(formulas, SHEETS);

        assertEquals(Collections.singleton(data), graph.getPrecedents(cell("A1")));
        assertTrue(graph.getPrecedents(cell("A2")).isEmpty());
    }

    @Test
    void testSelfReferenceIsASelfEdge() {
        formula(cell("A1"), "=A1+1");
        DependencyGraph graph = DependencyGraphBuilder.build(formulas, SHEETS);
        assertTrue(graph.getDependents(cell("A1")).contains(cell("A1")));
    }

    @Test
    void testCollectReferences() {
        List<AstNode> refs = DependencyGraphBuilder.collectReferences(
                FormulaParser.parse("=IF(A1>0,SUM(B1:B3),-C2%)&\"A9\""));
        assertEquals(3, refs.size());
        assertEquals("A1", refs.get(0).toFormula());
        assertEquals("B1:B3", refs.get(1).toFormula());
        assertEquals("C2", refs.get(2).toFormula());
    }
}
