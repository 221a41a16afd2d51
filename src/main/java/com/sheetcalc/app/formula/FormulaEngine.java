package com.sheetcalc.app.formula;

import com.sheetcalc.app.exceptions.CircularReferenceException;
import com.sheetcalc.app.exceptions.FormulaParseException;
import com.sheetcalc.app.exceptions.SheetNotFoundException;
import com.sheetcalc.app.formula.ast.AstNode;
import com.sheetcalc.app.formula.eval.CellSnapshot;
import com.sheetcalc.app.formula.eval.EvaluationContext;
import com.sheetcalc.app.formula.eval.Evaluator;
import com.sheetcalc.app.formula.functions.FunctionRegistry;
import com.sheetcalc.app.formula.graph.DependencyGraph;
import com.sheetcalc.app.formula.graph.DependencyGraphBuilder;
import com.sheetcalc.app.formula.graph.TopologicalScheduler;
import com.sheetcalc.app.formula.parser.FormulaParser;
import com.sheetcalc.app.models.CellAddress;
import com.sheetcalc.app.models.CellValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry points of the formula engine:
 * - evaluateFormula: compute an ad hoc formula against a store, persisting nothing
 * - calculateAll: recompute every formula cell of a store in dependency order
 *
 * Not thread-safe; callers serialize access per store.
 */
public class FormulaEngine {

    private static final Logger log = LoggerFactory.getLogger(FormulaEngine.class);

    private final Evaluator evaluator;
    private final Clock clock;
    private final int maxDepth;

    public FormulaEngine() {
        this(FunctionRegistry.createDefault(), Clock.systemDefaultZone(), EvaluationContext.DEFAULT_MAX_DEPTH, false);
    }

    public FormulaEngine(FunctionRegistry functions, Clock clock, int maxDepth, boolean strictFunctionNames) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.evaluator = new Evaluator(functions, strictFunctionNames);
        this.clock = clock;
        this.maxDepth = maxDepth;
    }

    /**
     * Evaluates a formula in the context of the given sheet. Cells are read
     * from the store as they are referenced; nothing is written back.
     *
     * @throws SheetNotFoundException if the sheet does not exist
     * @throws FormulaParseException  if the formula is malformed
     * @throws CircularReferenceException if referenced formula cells read each other in a loop
     */
    public CellValue evaluateFormula(CellStore store, String sheet, String formula) {
        String canonicalSheet = store.resolveSheetName(sheet);
        if (canonicalSheet == null) {
            throw new SheetNotFoundException("Sheet not found: " + sheet);
        }
        AstNode ast = FormulaParser.parse(formula);
        EvaluationContext ctx = new EvaluationContext(canonicalSheet, null, CellSnapshot.lazy(store), clock, maxDepth);
        CellValue result = Evaluator.toCellResult(evaluator.evaluate(ast, ctx));
        log.debug("Evaluated '{}' on sheet {} -> {}", formula, canonicalSheet, result);
        return result;
    }

    /**
     * Recomputes every formula cell and stores the results as their cached
     * values. Either every formula cell is updated or, on a parse error,
     * circular reference or recursion limit, none is.
     *
     * @throws CircularReferenceException if formula cells reference each other in a loop
     */
    public void calculateAll(CellStore store) {
        long started = System.nanoTime();
        CellSnapshot snapshot = CellSnapshot.capture(store);

        // 1. Parse every formula up front
        Map<CellAddress, AstNode> formulas = new LinkedHashMap<>();
        for (CellAddress cell : store.formulaCells()) {
            String expression = snapshot.get(cell).getFormula();
            try {
                formulas.put(cell, FormulaParser.parse(expression));
            } catch (FormulaParseException e) {
                log.warn("Cannot recalculate: formula in {} does not parse: {}", cell, e.getMessage());
                throw e;
            }
        }

        // 2. Order by dependencies
        DependencyGraph graph = DependencyGraphBuilder.build(formulas, store.sheetNames());
        List<CellAddress> order;
        try {
            order = TopologicalScheduler.order(graph);
        } catch (CircularReferenceException e) {
            log.warn("Cannot recalculate: circular reference involving {}", e.getCell());
            throw e;
        }

        // 3. Evaluate; each result is visible to later cells through the snapshot
        Map<CellAddress, CellValue> results = new LinkedHashMap<>();
        for (CellAddress cell : order) {
            EvaluationContext ctx = new EvaluationContext(cell.getSheet(), cell, snapshot, clock, maxDepth);
            CellValue result = Evaluator.toCellResult(evaluator.evaluate(formulas.get(cell), ctx));
            snapshot.put(cell, result);
            results.put(cell, result);
        }

        // 4. Commit
        for (Map.Entry<CellAddress, CellValue> entry : results.entrySet()) {
            store.setCachedResult(entry.getKey(), entry.getValue());
        }
        log.debug("Recalculated {} formula cells ({} dependencies) in {} ms",
                results.size(), graph.edgeCount(), (System.nanoTime() - started) / 1_000_000);
    }
}
