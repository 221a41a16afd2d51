package com.sheetcalc.app.formula.eval;

import com.sheetcalc.app.exceptions.CircularReferenceException;
import com.sheetcalc.app.exceptions.RecursionLimitException;
import com.sheetcalc.app.models.CellAddress;

import java.time.Clock;
import java.util.HashSet;
import java.util.Set;

/**
 * Everything an evaluation needs besides the AST: the sheet unqualified
 * references resolve against, the snapshot to read, the cell being computed
 * (may be null for ad hoc formulas), the clock and the nesting guard.
 */
public class EvaluationContext {

    public static final int DEFAULT_MAX_DEPTH = 256;

    private final String sheet;
    private final CellAddress currentCell;
    private final CellSnapshot snapshot;
    private final Clock clock;
    private final DepthCounter depth;

    public EvaluationContext(String sheet, CellSnapshot snapshot) {
        this(sheet, null, snapshot, Clock.systemDefaultZone(), DEFAULT_MAX_DEPTH);
    }

    public EvaluationContext(String sheet, CellAddress currentCell, CellSnapshot snapshot,
                             Clock clock, int maxDepth) {
        this(sheet, currentCell, snapshot, clock, new DepthCounter(maxDepth));
    }

    private EvaluationContext(String sheet, CellAddress currentCell, CellSnapshot snapshot,
                              Clock clock, DepthCounter depth) {
        this.sheet = sheet;
        this.currentCell = currentCell;
        this.snapshot = snapshot;
        this.clock = clock;
        this.depth = depth;
    }

    /**
     * Context for evaluating another cell's formula on the fly.
     * Shares the snapshot, clock and nesting guard with this one.
     */
    public EvaluationContext forCell(CellAddress cell) {
        return new EvaluationContext(cell.getSheet(), cell, snapshot, clock, depth);
    }

    public String getSheet() {
        return sheet;
    }

    public CellAddress getCurrentCell() {
        return currentCell;
    }

    public CellSnapshot getSnapshot() {
        return snapshot;
    }

    public Clock getClock() {
        return clock;
    }

    public int getDepth() {
        return depth.current;
    }

    /**
     * Called on entering a function call, operator or nested formula cell.
     *
     * @throws RecursionLimitException once the nesting exceeds the limit
     */
    public void enter() {
        if (depth.current >= depth.max) {
            throw new RecursionLimitException(depth.max);
        }
        depth.current++;
    }

    public void exit() {
        depth.current--;
    }

    /**
     * Marks a formula cell as being computed on the fly.
     *
     * @throws CircularReferenceException if the cell is already being computed
     */
    public void beginCell(CellAddress cell) {
        if (!depth.cellsInProgress.add(cell)) {
            throw new CircularReferenceException(cell);
        }
    }

    public void endCell(CellAddress cell) {
        depth.cellsInProgress.remove(cell);
    }

    private static final class DepthCounter {
        private final int max;
        private final Set<CellAddress> cellsInProgress = new HashSet<>();
        private int current;

        private DepthCounter(int max) {
            this.max = max;
        }
    }
}
