package com.sheetcalc.app.formula.graph;

import com.sheetcalc.app.exceptions.CircularReferenceException;
import com.sheetcalc.app.models.CellAddress;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeSet;

/**
 * Orders formula cells so that every cell comes after the cells it reads.
 *
 * Kahn's algorithm; among cells that are ready at the same time the
 * smallest address (sheet, then row, then column) goes first, so the order
 * is deterministic.
 */
public final class TopologicalScheduler {

    private TopologicalScheduler() {
    }

    /**
     * @throws CircularReferenceException naming the smallest cell on a cycle
     *                                    if the graph is not acyclic
     */
    public static List<CellAddress> order(DependencyGraph graph) {
        // 1. In-degrees
        Map<CellAddress, Integer> inDegree = new HashMap<>();
        for (CellAddress cell : graph.nodes()) {
            inDegree.put(cell, graph.getPrecedents(cell).size());
        }

        // 2. Ready queue seeded with cells that read no formula cell
        PriorityQueue<CellAddress> ready = new PriorityQueue<>();
        for (Map.Entry<CellAddress, Integer> entry : inDegree.entrySet()) {
            if (entry.getValue() == 0) {
                ready.add(entry.getKey());
            }
        }

        // 3. Kahn's algorithm
        List<CellAddress> order = new ArrayList<>(graph.size());
        while (!ready.isEmpty()) {
            CellAddress cell = ready.poll();
            order.add(cell);
            for (CellAddress dependent : graph.getDependents(cell)) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (order.size() != graph.size()) {
            Set<CellAddress> leftover = new TreeSet<>(graph.nodes());
            leftover.removeAll(order);
            throw new CircularReferenceException(firstCellOnCycle(graph, leftover));
        }
        return order;
    }

    /**
     * Leftover cells either sit on a cycle or only depend on one. Returns the
     * smallest leftover cell that can reach itself.
     */
    static CellAddress firstCellOnCycle(DependencyGraph graph, Set<CellAddress> leftover) {
        for (CellAddress start : leftover) {
            if (reachesItself(graph, start, leftover)) {
                return start;
            }
        }
        // unreachable: Kahn leaves cells behind only when a cycle exists
        return leftover.iterator().next();
    }

    private static boolean reachesItself(DependencyGraph graph, CellAddress start, Set<CellAddress> leftover) {
        Deque<CellAddress> stack = new ArrayDeque<>(graph.getDependents(start));
        Set<CellAddress> seen = new HashSet<>();
        while (!stack.isEmpty()) {
            CellAddress cell = stack.pop();
            if (cell.equals(start)) {
                return true;
            }
            if (!leftover.contains(cell) || !seen.add(cell)) {
                continue;
            }
            stack.addAll(graph.getDependents(cell));
        }
        return false;
    }
}
