package com.sheetcalc.app.formula.graph;

import com.sheetcalc.app.models.CellAddress;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Dependencies between formula cells.
 *
 * - Nodes are the addresses of formula cells
 * - An edge B -> A means A's formula reads B, so B must be computed first
 *
 * Both directions are kept so the scheduler can walk dependents and the
 * cycle reporter can walk precedents.
 */
public class DependencyGraph {

    // Key: cell -> cells whose formulas read it
    private final Map<CellAddress, Set<CellAddress>> dependents = new TreeMap<>();
    // Key: cell -> formula cells its own formula reads
    private final Map<CellAddress, Set<CellAddress>> precedents = new TreeMap<>();

    public void addNode(CellAddress cell) {
        dependents.computeIfAbsent(cell, k -> new TreeSet<>());
        precedents.computeIfAbsent(cell, k -> new TreeSet<>());
    }

    /**
     * Records that {@code dependent} reads {@code precedent}. Both must
     * already be nodes.
     */
    public void addEdge(CellAddress precedent, CellAddress dependent) {
        if (!contains(precedent) || !contains(dependent)) {
            throw new IllegalArgumentException("Unknown node in edge " + precedent + " -> " + dependent);
        }
        dependents.get(precedent).add(dependent);
        precedents.get(dependent).add(precedent);
    }

    public boolean contains(CellAddress cell) {
        return dependents.containsKey(cell);
    }

    /** All nodes in address order. */
    public Set<CellAddress> nodes() {
        return Collections.unmodifiableSet(dependents.keySet());
    }

    public Set<CellAddress> getDependents(CellAddress cell) {
        Set<CellAddress> result = dependents.get(cell);
        return result == null ? Collections.emptySet() : Collections.unmodifiableSet(result);
    }

    public Set<CellAddress> getPrecedents(CellAddress cell) {
        Set<CellAddress> result = precedents.get(cell);
        return result == null ? Collections.emptySet() : Collections.unmodifiableSet(result);
    }

    public int size() {
        return dependents.size();
    }

    public int edgeCount() {
        int count = 0;
        for (Set<CellAddress> targets : dependents.values()) {
            count += targets.size();
        }
        return count;
    }
}
