package com.assign.x.models;

import com.assign.x.dto.Cell;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Alternating chain of prepared and selected zeros. A complete path starts and ends with a prepared
 * cell, so it holds exactly one more prepared cell than selected cells.
 */
public final class AlternatingPath {

    private final List<Cell> preparedCells = new ArrayList<>();
    private final List<Cell> selectedCells = new ArrayList<>();

    public static AlternatingPath empty() {
        return new AlternatingPath();
    }

    public void addPrepared(int row, int col) {
        preparedCells.add(new Cell(row, col));
    }

    public void addSelected(int row, int col) {
        selectedCells.add(new Cell(row, col));
    }

    public List<Cell> getPreparedCells() {
        return Collections.unmodifiableList(preparedCells);
    }

    public List<Cell> getSelectedCells() {
        return Collections.unmodifiableList(selectedCells);
    }

    public int length() {
        return preparedCells.size() + selectedCells.size();
    }

    public boolean isComplete() {
        return preparedCells.size() == selectedCells.size() + 1;
    }
}
