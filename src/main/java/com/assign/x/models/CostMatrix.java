package com.assign.x.models;

import com.assign.x.exceptions.InternalInvariantException;
import com.assign.x.utils.basic.MatrixUtils;
import lombok.Getter;

/**
 * Working copy of a square cost matrix, owned by a single solve.
 * <p>
 * Values only change through {@link #reduce()} and {@link #adjustPotentials(CoverageTracker)}; both keep
 * every entry non-negative and preserve the set of optimal assignments.
 * </p>
 */
public final class CostMatrix {

    @Getter
    private final int size;
    private final double[][] cells;

    private CostMatrix(double[][] cells) {
        this.size = cells.length;
        this.cells = cells;
    }

    /**
     * Validates the shape of {@code costs} and copies it; the caller's array is never touched.
     *
     * @throws com.assign.x.exceptions.DimensionException if {@code costs} is not a non-empty square
     */
    public static CostMatrix copyOf(double[][] costs) {
        MatrixUtils.requireSquare(costs);
        return new CostMatrix(MatrixUtils.deepCopy(costs));
    }

    public double get(int row, int col) {
        return cells[row][col];
    }

    public boolean isZero(int row, int col) {
        return cells[row][col] == 0.0;
    }

    public int countZeros(int row) {
        int count = 0;
        for (double value : cells[row]) {
            if (value == 0.0) {
                count++;
            }
        }
        return count;
    }

    /**
     * Subtracts each row minimum from its row, then each column minimum (of the row-reduced matrix)
     * from its column.
     *
     * @return the sum of all subtracted minima
     * @throws InternalInvariantException if a reduced value overflows to a non-finite number
     */
    public double reduce() {
        double offset = 0.0;
        for (double[] row : cells) {
            double rowMin = row[0];
            for (double value : row) {
                rowMin = Math.min(rowMin, value);
            }
            for (int j = 0; j < size; j++) {
                row[j] -= rowMin;
            }
            offset += rowMin;
        }

        for (int j = 0; j < size; j++) {
            double colMin = cells[0][j];
            for (int i = 1; i < size; i++) {
                colMin = Math.min(colMin, cells[i][j]);
            }
            for (int i = 0; i < size; i++) {
                cells[i][j] -= colMin;
            }
            offset += colMin;
        }
        for (int i = 0; i < size; i++) {
            for (int j = 0; j < size; j++) {
                if (!Double.isFinite(cells[i][j])) {
                    throw new InternalInvariantException("Reduced value at (" + i + ", " + j + ") overflowed to "
                            + cells[i][j], SolverState.REDUCED);
                }
            }
        }
        return offset;
    }

    /**
     * Dual update: subtracts the smallest uncovered value from every uncovered cell and adds it to every
     * cell whose row and column are both covered.
     *
     * @return the value that was subtracted
     * @throws InternalInvariantException if every cell is covered by a row or a column
     */
    public double adjustPotentials(CoverageTracker coverage) {
        double min = Double.POSITIVE_INFINITY;
        boolean found = false;
        for (int i = 0; i < size; i++) {
            if (coverage.isRowCovered(i)) {
                continue;
            }
            for (int j = 0; j < size; j++) {
                if (!coverage.isColumnCovered(j)) {
                    min = Math.min(min, cells[i][j]);
                    found = true;
                }
            }
        }
        if (!found) {
            throw new InternalInvariantException("No uncovered cell left to adjust", SolverState.ADJUST_POTENTIALS);
        }
        if (!Double.isFinite(min)) {
            throw new InternalInvariantException("Non-finite uncovered value " + min, SolverState.ADJUST_POTENTIALS);
        }
        if (min < 0.0) {
            throw new InternalInvariantException("Negative uncovered value " + min, SolverState.ADJUST_POTENTIALS);
        }

        for (int i = 0; i < size; i++) {
            boolean rowCovered = coverage.isRowCovered(i);
            for (int j = 0; j < size; j++) {
                boolean colCovered = coverage.isColumnCovered(j);
                if (rowCovered && colCovered) {
                    cells[i][j] += min;
                    if (Double.isInfinite(cells[i][j])) {
                        throw new InternalInvariantException("Twice-covered value at (" + i + ", " + j
                                + ") overflowed", SolverState.ADJUST_POTENTIALS);
                    }
                } else if (!rowCovered && !colCovered) {
                    cells[i][j] -= min;
                }
            }
        }
        return min;
    }

    public double[][] toArray() {
        return MatrixUtils.deepCopy(cells);
    }
}
