package com.assign.x.utils.basic;

import com.assign.x.exceptions.DimensionException;
import com.assign.x.exceptions.InternalInvariantException;
import com.assign.x.models.SolverState;
import lombok.experimental.UtilityClass;

@UtilityClass
public final class MatrixUtils {

    /**
     * Checks that {@code costs} is a non-empty square matrix and returns its size.
     *
     * @throws DimensionException if the matrix is null, empty, has a null row or a row of the wrong length
     */
    public static int requireSquare(double[][] costs) {
        if (costs == null || costs.length == 0) {
            throw new DimensionException("Cost matrix must have at least one row");
        }
        int n = costs.length;
        for (int i = 0; i < n; i++) {
            if (costs[i] == null) {
                throw new DimensionException("Row " + i + " of the cost matrix is missing");
            }
            if (costs[i].length != n) {
                throw new DimensionException("Row " + i + " has " + costs[i].length
                        + " entries, expected " + n + " for a square matrix");
            }
        }
        return n;
    }

    public static void requireFinite(double[][] costs) {
        for (int i = 0; i < costs.length; i++) {
            for (int j = 0; j < costs[i].length; j++) {
                if (!Double.isFinite(costs[i][j])) {
                    throw new InternalInvariantException("Non-finite cost " + costs[i][j]
                            + " at (" + i + ", " + j + ")", SolverState.VALIDATION);
                }
            }
        }
    }

    public static double[][] deepCopy(double[][] source) {
        double[][] copy = new double[source.length][];
        for (int i = 0; i < source.length; i++) {
            copy[i] = source[i].clone();
        }
        return copy;
    }

    public static double totalCost(double[][] costs, int[] assignment) {
        double total = 0.0;
        for (int i = 0; i < assignment.length; i++) {
            total += costs[i][assignment[i]];
        }
        return total;
    }

    /**
     * True if {@code assignment} maps {0..n-1} onto {0..n-1} with no column used twice.
     */
    public static boolean isPermutation(int[] assignment, int n) {
        if (assignment == null || assignment.length != n) {
            return false;
        }
        boolean[] used = new boolean[n];
        for (int col : assignment) {
            if (col < 0 || col >= n || used[col]) {
                return false;
            }
            used[col] = true;
        }
        return true;
    }

    /**
     * Coarse size tag for metrics, keeps the tag cardinality bounded.
     */
    public static String sizeBucket(int n) {
        if (n <= 8) {
            return "tiny";
        }
        if (n <= 64) {
            return "small";
        }
        if (n <= 512) {
            return "medium";
        }
        return "large";
    }
}
