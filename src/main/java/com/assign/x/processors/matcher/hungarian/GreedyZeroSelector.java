package com.assign.x.processors.matcher.hungarian;

import com.assign.x.exceptions.InternalInvariantException;
import com.assign.x.models.CostMatrix;
import com.assign.x.models.MatchingState;
import com.assign.x.models.SolverState;
import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds the initial set of independent zeros on a reduced matrix.
 * <p>
 * Rows are served fewest-free-zeros first (lowest index on ties); each takes its first zero in a column
 * nobody has taken yet. The result is usually close to a full matching but not guaranteed maximum.
 * </p>
 */
@Slf4j
public class GreedyZeroSelector {

    public void select(CostMatrix matrix, MatchingState matching) {
        int n = matrix.getSize();
        Map<Integer, Integer> freeZerosByRow = new TreeMap<>();
        for (int i = 0; i < n; i++) {
            freeZerosByRow.put(i, matrix.countZeros(i));
        }

        while (!freeZerosByRow.isEmpty()) {
            Map.Entry<Integer, Integer> fewest = null;
            for (Map.Entry<Integer, Integer> entry : freeZerosByRow.entrySet()) {
                if (fewest == null || entry.getValue() < fewest.getValue()) {
                    fewest = entry;
                }
            }
            int row = fewest.getKey();
            if (fewest.getValue() == 0) {
                throw new InternalInvariantException("Row " + row + " has no free zero left",
                        SolverState.INITIAL_SELECTION);
            }

            int col = firstFreeZero(matrix, matching, row);
            if (col < 0) {
                throw new InternalInvariantException("Row " + row + " counts " + fewest.getValue()
                        + " free zeros but none was found", SolverState.INITIAL_SELECTION);
            }
            matching.select(row, col);
            freeZerosByRow.remove(row);
            log.trace("Greedy selection picked ({}, {})", row, col);

            Iterator<Map.Entry<Integer, Integer>> it = freeZerosByRow.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<Integer, Integer> other = it.next();
                if (matrix.isZero(other.getKey(), col)) {
                    int remaining = other.getValue() - 1;
                    if (remaining == 0) {
                        it.remove();
                    } else {
                        other.setValue(remaining);
                    }
                }
            }
        }
        log.debug("Greedy selection placed {} of {} zeros", matching.getSelectedCount(), n);
    }

    private int firstFreeZero(CostMatrix matrix, MatchingState matching, int row) {
        for (int j = 0; j < matrix.getSize(); j++) {
            if (matrix.isZero(row, j) && !matching.hasSelectionInColumn(j)) {
                return j;
            }
        }
        return -1;
    }
}
