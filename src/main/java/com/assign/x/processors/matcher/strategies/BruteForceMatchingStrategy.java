package com.assign.x.processors.matcher.strategies;

import com.assign.x.dto.AssignmentResult;
import com.assign.x.exceptions.BadRequestException;
import com.assign.x.processors.instrumentation.SolverStepListener;
import com.assign.x.utils.basic.MatrixUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import static com.assign.x.utils.basic.Constant.BRUTE_FORCE;

/**
 * Exhaustive search over all permutations. Only meant for small matrices, mostly as a reference for the
 * Hungarian solver. Ties keep the lexicographically first permutation.
 */
@Component("bruteForceMatchingStrategy")
@Slf4j
public class BruteForceMatchingStrategy implements MatchingStrategy {

    public static final int MAX_SIZE = 9;

    @Override
    public AssignmentResult solve(double[][] costs, SolverStepListener listener) {
        int n = MatrixUtils.requireSquare(costs);
        MatrixUtils.requireFinite(costs);
        if (n > MAX_SIZE) {
            throw new BadRequestException("Brute force supports at most " + MAX_SIZE + " rows, got " + n);
        }

        Search search = new Search(costs);
        search.extend(0, 0.0);
        log.debug("Brute force over size {} visited {} permutations, best cost {}", n, search.visited, search.bestCost);
        return AssignmentResult.builder()
                .strategy(BRUTE_FORCE)
                .assignment(search.best)
                .totalCost(MatrixUtils.totalCost(costs, search.best))
                .iterations((int) Math.min(Integer.MAX_VALUE, search.visited))
                .build();
    }

    @Override
    public boolean supports(String mode) {
        return BRUTE_FORCE.equalsIgnoreCase(mode);
    }

    @Override
    public String name() {
        return BRUTE_FORCE;
    }

    private static final class Search {
        private final double[][] costs;
        private final int n;
        private final int[] current;
        private final boolean[] usedColumns;
        private int[] best;
        private double bestCost = Double.POSITIVE_INFINITY;
        private long visited;

        Search(double[][] costs) {
            this.costs = costs;
            this.n = costs.length;
            this.current = new int[n];
            this.usedColumns = new boolean[n];
        }

        void extend(int row, double partial) {
            if (row == n) {
                visited++;
                if (best == null || partial < bestCost) {
                    bestCost = partial;
                    best = current.clone();
                }
                return;
            }
            for (int col = 0; col < n; col++) {
                if (!usedColumns[col]) {
                    usedColumns[col] = true;
                    current[row] = col;
                    extend(row + 1, partial + costs[row][col]);
                    usedColumns[col] = false;
                }
            }
        }
    }
}
