package com.assign.x.processors.matcher.hungarian;

import com.assign.x.dto.AssignmentResult;
import com.assign.x.dto.Cell;
import com.assign.x.dto.SolverSnapshot;
import com.assign.x.exceptions.InternalInvariantException;
import com.assign.x.models.AlternatingPath;
import com.assign.x.models.CostMatrix;
import com.assign.x.models.CoverageTracker;
import com.assign.x.models.MatchingState;
import com.assign.x.models.SolverState;
import com.assign.x.processors.instrumentation.SolverStepListener;
import com.assign.x.utils.basic.MatrixUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

import static com.assign.x.utils.basic.Constant.HUNGARIAN;

/**
 * Kuhn-Munkres solver for one square cost matrix.
 * <p>
 * The instance owns a working copy of the costs, the matching and the coverage for the duration of
 * {@link #solve()} and cannot be reused.
 * </p>
 * <ol>
 *     <li>Reduce rows and columns, pick an initial set of independent zeros greedily, cover their columns.</li>
 *     <li>While fewer than n columns are covered, search uncovered rows and columns for a zero and mark it prepared.</li>
 *     <li>If none is found, adjust potentials.</li>
 *     <li>If the zero's row holds a selected zero, cover that row, uncover that zero's column and adjust potentials.</li>
 *     <li>Otherwise build the alternating path from the prepared zero and flip it.</li>
 * </ol>
 * <p>
 * Adjusting potentials while an uncovered zero still exists subtracts zero and changes nothing, so the
 * search simply resumes.
 * </p>
 */
@Slf4j
public class HungarianSolver {

    private final double[][] original;
    private final CostMatrix matrix;
    private final MatchingState matching;
    private final CoverageTracker coverage;
    private final SolverStepListener listener;
    private final GreedyZeroSelector zeroSelector = new GreedyZeroSelector();
    private final AugmentingPathBuilder pathBuilder = new AugmentingPathBuilder();
    private final int size;
    private final int maxIterations;

    private AlternatingPath currentPath = AlternatingPath.empty();
    private SolverState state = SolverState.VALIDATION;
    private boolean used;
    private int step;
    private int augmentations;
    private int potentialAdjustments;
    private int iterations;

    public HungarianSolver(double[][] costs) {
        this(costs, SolverStepListener.NO_OP);
    }

    /**
     * Validates and copies {@code costs}. The caller's array is never modified.
     *
     * @throws com.assign.x.exceptions.DimensionException if {@code costs} is not a non-empty square
     * @throws InternalInvariantException                  if a cost is NaN or infinite
     */
    public HungarianSolver(double[][] costs, SolverStepListener listener) {
        this.matrix = CostMatrix.copyOf(costs);
        MatrixUtils.requireFinite(costs);
        this.original = MatrixUtils.deepCopy(costs);
        this.size = matrix.getSize();
        this.matching = new MatchingState(size);
        this.coverage = new CoverageTracker(size);
        this.listener = Objects.requireNonNullElse(listener, SolverStepListener.NO_OP);
        this.maxIterations = 4 * size * size + 16;
    }

    public AssignmentResult solve() {
        if (used) {
            throw new IllegalStateException("HungarianSolver instances are single-use");
        }
        used = true;
        try {
            return run();
        } catch (InternalInvariantException e) {
            log.error("Hungarian solve of size {} failed in state {}: {}", size, state, e.getMessage());
            throw e.getSnapshot() == null ? e.withSnapshot(snapshot(e.getState())) : e;
        } catch (IllegalStateException e) {
            log.error("Hungarian solve of size {} failed in state {}: {}", size, state, e.getMessage());
            throw new InternalInvariantException(e.getMessage(), state, snapshot(state), e);
        }
    }

    private AssignmentResult run() {
        double offset = matrix.reduce();
        transition(SolverState.REDUCED);

        state = SolverState.INITIAL_SELECTION;
        zeroSelector.select(matrix, matching);
        coverage.coverSelectedColumns(matching);
        transition(SolverState.INITIAL_SELECTION);

        while (!isOptimal()) {
            if (++iterations > maxIterations) {
                throw new InternalInvariantException("Exceeded " + maxIterations + " iterations", state);
            }

            Cell zero = findUncoveredZero();
            if (zero == null) {
                adjustPotentials();
                continue;
            }
            matching.prepare(zero.row(), zero.col());
            transition(SolverState.SEARCH);

            if (matching.hasSelectionInRow(zero.row())) {
                int selectedCol = matching.selectedColumnOf(zero.row());
                coverage.coverRow(zero.row());
                coverage.uncoverColumn(selectedCol);
                transition(SolverState.ROW_HAS_SELECTION);
                adjustPotentials();
            } else {
                augment(zero);
            }
        }

        int[] assignment = matching.selectedInRowCopy();
        if (!MatrixUtils.isPermutation(assignment, size)) {
            throw new InternalInvariantException("Final selection is not a permutation", SolverState.SOLVED);
        }
        transition(SolverState.SOLVED);

        double totalCost = MatrixUtils.totalCost(original, assignment);
        log.debug("Solved size {} in {} iterations: {} augmentations, {} potential adjustments, cost {}",
                size, iterations, augmentations, potentialAdjustments, totalCost);
        return AssignmentResult.builder()
                .strategy(HUNGARIAN)
                .assignment(assignment)
                .totalCost(totalCost)
                .reductionOffset(offset)
                .augmentations(augmentations)
                .potentialAdjustments(potentialAdjustments)
                .iterations(iterations)
                .build();
    }

    private boolean isOptimal() {
        return coverage.coveredColumnCount() == size;
    }

    private Cell findUncoveredZero() {
        state = SolverState.SEARCH;
        for (int i = 0; i < size; i++) {
            if (coverage.isRowCovered(i)) {
                continue;
            }
            for (int j = 0; j < size; j++) {
                if (!coverage.isColumnCovered(j) && matrix.isZero(i, j)) {
                    return new Cell(i, j);
                }
            }
        }
        return null;
    }

    private void adjustPotentials() {
        state = SolverState.ADJUST_POTENTIALS;
        double delta = matrix.adjustPotentials(coverage);
        potentialAdjustments++;
        log.trace("Adjusted potentials by {}", delta);
        transition(SolverState.ADJUST_POTENTIALS);
    }

    private void augment(Cell start) {
        state = SolverState.BUILD_PATH;
        currentPath = pathBuilder.build(matching, size, start.row(), start.col());
        transition(SolverState.BUILD_PATH);

        pathBuilder.flip(matching, currentPath);
        coverage.coverSelectedColumns(matching);
        currentPath = AlternatingPath.empty();
        augmentations++;
        transition(SolverState.AUGMENTED);
    }

    private void transition(SolverState next) {
        state = next;
        if (listener == SolverStepListener.NO_OP) {
            step++;
            return;
        }
        SolverSnapshot snapshot = snapshot(next);
        step++;
        try {
            listener.onTransition(next, snapshot);
        } catch (RuntimeException e) {
            log.warn("Step listener failed on {} at step {}: {}", next, snapshot.step(), e.getMessage());
        }
    }

    private SolverSnapshot snapshot(SolverState at) {
        return new SolverSnapshot(at, step, matrix.toArray(),
                coverage.coveredRowsCopy(), coverage.coveredColsCopy(),
                matching.selectedInRowCopy(), matching.preparedInRowCopy(),
                currentPath.getPreparedCells(), currentPath.getSelectedCells());
    }
}
