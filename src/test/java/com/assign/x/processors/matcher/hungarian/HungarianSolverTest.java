package com.assign.x.processors.matcher.hungarian;

import com.assign.x.dto.AssignmentResult;
import com.assign.x.dto.Cell;
import com.assign.x.dto.SolverSnapshot;
import com.assign.x.exceptions.DimensionException;
import com.assign.x.exceptions.InternalInvariantException;
import com.assign.x.models.CostMatrix;
import com.assign.x.models.SolverState;
import com.assign.x.processors.instrumentation.SolverStepListener;
import com.assign.x.processors.matcher.strategies.BruteForceMatchingStrategy;
import com.assign.x.utils.basic.MatrixUtils;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class HungarianSolverTest {

    private static final double[][] GREEDY_INCOMPLETE = {
            {5, 4, 6, 3},
            {3, 4, 6, 5},
            {3, 4, 5, 6},
            {5, 4, 3, 6}
    };

    private final BruteForceMatchingStrategy bruteForce = new BruteForceMatchingStrategy();

    @Test
    void singleCell() {
        AssignmentResult result = new HungarianSolver(new double[][]{{5}}).solve();

        assertThat(result.getAssignment()).containsExactly(0);
        assertThat(result.getTotalCost()).isEqualTo(5.0);
    }

    @Test
    void prefersTheCheaperDiagonal() {
        AssignmentResult result = new HungarianSolver(new double[][]{{1, 2}, {2, 1}}).solve();

        assertThat(result.getAssignment()).containsExactly(0, 1);
        assertThat(result.getTotalCost()).isEqualTo(2.0);
    }

    @Test
    void anyPermutationWhenAllCostsTie() {
        AssignmentResult result = new HungarianSolver(new double[][]{{1, 1}, {1, 1}}).solve();

        assertThat(MatrixUtils.isPermutation(result.getAssignment(), 2)).isTrue();
        assertThat(result.getTotalCost()).isEqualTo(2.0);
    }

    @Test
    void repairsAnIncompleteGreedySelection() {
        List<SolverState> states = new ArrayList<>();
        List<SolverSnapshot> snapshots = new ArrayList<>();
        SolverStepListener recorder = (state, snapshot) -> {
            states.add(state);
            snapshots.add(snapshot);
        };

        AssignmentResult result = new HungarianSolver(GREEDY_INCOMPLETE, recorder).solve();

        assertThat(result.getAssignment()).containsExactly(3, 1, 0, 2);
        assertThat(result.getTotalCost()).isEqualTo(13.0);
        assertThat(result.getTotalCost()).isEqualTo(bruteForce.solve(GREEDY_INCOMPLETE, null).getTotalCost());
        assertThat(result.getAugmentations()).isEqualTo(1);
        assertThat(states).contains(SolverState.ADJUST_POTENTIALS, SolverState.BUILD_PATH);
        assertThat(states.get(0)).isEqualTo(SolverState.REDUCED);
        assertThat(states.get(states.size() - 1)).isEqualTo(SolverState.SOLVED);

        SolverSnapshot initial = snapshots.get(states.indexOf(SolverState.INITIAL_SELECTION));
        assertThat(initial.selectedInRow()).containsExactly(1, 0, -1, 2);
        assertThat(initial.coveredCols()).containsExactly(true, true, true, false);

        SolverSnapshot path = snapshots.get(states.indexOf(SolverState.BUILD_PATH));
        assertThat(path.preparedPath()).containsExactly(new Cell(2, 0), new Cell(1, 1), new Cell(0, 3));
        assertThat(path.selectedPath()).containsExactly(new Cell(1, 0), new Cell(0, 1));
    }

    @Test
    void adjustsPotentialsByThePositiveUncoveredMinimum() {
        List<SolverSnapshot> adjustments = new ArrayList<>();
        SolverStepListener recorder = (state, snapshot) -> {
            if (state == SolverState.ADJUST_POTENTIALS) {
                adjustments.add(snapshot);
            }
        };
        double[][] costs = {{1, 2, 3}, {2, 4, 6}, {3, 6, 9}};

        AssignmentResult result = new HungarianSolver(costs, recorder).solve();

        assertThat(adjustments.get(0).matrix()).isDeepEqualTo(new double[][]{
                {1, 0, 0},
                {0, 0, 1},
                {0, 1, 3}
        });
        assertThat(result.getAssignment()).containsExactly(2, 1, 0);
        assertThat(result.getTotalCost()).isEqualTo(10.0);
        assertThat(result.getReductionOffset()).isEqualTo(9.0);
    }

    @Test
    void matchesBruteForceOnSmallIntegerMatrices() {
        Random random = new Random(42);
        for (int n = 1; n <= 8; n++) {
            for (int trial = 0; trial < 25; trial++) {
                double[][] costs = new double[n][n];
                for (int i = 0; i < n; i++) {
                    for (int j = 0; j < n; j++) {
                        costs[i][j] = random.nextInt(10);
                    }
                }
                assertOptimal(costs);
            }
        }
    }

    @Test
    void matchesBruteForceOnSmallRealMatrices() {
        Random random = new Random(1234);
        for (int n = 1; n <= 7; n++) {
            for (int trial = 0; trial < 25; trial++) {
                double[][] costs = new double[n][n];
                for (int i = 0; i < n; i++) {
                    for (int j = 0; j < n; j++) {
                        costs[i][j] = random.nextDouble() * 1000 - 500;
                    }
                }
                assertOptimal(costs);
            }
        }
    }

    @Test
    void matchesBruteForceOnShuffledRowsOfThreeToSix() {
        Random random = new Random(2020);
        for (int trial = 0; trial < 100; trial++) {
            double[][] costs = new double[4][];
            for (int i = 0; i < 4; i++) {
                List<Double> row = new ArrayList<>(List.of(3.0, 4.0, 5.0, 6.0));
                java.util.Collections.shuffle(row, random);
                costs[i] = row.stream().mapToDouble(Double::doubleValue).toArray();
            }
            assertOptimal(costs);
        }
    }

    @Test
    void solvingTheReducedMatrixGivesTheSameOriginalCost() {
        Random random = new Random(99);
        for (int trial = 0; trial < 30; trial++) {
            int n = 2 + random.nextInt(6);
            double[][] costs = new double[n][n];
            for (int i = 0; i < n; i++) {
                for (int j = 0; j < n; j++) {
                    costs[i][j] = random.nextInt(50);
                }
            }
            CostMatrix reduced = CostMatrix.copyOf(costs);
            reduced.reduce();

            AssignmentResult direct = new HungarianSolver(costs).solve();
            AssignmentResult viaReduced = new HungarianSolver(reduced.toArray()).solve();

            assertThat(MatrixUtils.totalCost(costs, viaReduced.getAssignment()))
                    .isCloseTo(direct.getTotalCost(), within(1e-9));
        }
    }

    @Test
    void isDeterministic() {
        Random random = new Random(5);
        double[][] costs = new double[12][12];
        for (int i = 0; i < 12; i++) {
            for (int j = 0; j < 12; j++) {
                costs[i][j] = random.nextInt(5);
            }
        }

        AssignmentResult first = new HungarianSolver(MatrixUtils.deepCopy(costs)).solve();
        AssignmentResult second = new HungarianSolver(MatrixUtils.deepCopy(costs)).solve();

        assertThat(first.getAssignment()).containsExactly(second.getAssignment());
        assertThat(first.getIterations()).isEqualTo(second.getIterations());
    }

    @Test
    void solvesLargerMatricesIntoAPermutation() {
        Random random = new Random(77);
        int n = 80;
        double[][] costs = new double[n][n];
        double identityCost = 0;
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                costs[i][j] = random.nextInt(1000);
            }
            identityCost += costs[i][i];
        }

        AssignmentResult result = new HungarianSolver(costs).solve();

        assertThat(MatrixUtils.isPermutation(result.getAssignment(), n)).isTrue();
        assertThat(result.getTotalCost()).isLessThanOrEqualTo(identityCost);
        assertThat(result.getTotalCost()).isGreaterThanOrEqualTo(result.getReductionOffset());
    }

    @Test
    void leavesTheCallersMatrixUntouched() {
        double[][] costs = {{4, 1, 3}, {2, 0, 5}, {3, 2, 2}};
        double[][] before = MatrixUtils.deepCopy(costs);

        new HungarianSolver(costs).solve();

        assertThat(costs).isDeepEqualTo(before);
    }

    @Test
    void rejectsNonSquareInputBeforeTouchingIt() {
        double[][] costs = {{1, 2}, {3, 4}, {5, 6}};
        double[][] before = MatrixUtils.deepCopy(costs);
        SolverStepListener listener = mock(SolverStepListener.class);

        assertThatThrownBy(() -> new HungarianSolver(costs, listener).solve())
                .isInstanceOf(DimensionException.class);
        assertThat(costs).isDeepEqualTo(before);
        org.mockito.Mockito.verifyNoInteractions(listener);
    }

    @Test
    void rejectsNonFiniteCosts() {
        double[][] costs = {{1, Double.NaN}, {3, 4}};

        assertThatThrownBy(() -> new HungarianSolver(costs).solve())
                .isInstanceOf(InternalInvariantException.class)
                .hasMessageContaining("Non-finite")
                .extracting("state").isEqualTo(SolverState.VALIDATION);
    }

    @Test
    void failureAfterReductionCarriesStateAndSnapshot() {
        double[][] costs = {{-1e308, 1e308}, {-1e308, 1.7e308}};

        InternalInvariantException failure = catchThrowableOfType(() -> new HungarianSolver(costs).solve(),
                InternalInvariantException.class);

        assertThat(failure.getState()).isEqualTo(SolverState.REDUCED);
        assertThat(failure.getMessage()).contains("overflowed").contains("[state=REDUCED]");
        SolverSnapshot snapshot = failure.getSnapshot();
        assertThat(snapshot).isNotNull();
        assertThat(snapshot.state()).isEqualTo(SolverState.REDUCED);
        assertThat(snapshot.matrix()).hasDimensions(2, 2);
        assertThat(snapshot.selectedInRow()).containsExactly(-1, -1);
    }

    @Test
    void failingListenerDoesNotChangeTheResult() {
        SolverStepListener failing = (state, snapshot) -> {
            throw new IllegalStateException("sink down");
        };

        AssignmentResult withFailing = new HungarianSolver(GREEDY_INCOMPLETE, failing).solve();
        AssignmentResult without = new HungarianSolver(GREEDY_INCOMPLETE).solve();

        assertThat(withFailing.getAssignment()).containsExactly(without.getAssignment());
        assertThat(withFailing.getTotalCost()).isEqualTo(without.getTotalCost());
    }

    @Test
    void notifiesListenerOfPathBuilding() {
        SolverStepListener listener = mock(SolverStepListener.class);

        new HungarianSolver(GREEDY_INCOMPLETE, listener).solve();

        verify(listener).onTransition(eq(SolverState.REDUCED), any());
        verify(listener, atLeastOnce()).onTransition(eq(SolverState.BUILD_PATH), any());
        verify(listener).onTransition(eq(SolverState.SOLVED), any());
    }

    @Test
    void instancesAreSingleUse() {
        HungarianSolver solver = new HungarianSolver(new double[][]{{1}});
        solver.solve();

        assertThatThrownBy(solver::solve).isInstanceOf(IllegalStateException.class);
    }

    private void assertOptimal(double[][] costs) {
        double[][] input = MatrixUtils.deepCopy(costs);
        AssignmentResult result = new HungarianSolver(input).solve();
        double expected = bruteForce.solve(costs, null).getTotalCost();

        assertThat(MatrixUtils.isPermutation(result.getAssignment(), costs.length)).isTrue();
        assertThat(result.getTotalCost())
                .as("optimal cost for %s", java.util.Arrays.deepToString(costs))
                .isCloseTo(expected, within(1e-6));
    }
}
