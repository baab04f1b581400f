package com.assign.x.processors.matcher.strategies;

import com.assign.x.dto.AssignmentResult;
import com.assign.x.exceptions.BadRequestException;
import com.assign.x.processors.instrumentation.SolverStepListener;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BruteForceMatchingStrategyTest {

    private final BruteForceMatchingStrategy strategy = new BruteForceMatchingStrategy();

    @Test
    void findsTheCheapestPermutation() {
        AssignmentResult result = strategy.solve(new double[][]{{1, 2, 3}, {2, 4, 6}, {3, 6, 9}}, SolverStepListener.NO_OP);

        assertThat(result.getAssignment()).containsExactly(2, 1, 0);
        assertThat(result.getTotalCost()).isEqualTo(10.0);
        assertThat(result.getIterations()).isEqualTo(6);
        assertThat(result.getStrategy()).isEqualTo("BRUTE_FORCE");
    }

    @Test
    void keepsTheFirstPermutationOnTies() {
        AssignmentResult result = strategy.solve(new double[][]{{1, 1}, {1, 1}}, null);

        assertThat(result.getAssignment()).containsExactly(0, 1);
    }

    @Test
    void refusesLargeMatrices() {
        double[][] costs = new double[BruteForceMatchingStrategy.MAX_SIZE + 1][BruteForceMatchingStrategy.MAX_SIZE + 1];

        assertThatThrownBy(() -> strategy.solve(costs, null)).isInstanceOf(BadRequestException.class);
    }

    @Test
    void supportsItsModeCaseInsensitively() {
        assertThat(strategy.supports("brute_force")).isTrue();
        assertThat(strategy.supports("HUNGARIAN")).isFalse();
        assertThat(new HungarianMatchingStrategy().supports("hungarian")).isTrue();
    }
}
