package com.assign.x.service;

import com.assign.x.exceptions.DimensionException;
import com.assign.x.utils.basic.MatrixUtils;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.function.ToDoubleBiFunction;

/**
 * Scores every (row item, column item) pair into a square cost matrix, one executor task per row.
 * <p>
 * Each task writes only its own row, so no locking is needed; the returned future completes once every
 * row task has finished, which is the only point where the matrix is safe to hand to a solver.
 * </p>
 */
@Slf4j
@Service
public class CostMatrixBuilder implements CostMatrixBuilderService {

    private final ExecutorService costMatrixExecutor;
    private final MeterRegistry meterRegistry;

    public CostMatrixBuilder(@Qualifier("costMatrixExecutor") ExecutorService costMatrixExecutor,
                             MeterRegistry meterRegistry) {
        this.costMatrixExecutor = Objects.requireNonNull(costMatrixExecutor, "costMatrixExecutor must not be null");
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
    }

    @Override
    public <L, R> CompletableFuture<double[][]> build(List<L> rows, List<R> cols, ToDoubleBiFunction<L, R> scorer) {
        Objects.requireNonNull(scorer, "scorer must not be null");
        if (rows == null || cols == null || rows.isEmpty()) {
            return CompletableFuture.failedFuture(
                    new DimensionException("Cost matrix needs at least one row and one column"));
        }
        if (rows.size() != cols.size()) {
            return CompletableFuture.failedFuture(new DimensionException("Cost matrix must be square, got "
                    + rows.size() + " rows and " + cols.size() + " columns"));
        }

        int n = rows.size();
        double[][] costs = new double[n][n];
        Timer.Sample sample = Timer.start(meterRegistry);
        log.info("Building {}x{} cost matrix", n, n);

        List<CompletableFuture<Void>> rowFutures = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            final int row = i;
            rowFutures.add(CompletableFuture.runAsync(() -> fillRow(costs[row], rows.get(row), cols, scorer),
                    costMatrixExecutor));
        }

        return CompletableFuture.allOf(rowFutures.toArray(new CompletableFuture[0]))
                .thenApply(v -> costs)
                .whenComplete((result, throwable) -> {
                    sample.stop(meterRegistry.timer("cost_matrix_build_duration", "size", MatrixUtils.sizeBucket(n)));
                    if (throwable != null) {
                        log.error("Cost matrix build of size {} failed: {}", n, throwable.getMessage());
                    } else {
                        log.debug("Cost matrix of size {} built", n);
                    }
                });
    }

    private static <L, R> void fillRow(double[] target, L rowItem, List<R> cols, ToDoubleBiFunction<L, R> scorer) {
        for (int j = 0; j < target.length; j++) {
            target[j] = scorer.applyAsDouble(rowItem, cols.get(j));
        }
    }
}
