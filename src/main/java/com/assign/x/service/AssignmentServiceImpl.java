package com.assign.x.service;

import com.assign.x.dto.AssignmentRequest;
import com.assign.x.dto.AssignmentResponse;
import com.assign.x.dto.AssignmentResult;
import com.assign.x.exceptions.BadRequestException;
import com.assign.x.exceptions.InternalInvariantException;
import com.assign.x.processors.instrumentation.SolverStepListener;
import com.assign.x.processors.instrumentation.StepListenerProvider;
import com.assign.x.processors.matcher.strategies.MatchingStrategy;
import com.assign.x.processors.matcher.strategies.decider.MatchingStrategySelector;
import com.assign.x.utils.basic.DefaultValuesPopulator;
import com.assign.x.utils.basic.MatrixUtils;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.ToDoubleBiFunction;

import static com.assign.x.utils.basic.Constant.OUTCOME;
import static com.assign.x.utils.basic.Constant.SIZE;
import static com.assign.x.utils.basic.Constant.STRATEGY;
import static com.assign.x.utils.basic.Constant.TYPE;

@Slf4j
@Service
public class AssignmentServiceImpl implements AssignmentService {

    private final MatchingStrategySelector strategySelector;
    private final StepListenerProvider stepListenerProvider;
    private final CostMatrixBuilderService costMatrixBuilderService;
    private final MeterRegistry meterRegistry;
    private final int maxSize;

    public AssignmentServiceImpl(MatchingStrategySelector strategySelector,
                                 StepListenerProvider stepListenerProvider,
                                 CostMatrixBuilderService costMatrixBuilderService,
                                 MeterRegistry meterRegistry,
                                 @Value("${assign.solver.max-size:2000}") int maxSize) {
        this.strategySelector = Objects.requireNonNull(strategySelector, "strategySelector must not be null");
        this.stepListenerProvider = Objects.requireNonNull(stepListenerProvider, "stepListenerProvider must not be null");
        this.costMatrixBuilderService = Objects.requireNonNull(costMatrixBuilderService, "costMatrixBuilderService must not be null");
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
        this.maxSize = maxSize;
    }

    @Override
    public AssignmentResponse assign(AssignmentRequest request) {
        if (request == null) {
            throw new BadRequestException("Assignment request must not be null");
        }
        int n = MatrixUtils.requireSquare(request.getCosts());
        if (n > maxSize) {
            throw new BadRequestException("Cost matrix size " + n + " exceeds the configured maximum " + maxSize);
        }

        String requestId = DefaultValuesPopulator.getUid();
        MatchingStrategy strategy = strategySelector.select(request.getStrategy());
        SolverStepListener listener = stepListenerProvider.forRequest(requestId, request.isTraceSteps());
        log.info("requestId={} solving {}x{} assignment with {}", requestId, n, n, strategy.getClass().getSimpleName());

        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "failure";
        AssignmentResult result;
        long nanos;
        try {
            result = strategy.solve(request.getCosts(), listener);
            outcome = "success";
        } catch (InternalInvariantException e) {
            meterRegistry.counter("assignment_solve_errors", TYPE, "invariant", SIZE, MatrixUtils.sizeBucket(n)).increment();
            log.error("requestId={} solver invariant failed in state {}: {}", requestId, e.getState(), e.getMessage(), e);
            throw e;
        } catch (BadRequestException e) {
            meterRegistry.counter("assignment_solve_errors", TYPE, "bad_request", SIZE, MatrixUtils.sizeBucket(n)).increment();
            log.warn("requestId={} rejected: {}", requestId, e.getMessage());
            throw e;
        } finally {
            nanos = sample.stop(meterRegistry.timer("assignment_solve_duration",
                    STRATEGY, strategy.name(), SIZE, MatrixUtils.sizeBucket(n), OUTCOME, outcome));
        }
        meterRegistry.counter("assignment_solved_total", STRATEGY, result.getStrategy()).increment();

        log.info("requestId={} solved size {} with cost {} ({} augmentations, {} potential adjustments)",
                requestId, n, result.getTotalCost(), result.getAugmentations(), result.getPotentialAdjustments());
        return AssignmentResponse.builder()
                .requestId(requestId)
                .strategy(result.getStrategy())
                .size(result.size())
                .assignment(result.getAssignment())
                .totalCost(result.getTotalCost())
                .augmentations(result.getAugmentations())
                .potentialAdjustments(result.getPotentialAdjustments())
                .durationMillis(TimeUnit.NANOSECONDS.toMillis(nanos))
                .build();
    }

    @Override
    public <L, R> CompletableFuture<AssignmentResponse> assignAsync(List<L> rows, List<R> cols,
                                                                    ToDoubleBiFunction<L, R> scorer, String mode) {
        return costMatrixBuilderService.build(rows, cols, scorer)
                .thenApply(costs -> assign(AssignmentRequest.builder().costs(costs).strategy(mode).build()));
    }
}
