package com.assign.x.processors.instrumentation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the step listener for one solve from configuration and the request's trace flag.
 * Returns {@link SolverStepListener#NO_OP} when nothing is enabled so the solver skips snapshots entirely.
 */
@Slf4j
@Component
public class StepListenerProvider {

    private final boolean stepLogging;
    private final boolean htmlStepsEnabled;
    private final Path htmlStepsDir;

    public StepListenerProvider(
            @Value("${assign.solver.step-logging:false}") boolean stepLogging,
            @Value("${assign.solver.html-steps.enabled:false}") boolean htmlStepsEnabled,
            @Value("${assign.solver.html-steps.dir:/tmp/hungarian_steps}") String htmlStepsDir) {
        this.stepLogging = stepLogging;
        this.htmlStepsEnabled = htmlStepsEnabled;
        this.htmlStepsDir = Path.of(htmlStepsDir);
    }

    public SolverStepListener forRequest(String requestId, boolean traceSteps) {
        List<SolverStepListener> listeners = new ArrayList<>();
        if (stepLogging || traceSteps) {
            listeners.add(new LoggingStepListener(requestId));
        }
        if (htmlStepsEnabled && traceSteps) {
            listeners.add(new HtmlStepWriter(htmlStepsDir.resolve(requestId)));
        }

        if (listeners.isEmpty()) {
            return SolverStepListener.NO_OP;
        }
        log.debug("requestId={} attaching {} step listener(s)", requestId, listeners.size());
        return listeners.size() == 1 ? listeners.get(0) : new CompositeStepListener(listeners);
    }
}
