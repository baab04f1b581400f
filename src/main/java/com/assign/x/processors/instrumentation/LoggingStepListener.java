package com.assign.x.processors.instrumentation;

import com.assign.x.dto.SolverSnapshot;
import com.assign.x.models.SolverState;
import lombok.extern.slf4j.Slf4j;

/**
 * Logs every transition at debug level with the working matrix as a text grid.
 * Selected zeros are suffixed with {@code *}, prepared zeros with {@code '}, covered lines with {@code |} and {@code -}.
 */
@Slf4j
public class LoggingStepListener implements SolverStepListener {

    private final String requestId;

    public LoggingStepListener(String requestId) {
        this.requestId = requestId;
    }

    @Override
    public void onTransition(SolverState state, SolverSnapshot snapshot) {
        if (!log.isDebugEnabled()) {
            return;
        }
        log.debug("requestId={} step={} state={} path={}/{}\n{}", requestId, snapshot.step(), state,
                snapshot.preparedPath(), snapshot.selectedPath(), render(snapshot));
    }

    static String render(SolverSnapshot snapshot) {
        int n = snapshot.size();
        StringBuilder sb = new StringBuilder();
        sb.append("     ");
        for (int j = 0; j < n; j++) {
            sb.append(String.format("%10s", snapshot.coveredCols()[j] ? "|" + j + "|" : String.valueOf(j)));
        }
        sb.append('\n');
        for (int i = 0; i < n; i++) {
            sb.append(String.format("%4s ", snapshot.coveredRows()[i] ? "-" + i : String.valueOf(i)));
            for (int j = 0; j < n; j++) {
                String mark = snapshot.isSelected(i, j) ? "*" : snapshot.isPrepared(i, j) ? "'" : " ";
                sb.append(String.format("%9.3f%s", snapshot.matrix()[i][j], mark));
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
