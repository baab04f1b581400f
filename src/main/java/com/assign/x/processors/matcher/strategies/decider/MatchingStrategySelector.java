package com.assign.x.processors.matcher.strategies.decider;

import com.assign.x.exceptions.BadRequestException;
import com.assign.x.processors.matcher.strategies.MatchingStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Map;

@Slf4j
@Service
public class MatchingStrategySelector {

    private final Map<String, MatchingStrategy> strategyMap;
    private final String defaultMode;

    public MatchingStrategySelector(Map<String, MatchingStrategy> strategyMap,
                                    @Value("${assign.solver.default-strategy:HUNGARIAN}") String defaultMode) {
        this.strategyMap = strategyMap;
        this.defaultMode = defaultMode;
    }

    /**
     * Returns the strategy supporting {@code mode}, or the configured default when {@code mode} is blank.
     *
     * @throws BadRequestException if no registered strategy supports the mode
     */
    public MatchingStrategy select(String mode) {
        String effectiveMode = mode == null || mode.isBlank() ? defaultMode : mode.trim();
        for (Map.Entry<String, MatchingStrategy> entry : strategyMap.entrySet()) {
            if (entry.getValue().supports(effectiveMode)) {
                log.debug("Selected strategy bean {} for mode {}", entry.getKey(), effectiveMode);
                return entry.getValue();
            }
        }
        throw new BadRequestException("No matching strategy found for algorithm: " + effectiveMode);
    }
}
