package com.hoopstats.application.usecase;

import com.hoopstats.domain.model.CollectionStatus;
import com.hoopstats.domain.model.ValidationOutcome;

import java.util.List;

/**
 * Terminal result of one source within a run. Only usable (accepted or repaired) outcomes are kept.
 */
public record SourceResult(String sourceId, CollectionStatus status, List<ValidationOutcome> outcomes) {

    public boolean contributes() {
        return status != CollectionStatus.FAILED && !outcomes.isEmpty();
    }
}
