package com.hoopstats.application.reconcile;

import com.hoopstats.domain.model.CanonicalRecord;

import java.util.List;

public record MergeResult(CanonicalRecord record, List<FieldConflict> conflicts) {
}
