package com.capstone.drivesync.dto;

import com.capstone.drivesync.domain.ReconcileStatus;
import lombok.Getter;

import java.util.List;

@Getter
public class ReconcileReport {

    private final int processed;
    private final int successful;
    private final List<ReconcileOutcome> results;

    public ReconcileReport(List<ReconcileOutcome> results) {
        this.results = results;
        this.processed = results.size();
        this.successful = (int) results.stream()
                .filter(outcome -> outcome.getStatus() != ReconcileStatus.ERROR)
                .count();
    }
}
