package com.capstone.drivesync.dto;

import com.capstone.drivesync.domain.ReconcileStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ReconcileOutcome {
    private final String projectCode;
    private final ReconcileStatus status;
    private final String message;
    private final String folderId; // 오류면 null
}
