package com.capstone.drivesync.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ValidationResult {

    private static final ValidationResult VALID = new ValidationResult(true, null, null);

    private final boolean valid;
    private final String reason;
    private final String failedSegment;

    public static ValidationResult ok() {
        return VALID;
    }

    public static ValidationResult invalid(String reason) {
        return new ValidationResult(false, reason, null);
    }

    public static ValidationResult invalid(String reason, String failedSegment) {
        return new ValidationResult(false, reason, failedSegment);
    }
}
