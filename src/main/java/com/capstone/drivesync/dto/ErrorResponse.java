package com.capstone.drivesync.dto;

import com.capstone.drivesync.domain.DomainError;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.LocalDateTime;

@Getter
@AllArgsConstructor
public class ErrorResponse {

    private String kind;
    private String message;
    private String vendorCode;
    private String detail;
    private boolean retryable;
    private LocalDateTime timestamp;

    public static ErrorResponse from(DomainError error) {
        return new ErrorResponse(error.getKind().name(), error.getUserMessage(), error.getVendorCode(),
                error.getDetail(), error.isRetryable(), LocalDateTime.now());
    }
}
