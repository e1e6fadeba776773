package com.capstone.drivesync.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class DomainError {

    private final ErrorKind kind;
    private final int httpStatus;
    private final String userMessage;
    private final String vendorCode;
    private final String detail;

    public static DomainError of(ErrorKind kind, String detail) {
        return DomainError.builder()
                .kind(kind)
                .httpStatus(kind.getDefaultStatus().value())
                .userMessage(kind.getDefaultMessage())
                .detail(detail)
                .build();
    }

    // 재시도 가능한 오류: 요청 제한, 서버측 일시 오류
    public boolean isRetryable() {
        return kind == ErrorKind.RATE_LIMITED || (kind == ErrorKind.UNKNOWN && httpStatus >= 500);
    }

    public String describe() {
        return detail == null ? userMessage : userMessage + " (" + detail + ")";
    }
}
