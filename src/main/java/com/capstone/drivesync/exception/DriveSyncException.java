package com.capstone.drivesync.exception;

import com.capstone.drivesync.domain.DomainError;
import com.capstone.drivesync.domain.ErrorKind;
import lombok.Getter;

/**
 * 분류가 끝난 오류. 서비스 경계 밖으로는 이 예외만 나간다.
 */
@Getter
public class DriveSyncException extends RuntimeException {

    private final DomainError error;

    public DriveSyncException(DomainError error) {
        super(error.describe());
        this.error = error;
    }

    public DriveSyncException(DomainError error, Throwable cause) {
        super(error.describe(), cause);
        this.error = error;
    }

    public static DriveSyncException of(ErrorKind kind, String detail) {
        return new DriveSyncException(DomainError.of(kind, detail));
    }

    public ErrorKind getKind() {
        return error.getKind();
    }
}
