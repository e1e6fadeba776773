package com.capstone.drivesync.exception;

import com.capstone.drivesync.domain.DomainError;
import com.capstone.drivesync.domain.ErrorKind;
import com.capstone.drivesync.dto.ErrorResponse;
import com.capstone.drivesync.remote.RemoteErrorClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final RemoteErrorClassifier errorClassifier;

    @ExceptionHandler(DriveSyncException.class)
    public ResponseEntity<ErrorResponse> handleDriveSync(DriveSyncException e) {
        DomainError error = e.getError();
        log.warn("드라이브 작업 실패: kind={}, detail={}", error.getKind(), error.getDetail());
        return ResponseEntity.status(error.getHttpStatus()).body(ErrorResponse.from(error));
    }

    // 서비스에서 분류되지 않고 올라온 원격 오류
    @ExceptionHandler(RemoteDriveException.class)
    public ResponseEntity<ErrorResponse> handleRemote(RemoteDriveException e) {
        DomainError error = errorClassifier.classify(e);
        log.warn("원격 드라이브 오류: status={}, kind={}", e.getStatusCode(), error.getKind());
        return ResponseEntity.status(error.getHttpStatus()).body(ErrorResponse.from(error));
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResourceNotFoundException e) {
        DomainError error = DomainError.builder()
                .kind(ErrorKind.NOT_FOUND)
                .httpStatus(404)
                .userMessage(e.getMessage())
                .build();
        return ResponseEntity.status(404).body(ErrorResponse.from(error));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        DomainError error = DomainError.builder()
                .kind(ErrorKind.MISSING_PARAMETER)
                .httpStatus(400)
                .userMessage(e.getMessage())
                .build();
        return ResponseEntity.badRequest().body(ErrorResponse.from(error));
    }
}
