package com.capstone.drivesync.domain;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 원격 드라이브 작업에서 발생하는 오류 분류.
 * 모든 사용자 노출 오류는 이 분류 중 하나로 변환된다.
 */
@Getter
public enum ErrorKind {

    INVALID_NAME(HttpStatus.BAD_REQUEST, "폴더 또는 파일 이름이 올바르지 않습니다."),
    NAME_CONFLICT(HttpStatus.CONFLICT, "같은 이름의 항목이 이미 존재합니다."),
    QUOTA_EXCEEDED(HttpStatus.INSUFFICIENT_STORAGE, "드라이브 저장 공간이 부족합니다."),
    AUTH_EXPIRED(HttpStatus.UNAUTHORIZED, "드라이브 인증이 만료되었습니다. 다시 연결해 주세요."),
    PERMISSION_DENIED(HttpStatus.FORBIDDEN, "해당 위치에 접근할 권한이 없습니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "요청한 항목을 찾을 수 없습니다."),
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS, "요청이 너무 많습니다. 잠시 후 다시 시도해 주세요."),
    TEMPLATE_PARTIAL_FAILURE(HttpStatus.MULTI_STATUS, "일부 하위 폴더를 생성하지 못했습니다."),
    MISSING_PARAMETER(HttpStatus.BAD_REQUEST, "필수 입력값이 누락되었습니다."),
    DUPLICATE_MAPPING(HttpStatus.CONFLICT, "이미 연결된 프로젝트 폴더가 있습니다."),
    UNKNOWN(HttpStatus.INTERNAL_SERVER_ERROR, "드라이브 작업 중 알 수 없는 오류가 발생했습니다.");

    private final HttpStatus defaultStatus;
    private final String defaultMessage;

    ErrorKind(HttpStatus defaultStatus, String defaultMessage) {
        this.defaultStatus = defaultStatus;
        this.defaultMessage = defaultMessage;
    }
}
