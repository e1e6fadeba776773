package com.capstone.drivesync.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 다단계 작업 중 실패한 하나의 대상(하위 폴더 이름, 스캔 경로 등)과 그 원인.
 */
@Getter
@AllArgsConstructor
public class FailureRecord {

    private final String target;
    private final DomainError error;
}
