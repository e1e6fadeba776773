package com.capstone.drivesync.dto;

import com.capstone.drivesync.domain.DomainError;
import com.capstone.drivesync.domain.PartialResult;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ProvisionResult {
    private final ProvisionedFolder folder; // 생성된 프로젝트 루트 폴더
    private final PartialResult<String> subfolders; // 하위 폴더 생성 결과
    private final DomainError warning; // 일부 실패 시 TEMPLATE_PARTIAL_FAILURE, 아니면 null
}
