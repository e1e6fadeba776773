package com.capstone.drivesync.dto;

import com.capstone.drivesync.domain.MappingHealth;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class MappingVerification {
    private final String projectCode;
    private final MappingHealth health;
    private final FolderMappingResponse mapping; // 검사 후 최신 상태
}
