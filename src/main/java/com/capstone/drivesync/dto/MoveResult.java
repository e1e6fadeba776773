package com.capstone.drivesync.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class MoveResult {
    private final String fileId;
    private final String name; // 최종 이름 (충돌 시 _N 접미사)
    private final String path;
    private final String parentFolderId;
}
