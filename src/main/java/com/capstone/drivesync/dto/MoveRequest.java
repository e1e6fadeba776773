package com.capstone.drivesync.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class MoveRequest {
    private String targetFolderId; // 대상 폴더 ID
    private String targetPath; // 또는 대상 경로 (없으면 생성)
    private String newFileName; // 이름 변경 (대상이 없으면 제자리 이름 변경)
}
