package com.capstone.drivesync.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class RootFolderConfiguration {
    private String folderPath; // 예: /Progetti
    private String folderId; // 원격 폴더 ID
    private String folderName; // 경로의 마지막 구간, 루트면 "Root"
    private LocalDateTime lastUpdated;
}
