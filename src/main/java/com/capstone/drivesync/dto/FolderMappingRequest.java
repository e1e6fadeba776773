package com.capstone.drivesync.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class FolderMappingRequest {
    private String projectCode;
    private String remoteFolderId; // 모르면 비워 둔다
    private String remoteFolderPath;
    private String remoteFolderName;
}
