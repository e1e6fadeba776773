package com.capstone.drivesync.dto;

import com.capstone.drivesync.entity.ProjectFolderMapping;
import lombok.Getter;

import java.time.LocalDateTime;

@Getter
public class FolderMappingResponse {

    private final String projectCode;
    private final String remoteFolderId;
    private final String remoteFolderPath;
    private final String remoteFolderName;
    private final LocalDateTime createdAt;
    private final LocalDateTime updatedAt;

    public FolderMappingResponse(ProjectFolderMapping mapping) {
        this.projectCode = mapping.getProjectCode();
        this.remoteFolderId = mapping.getRemoteFolderId();
        this.remoteFolderPath = mapping.getRemoteFolderPath();
        this.remoteFolderName = mapping.getRemoteFolderName();
        this.createdAt = mapping.getCreatedAt();
        this.updatedAt = mapping.getUpdatedAt();
    }
}
