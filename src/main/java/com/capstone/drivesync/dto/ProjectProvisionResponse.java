package com.capstone.drivesync.dto;

import com.capstone.drivesync.domain.DomainError;
import com.capstone.drivesync.domain.FailureRecord;
import lombok.Getter;

import java.util.List;

@Getter
public class ProjectProvisionResponse {

    private final ProvisionedFolder folder;
    private final FolderMappingResponse mapping;
    private final List<String> createdSubfolders;
    private final List<FailureRecord> failedSubfolders;
    private final DomainError warning;

    public ProjectProvisionResponse(ProvisionResult result, FolderMappingResponse mapping) {
        this.folder = result.getFolder();
        this.mapping = mapping;
        this.createdSubfolders = result.getSubfolders().getSucceeded();
        this.failedSubfolders = result.getSubfolders().getFailed();
        this.warning = result.getWarning();
    }
}
