package com.capstone.drivesync.dto;

import com.capstone.drivesync.entity.RemoteFileRecord;
import lombok.Getter;

import java.time.LocalDateTime;

@Getter
public class FileIndexResponse {

    private final String driveItemId;
    private final String name;
    private final String path;
    private final long size;
    private final String mimeType;
    private final LocalDateTime lastModified;
    private final String projectCode;
    private final String parentFolderId;
    private final boolean folder;
    private final String webUrl;
    private final String downloadUrl;

    public FileIndexResponse(RemoteFileRecord record) {
        this.driveItemId = record.getDriveItemId();
        this.name = record.getName();
        this.path = record.getPath();
        this.size = record.getSize();
        this.mimeType = record.getMimeType();
        this.lastModified = record.getLastModified();
        this.projectCode = record.getProjectCode();
        this.parentFolderId = record.getParentFolderId();
        this.folder = record.isFolder();
        this.webUrl = record.getWebUrl();
        this.downloadUrl = record.getDownloadUrl();
    }
}
