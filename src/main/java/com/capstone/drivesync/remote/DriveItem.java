package com.capstone.drivesync.remote;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;

/**
 * Graph driveItem 응답 중 이 서비스가 사용하는 필드.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DriveItem(
        String id,
        String name,
        Long size,
        OffsetDateTime lastModifiedDateTime,
        String webUrl,
        Folder folder,
        File file,
        ParentReference parentReference,
        @JsonProperty("@microsoft.graph.downloadUrl") String downloadUrl
) {

    private static final String ROOT_PREFIX = "/drive/root:";

    @JsonIgnore
    public boolean isDirectory() {
        return folder != null;
    }

    @JsonIgnore
    public String mimeType() {
        return file != null ? file.mimeType() : null;
    }

    @JsonIgnore
    public String parentId() {
        return parentReference != null ? parentReference.id() : null;
    }

    /**
     * parentReference.path("/drive/root:/A/B")를 드라이브 경로("/A/B")로 바꾼다.
     * 루트 바로 아래 항목은 "/"를 돌려준다.
     */
    @JsonIgnore
    public String parentPath() {
        if (parentReference == null || parentReference.path() == null) {
            return null;
        }
        String path = parentReference.path();
        int idx = path.indexOf(ROOT_PREFIX);
        if (idx >= 0) {
            path = path.substring(idx + ROOT_PREFIX.length());
        }
        return path.isEmpty() ? "/" : path;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Folder(Integer childCount) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record File(String mimeType) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ParentReference(String id, String driveId, String path) {
    }
}
