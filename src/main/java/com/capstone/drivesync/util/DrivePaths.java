package com.capstone.drivesync.util;

import com.capstone.drivesync.domain.ErrorKind;
import com.capstone.drivesync.exception.DriveSyncException;

public final class DrivePaths {

    public static final String ROOT = "/";

    private DrivePaths() {
    }

    // "/"로 시작하면 경로, 아니면 항목 ID
    public static boolean isPath(String pathOrId) {
        return pathOrId != null && pathOrId.startsWith("/");
    }

    /**
     * 중복 슬래시를 합치고 앞에 "/"를 붙이며 끝의 "/"를 뗀다.
     * ".." 구간은 조용히 지우지 않고 거부한다.
     */
    public static String normalize(String path) {
        if (path == null || path.isBlank()) {
            throw DriveSyncException.of(ErrorKind.MISSING_PARAMETER, "경로가 비어 있습니다.");
        }
        String trimmed = path.trim();
        for (String segment : trimmed.split("/")) {
            if ("..".equals(segment) || ".".equals(segment)) {
                throw DriveSyncException.of(ErrorKind.INVALID_NAME, "상대 경로 구간은 사용할 수 없습니다: " + path);
            }
        }
        String normalized = ("/" + trimmed).replaceAll("/+", "/");
        if (normalized.length() > 1 && normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }

    public static String join(String parent, String name) {
        if (parent == null || parent.isEmpty() || ROOT.equals(parent)) {
            return ROOT + name;
        }
        return parent.endsWith("/") ? parent + name : parent + "/" + name;
    }

    // 마지막 구간, 루트면 "Root"
    public static String lastSegment(String path) {
        if (path == null || ROOT.equals(path) || path.isEmpty()) {
            return "Root";
        }
        String stripped = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
        return stripped.substring(stripped.lastIndexOf('/') + 1);
    }
}
