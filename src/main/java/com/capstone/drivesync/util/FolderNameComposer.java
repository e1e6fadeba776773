package com.capstone.drivesync.util;

/**
 * 프로젝트 코드와 설명으로 원격 폴더 이름을 만든다.
 */
public final class FolderNameComposer {

    public static final int MAX_FOLDER_NAME_LENGTH = 255;

    private static final String CODE_DISALLOWED = "[^a-zA-Z0-9_-]";
    // 이탈리아어 악센트 문자는 허용
    private static final String DESCRIPTION_DISALLOWED = "[^a-zA-Z0-9_\\-àáèéìíòóùúÀÁÈÉÌÍÒÓÙÚçÇñÑ]";

    private FolderNameComposer() {
    }

    public static String sanitizeProjectCode(String code) {
        return code == null ? "" : code.replaceAll(CODE_DISALLOWED, "");
    }

    public static String sanitizeDescription(String description) {
        if (description == null) {
            return "";
        }
        return description.trim()
                .replaceAll("\\s+", "_")
                .replaceAll(DESCRIPTION_DISALLOWED, "")
                .replaceAll("_+", "_")
                .replaceAll("^_+|_+$", "");
    }

    /**
     * CODE 또는 CODE_DESCRIPTION. 255자를 넘으면 코드는 유지하고 설명을 자른다.
     */
    public static String compose(String projectCode, String description) {
        String code = sanitizeProjectCode(projectCode);
        String desc = sanitizeDescription(description);
        if (desc.isEmpty()) {
            return code;
        }
        String name = code + "_" + desc;
        if (name.length() <= MAX_FOLDER_NAME_LENGTH) {
            return name;
        }
        int room = MAX_FOLDER_NAME_LENGTH - code.length() - 1;
        if (room <= 0) {
            return code;
        }
        String truncated = desc.substring(0, room).replaceAll("_+$", "");
        return truncated.isEmpty() ? code : code + "_" + truncated;
    }
}
