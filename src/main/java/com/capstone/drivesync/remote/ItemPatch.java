package com.capstone.drivesync.remote;

/**
 * 항목 수정 요청. null인 필드는 변경하지 않는다.
 */
public record ItemPatch(String name, String parentId) {

    public static ItemPatch rename(String name) {
        return new ItemPatch(name, null);
    }

    public static ItemPatch moveTo(String parentId) {
        return new ItemPatch(null, parentId);
    }
}
