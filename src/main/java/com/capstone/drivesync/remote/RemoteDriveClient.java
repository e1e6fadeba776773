package com.capstone.drivesync.remote;

import java.util.List;

/**
 * 원격 드라이브에 대한 최소 인터페이스.
 * pathOrId가 "/"로 시작하면 루트 기준 경로, 아니면 항목 ID로 취급한다.
 * 모든 메서드는 실패 시 {@link com.capstone.drivesync.exception.RemoteDriveException}을 던진다.
 */
public interface RemoteDriveClient {

    List<DriveItem> listChildren(String pathOrId);

    DriveItem getItem(String pathOrId);

    // 같은 이름이 있으면 409로 실패한다
    DriveItem createFolder(String parentPathOrId, String name);

    DriveItem patchItem(String id, ItemPatch patch);

    byte[] getContent(String id);

    DriveItem putContent(String pathOrId, byte[] content);

    List<DriveItem> search(String query);
}
