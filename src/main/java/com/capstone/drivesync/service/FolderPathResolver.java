package com.capstone.drivesync.service;

import com.capstone.drivesync.domain.DomainError;
import com.capstone.drivesync.domain.ErrorKind;
import com.capstone.drivesync.exception.DriveSyncException;
import com.capstone.drivesync.exception.RemoteDriveException;
import com.capstone.drivesync.remote.DriveItem;
import com.capstone.drivesync.remote.RemoteDriveClient;
import com.capstone.drivesync.remote.RemoteErrorClassifier;
import com.capstone.drivesync.util.DrivePaths;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 경로를 구간별로 따라가며 없는 폴더를 만든다.
 * 중간 폴더 생성은 관대하다: 409가 나면 이미 있는 폴더를 그대로 쓴다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FolderPathResolver {

    private final RemoteErrorClassifier errorClassifier;

    public Optional<DriveItem> find(RemoteDriveClient client, String pathOrId) {
        try {
            return Optional.ofNullable(client.getItem(pathOrId));
        } catch (RemoteDriveException e) {
            DomainError error = errorClassifier.classify(e);
            if (error.getKind() == ErrorKind.NOT_FOUND) {
                return Optional.empty();
            }
            throw new DriveSyncException(error, e);
        }
    }

    public DriveItem resolveOrCreate(RemoteDriveClient client, String path) {
        Optional<DriveItem> existing = find(client, path);
        if (existing.isPresent()) {
            return existing.get();
        }

        String currentPath = "";
        String parentRef = DrivePaths.ROOT;
        DriveItem current = null;
        for (String segment : path.split("/")) {
            if (segment.isEmpty()) {
                continue;
            }
            currentPath = currentPath + "/" + segment;
            current = find(client, currentPath).orElse(null);
            if (current == null) {
                current = createPermissive(client, parentRef, segment, currentPath);
            }
            parentRef = current.id();
        }
        if (current == null) {
            // 루트 자체가 조회되지 않는 경우
            throw DriveSyncException.of(ErrorKind.NOT_FOUND, "드라이브 루트를 찾을 수 없습니다.");
        }
        return current;
    }

    private DriveItem createPermissive(RemoteDriveClient client, String parentRef, String name, String fullPath) {
        try {
            log.info("중간 폴더 생성: {}", fullPath);
            return client.createFolder(parentRef, name);
        } catch (RemoteDriveException e) {
            DomainError error = errorClassifier.classify(e);
            if (error.getKind() != ErrorKind.NAME_CONFLICT) {
                throw new DriveSyncException(error, e);
            }
            // 다른 요청이 먼저 만든 경우
            log.debug("이미 존재하는 폴더 재사용: {}", fullPath);
            return find(client, fullPath)
                    .orElseThrow(() -> new DriveSyncException(error, e));
        }
    }
}
