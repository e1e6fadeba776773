package com.capstone.drivesync.service;

import com.capstone.drivesync.domain.DomainError;
import com.capstone.drivesync.domain.ErrorKind;
import com.capstone.drivesync.dto.BulkRenameResult;
import com.capstone.drivesync.dto.MoveResult;
import com.capstone.drivesync.dto.RenameOperation;
import com.capstone.drivesync.exception.DriveSyncException;
import com.capstone.drivesync.exception.RemoteDriveException;
import com.capstone.drivesync.remote.DriveItem;
import com.capstone.drivesync.remote.ItemPatch;
import com.capstone.drivesync.remote.RemoteDriveClient;
import com.capstone.drivesync.remote.RemoteDriveClientFactory;
import com.capstone.drivesync.remote.RemoteErrorClassifier;
import com.capstone.drivesync.util.DriveNameValidator;
import com.capstone.drivesync.util.DrivePaths;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 파일 이동과 이름 변경.
 * 대상이 없으면 제자리 이름 변경, 있으면 이동(필요하면 이름 변경 포함)이다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FileMoveService {

    public static final int MAX_SUFFIX_ATTEMPTS = 100;

    private final RemoteDriveClientFactory clientFactory;
    private final RemoteErrorClassifier errorClassifier;
    private final FolderPathResolver folderPathResolver;
    private final DriveNameValidator nameValidator;
    private final FileIndexService fileIndexService;

    @Value("${drive.bulk.delay-ms:100}")
    private long bulkDelayMs;

    @Value("${drive.bulk.max-operations:100}")
    private int maxBulkOperations;

    public MoveResult moveOrRename(String fileId, String targetFolderId, String targetPath, String newName) {
        // 로컬 검사 먼저
        if (!StringUtils.hasText(fileId)) {
            throw DriveSyncException.of(ErrorKind.MISSING_PARAMETER, "파일 ID가 필요합니다.");
        }
        boolean hasFolderId = StringUtils.hasText(targetFolderId);
        boolean hasPath = StringUtils.hasText(targetPath);
        boolean hasNewName = StringUtils.hasText(newName);
        if (!hasFolderId && !hasPath && !hasNewName) {
            throw DriveSyncException.of(ErrorKind.MISSING_PARAMETER, "제자리 이름 변경에는 새 파일명이 필요합니다.");
        }
        if (hasNewName) {
            nameValidator.requireValidName(newName);
        }
        String normalizedPath = null;
        if (!hasFolderId && hasPath) {
            normalizedPath = DrivePaths.normalize(targetPath);
            nameValidator.requireValidPath(normalizedPath);
        }

        RemoteDriveClient client = clientFactory.open();
        DriveItem source = folderPathResolver.find(client, fileId)
                .orElseThrow(() -> DriveSyncException.of(ErrorKind.NOT_FOUND, "파일을 찾을 수 없습니다: " + fileId));

        MoveResult result;
        if (!hasFolderId && !hasPath) {
            DriveItem renamed = patch(client, fileId, ItemPatch.rename(newName));
            String parentPath = renamed.parentPath() != null ? renamed.parentPath() : source.parentPath();
            String parentId = renamed.parentId() != null ? renamed.parentId() : source.parentId();
            result = new MoveResult(fileId, renamed.name(), DrivePaths.join(parentPath, renamed.name()), parentId);
            log.info("파일 이름 변경: {} -> {}", source.name(), renamed.name());
        } else {
            DriveItem target;
            String destinationPath;
            if (hasFolderId) {
                target = folderPathResolver.find(client, targetFolderId)
                        .orElseThrow(() -> DriveSyncException.of(ErrorKind.NOT_FOUND, "대상 폴더를 찾을 수 없습니다: " + targetFolderId));
                // 부모 참조가 없으면 드라이브 루트
                destinationPath = target.parentPath() != null
                        ? DrivePaths.join(target.parentPath(), target.name()) : DrivePaths.ROOT;
            } else {
                target = folderPathResolver.resolveOrCreate(client, normalizedPath);
                destinationPath = normalizedPath;
            }

            String finalName = hasNewName ? resolveAvailableName(client, target.id(), newName, fileId) : null;
            DriveItem moved = patch(client, fileId, new ItemPatch(finalName, target.id()));
            String movedName = moved.name() != null ? moved.name() : (finalName != null ? finalName : source.name());
            result = new MoveResult(fileId, movedName, DrivePaths.join(destinationPath, movedName), target.id());
            log.info("파일 이동: {} -> {}", source.name(), result.getPath());
        }

        fileIndexService.applyMove(result);
        return result;
    }

    /**
     * 대상 폴더에 같은 이름이 있으면 확장자 앞에 _1, _2 ... 를 붙인다.
     * 목록 조회에 실패하면 원하는 이름 그대로 진행한다.
     */
    String resolveAvailableName(RemoteDriveClient client, String folderId, String desiredName, String movingFileId) {
        Set<String> taken;
        try {
            taken = client.listChildren(folderId).stream()
                    .filter(item -> !item.id().equals(movingFileId))
                    .map(DriveItem::name)
                    .collect(Collectors.toSet());
        } catch (RemoteDriveException e) {
            log.warn("대상 폴더 목록 조회 실패, 원래 이름으로 진행: {}", e.getMessage());
            return desiredName;
        }

        if (!taken.contains(desiredName)) {
            return desiredName;
        }
        for (int counter = 1; counter <= MAX_SUFFIX_ATTEMPTS; counter++) {
            String candidate = withSuffix(desiredName, counter);
            if (!taken.contains(candidate)) {
                return candidate;
            }
        }
        throw DriveSyncException.of(ErrorKind.NAME_CONFLICT, "사용 가능한 파일 이름을 찾지 못했습니다: " + desiredName);
    }

    static String withSuffix(String name, int counter) {
        int dot = name.lastIndexOf('.');
        if (dot > 0) {
            return name.substring(0, dot) + "_" + counter + name.substring(dot);
        }
        return name + "_" + counter;
    }

    // 여러 파일 이름 변경. 요청 사이에 간격을 두고 하나씩 처리한다
    public BulkRenameResult bulkRename(List<RenameOperation> operations) {
        if (operations == null || operations.isEmpty()) {
            throw DriveSyncException.of(ErrorKind.MISSING_PARAMETER, "이름 변경 목록이 비어 있습니다.");
        }
        if (operations.size() > maxBulkOperations) {
            throw new IllegalArgumentException("한 번에 최대 " + maxBulkOperations + "개까지 변경할 수 있습니다.");
        }

        List<BulkRenameResult.Item> results = new ArrayList<>();
        for (int i = 0; i < operations.size(); i++) {
            RenameOperation operation = operations.get(i);
            if (i > 0 && !pause()) {
                DomainError interrupted = DomainError.of(ErrorKind.UNKNOWN, "일괄 작업이 중단되었습니다.");
                for (RenameOperation skipped : operations.subList(i, operations.size())) {
                    results.add(new BulkRenameResult.Item(skipped.getFileId(), false, null, interrupted));
                }
                break;
            }
            try {
                if (!StringUtils.hasText(operation.getFileId()) || !StringUtils.hasText(operation.getNewName())) {
                    throw DriveSyncException.of(ErrorKind.MISSING_PARAMETER, "파일 ID와 새 이름이 필요합니다.");
                }
                MoveResult renamed = moveOrRename(operation.getFileId(), null, null, operation.getNewName());
                results.add(new BulkRenameResult.Item(operation.getFileId(), true, renamed.getName(), null));
            } catch (RuntimeException e) {
                DomainError error = errorClassifier.classify(e);
                log.warn("일괄 이름 변경 실패: {} ({})", operation.getFileId(), error.getKind());
                results.add(new BulkRenameResult.Item(operation.getFileId(), false, null, error));
            }
        }
        return new BulkRenameResult(results);
    }

    // 중단되면 false
    boolean pause() {
        if (bulkDelayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(bulkDelayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("일괄 이름 변경 중단: {}", e.getMessage());
            return false;
        }
    }

    private DriveItem patch(RemoteDriveClient client, String fileId, ItemPatch patch) {
        try {
            return client.patchItem(fileId, patch);
        } catch (RemoteDriveException e) {
            throw new DriveSyncException(errorClassifier.classify(e), e);
        }
    }
}
