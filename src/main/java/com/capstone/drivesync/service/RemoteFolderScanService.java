package com.capstone.drivesync.service;

import com.capstone.drivesync.domain.DomainError;
import com.capstone.drivesync.domain.FailureRecord;
import com.capstone.drivesync.domain.PartialResult;
import com.capstone.drivesync.dto.FileIndexResponse;
import com.capstone.drivesync.dto.ScanOptions;
import com.capstone.drivesync.dto.ScanReport;
import com.capstone.drivesync.entity.ProjectFolderMapping;
import com.capstone.drivesync.entity.RemoteFileRecord;
import com.capstone.drivesync.exception.DriveSyncException;
import com.capstone.drivesync.remote.DriveItem;
import com.capstone.drivesync.remote.RemoteDriveClient;
import com.capstone.drivesync.remote.RemoteDriveClientFactory;
import com.capstone.drivesync.remote.RemoteErrorClassifier;
import com.capstone.drivesync.util.DriveNameValidator;
import com.capstone.drivesync.util.DrivePaths;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 원격 폴더 트리를 너비 우선으로 훑어 파일 목록을 만든다.
 * 하위 폴더 접근 실패는 기록만 하고 계속 진행한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RemoteFolderScanService {

    public static final int DEFAULT_MAX_DEPTH = 3;
    public static final int MAX_DEPTH_LIMIT = 10;

    private final RemoteDriveClientFactory clientFactory;
    private final RemoteErrorClassifier errorClassifier;
    private final DriveNameValidator nameValidator;
    private final ProjectFolderMappingService mappingService;
    private final FileIndexService fileIndexService;

    public PartialResult<RemoteFileRecord> scan(String rootPath, ScanOptions options) {
        return scan(rootPath, options, null);
    }

    public PartialResult<RemoteFileRecord> scan(String rootPath, ScanOptions options, String projectCode) {
        ScanOptions opts = options != null ? options : ScanOptions.defaults();
        String root = DrivePaths.normalize(rootPath);
        nameValidator.requireValidPath(root);
        int depthLimit = clampDepth(opts.getMaxDepth());

        PartialResult<RemoteFileRecord> result = new PartialResult<>();
        RemoteDriveClient client;
        try {
            client = clientFactory.open();
        } catch (RuntimeException e) {
            result.addFailure(new FailureRecord(root, errorClassifier.classify(e)));
            return result;
        }

        // 루트의 깊이는 0, depth < depthLimit 인 폴더만 내려간다
        Deque<PendingFolder> queue = new ArrayDeque<>();
        queue.add(new PendingFolder(root, 0));
        while (!queue.isEmpty()) {
            PendingFolder current = queue.poll();
            List<DriveItem> children;
            try {
                children = client.listChildren(current.path());
            } catch (RuntimeException e) {
                DomainError error = errorClassifier.classify(e);
                log.warn("폴더 스캔 실패, 건너뜀: {} ({})", current.path(), error.getKind());
                result.addFailure(new FailureRecord(current.path(), error));
                continue;
            }

            for (DriveItem item : children) {
                String itemPath = DrivePaths.join(current.path(), item.name());
                if (item.isDirectory()) {
                    if (opts.isIncludeFolders()) {
                        result.addSuccess(toRecord(item, itemPath, projectCode));
                    }
                    if (opts.isIncludeSubfolders() && current.depth() < depthLimit) {
                        queue.add(new PendingFolder(itemPath, current.depth() + 1));
                    }
                } else {
                    result.addSuccess(toRecord(item, itemPath, projectCode));
                }
            }
        }

        log.debug("스캔 완료: {} (항목 {}, 실패 {})", root, result.getSucceeded().size(), result.getFailed().size());
        return result;
    }

    // 매핑된 프로젝트 폴더를 스캔하고 색인에 저장
    public ScanReport scanProject(String projectCode, ScanOptions options) {
        ProjectFolderMapping mapping = mappingService.getOrThrow(projectCode);
        return scanAndIndex(currentFolderPath(mapping), projectCode, options);
    }

    // 폴더 ID가 있으면 ID로 현재 위치를 다시 찾는다. 저장된 경로는 오래됐을 수 있다
    private String currentFolderPath(ProjectFolderMapping mapping) {
        if (!StringUtils.hasText(mapping.getRemoteFolderId())) {
            return mapping.getRemoteFolderPath();
        }
        DriveItem folder;
        try {
            folder = clientFactory.open().getItem(mapping.getRemoteFolderId());
        } catch (RuntimeException e) {
            throw new DriveSyncException(errorClassifier.classify(e), e);
        }
        String actualPath = folder.parentPath() != null
                ? DrivePaths.join(folder.parentPath(), folder.name()) : DrivePaths.ROOT;
        if (!actualPath.equals(mapping.getRemoteFolderPath())) {
            log.info("매핑 경로 변경 감지, 갱신 후 스캔: {} {} -> {}", mapping.getProjectCode(),
                    mapping.getRemoteFolderPath(), actualPath);
            mappingService.verifyMapping(mapping.getProjectCode());
        }
        return actualPath;
    }

    public ScanReport scanAndIndex(String folderPath, String projectCode, ScanOptions options) {
        PartialResult<RemoteFileRecord> scanned = scan(folderPath, options, projectCode);

        List<FileIndexResponse> indexed = new ArrayList<>();
        for (RemoteFileRecord record : scanned.getSucceeded()) {
            try {
                indexed.add(new FileIndexResponse(fileIndexService.createOrUpdate(record)));
            } catch (RuntimeException e) {
                log.warn("파일 색인 저장 실패: {} ({})", record.getPath(), e.getMessage());
            }
        }
        return new ScanReport(folderPath, projectCode, scanned.getSucceeded().size(), indexed.size(),
                indexed, scanned.getFailed());
    }

    static int clampDepth(int requested) {
        int depth = requested > 0 ? requested : DEFAULT_MAX_DEPTH;
        return Math.min(depth, MAX_DEPTH_LIMIT);
    }

    private RemoteFileRecord toRecord(DriveItem item, String path, String projectCode) {
        return RemoteFileRecord.builder()
                .driveItemId(item.id())
                .name(item.name())
                .path(path)
                .size(item.size() != null ? item.size() : 0L)
                .mimeType(item.mimeType())
                .lastModified(FileIndexService.toLocal(item))
                .projectCode(projectCode)
                .parentFolderId(item.parentId())
                .folder(item.isDirectory())
                .webUrl(item.webUrl())
                .downloadUrl(item.downloadUrl())
                .build();
    }

    private record PendingFolder(String path, int depth) {
    }
}
