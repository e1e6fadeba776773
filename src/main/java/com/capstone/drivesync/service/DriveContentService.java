package com.capstone.drivesync.service;

import com.capstone.drivesync.domain.ErrorKind;
import com.capstone.drivesync.dto.FileIndexResponse;
import com.capstone.drivesync.entity.RemoteFileRecord;
import com.capstone.drivesync.exception.DriveSyncException;
import com.capstone.drivesync.exception.RemoteDriveException;
import com.capstone.drivesync.remote.DriveItem;
import com.capstone.drivesync.remote.RemoteDriveClient;
import com.capstone.drivesync.remote.RemoteDriveClientFactory;
import com.capstone.drivesync.remote.RemoteErrorClassifier;
import com.capstone.drivesync.util.DriveNameValidator;
import com.capstone.drivesync.util.DrivePaths;
import com.capstone.drivesync.util.FolderNameComposer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * 파일 내용 다운로드, 업로드, 검색.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DriveContentService {

    public static final int MAX_QUERY_LENGTH = 255;

    private final RemoteDriveClientFactory clientFactory;
    private final RemoteErrorClassifier errorClassifier;
    private final FolderPathResolver folderPathResolver;
    private final DriveNameValidator nameValidator;
    private final FileIndexService fileIndexService;

    public byte[] download(String fileId) {
        if (!StringUtils.hasText(fileId)) {
            throw DriveSyncException.of(ErrorKind.MISSING_PARAMETER, "파일 ID가 필요합니다.");
        }
        try {
            return clientFactory.open().getContent(fileId);
        } catch (RemoteDriveException e) {
            throw new DriveSyncException(errorClassifier.classify(e), e);
        }
    }

    public List<DriveItem> search(String query) {
        if (!StringUtils.hasText(query)) {
            throw DriveSyncException.of(ErrorKind.MISSING_PARAMETER, "검색어가 필요합니다.");
        }
        if (query.length() > MAX_QUERY_LENGTH) {
            throw new IllegalArgumentException("검색어는 " + MAX_QUERY_LENGTH + "자 이하여야 합니다.");
        }
        try {
            return clientFactory.open().search(query.trim());
        } catch (RemoteDriveException e) {
            throw new DriveSyncException(errorClassifier.classify(e), e);
        }
    }

    /**
     * 프로젝트 폴더 아래에 파일을 올린다. 파일명 앞에 "CODE_"를 붙이고 색인에도 저장한다.
     */
    public FileIndexResponse upload(String projectCode, String targetPath, String fileName, byte[] content) {
        if (!StringUtils.hasText(targetPath) || !StringUtils.hasText(fileName) || content == null) {
            throw DriveSyncException.of(ErrorKind.MISSING_PARAMETER, "업로드 경로, 파일명, 내용이 필요합니다.");
        }
        String folderPath = DrivePaths.normalize(targetPath);
        nameValidator.requireValidPath(folderPath);
        String finalName = prefixedFileName(projectCode, fileName);
        nameValidator.requireValidName(finalName);

        RemoteDriveClient client = clientFactory.open();
        DriveItem folder = folderPathResolver.resolveOrCreate(client, folderPath);
        String filePath = DrivePaths.join(folderPath, finalName);
        DriveItem uploaded;
        try {
            uploaded = client.putContent(filePath, content);
        } catch (RemoteDriveException e) {
            throw new DriveSyncException(errorClassifier.classify(e), e);
        }
        log.info("파일 업로드: {} ({} bytes)", filePath, content.length);

        RemoteFileRecord record = RemoteFileRecord.builder()
                .driveItemId(uploaded.id())
                .name(uploaded.name())
                .path(filePath)
                .size(uploaded.size() != null ? uploaded.size() : content.length)
                .mimeType(uploaded.mimeType())
                .lastModified(FileIndexService.toLocal(uploaded))
                .projectCode(StringUtils.hasText(projectCode) ? projectCode : null)
                .parentFolderId(folder.id())
                .webUrl(uploaded.webUrl())
                .downloadUrl(uploaded.downloadUrl())
                .build();
        return new FileIndexResponse(fileIndexService.createOrUpdate(record));
    }

    // 파일명 정리: 금지 문자는 "_"로, 이미 코드로 시작하면 그대로
    static String prefixedFileName(String projectCode, String fileName) {
        String cleaned = fileName.trim().replaceAll("[\\\\/:*?\"<>|]", "_");
        String code = FolderNameComposer.sanitizeProjectCode(projectCode);
        if (code.isEmpty() || cleaned.startsWith(code + "_")) {
            return cleaned;
        }
        return code + "_" + cleaned;
    }
}
