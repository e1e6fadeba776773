package com.capstone.drivesync.service;

import com.capstone.drivesync.domain.ErrorKind;
import com.capstone.drivesync.dto.FileIndexResponse;
import com.capstone.drivesync.dto.MoveResult;
import com.capstone.drivesync.entity.RemoteFileRecord;
import com.capstone.drivesync.exception.DriveSyncException;
import com.capstone.drivesync.exception.ResourceNotFoundException;
import com.capstone.drivesync.remote.DriveItem;
import com.capstone.drivesync.remote.RemoteDriveClient;
import com.capstone.drivesync.remote.RemoteDriveClientFactory;
import com.capstone.drivesync.repository.RemoteFileRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

/**
 * 원격 파일의 로컬 색인. driveItemId 기준으로 생성 또는 갱신한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FileIndexService {

    public static final int DEFAULT_LIMIT = 100;
    public static final String DEFAULT_MIME_TYPE = "application/octet-stream";

    private final RemoteFileRecordRepository fileRecordRepository;
    private final RemoteDriveClientFactory clientFactory;
    private final FolderPathResolver folderPathResolver;

    @Transactional
    public RemoteFileRecord createOrUpdate(RemoteFileRecord incoming) {
        RemoteFileRecord record = fileRecordRepository.findByDriveItemId(incoming.getDriveItemId())
                .orElseGet(RemoteFileRecord::new);
        record.setDriveItemId(incoming.getDriveItemId());
        record.setName(incoming.getName());
        record.setPath(incoming.getPath());
        record.setSize(Math.max(0, incoming.getSize()));
        record.setMimeType(incoming.isFolder() || incoming.getMimeType() != null
                ? incoming.getMimeType() : DEFAULT_MIME_TYPE);
        record.setLastModified(incoming.getLastModified());
        record.setProjectCode(incoming.getProjectCode());
        record.setParentFolderId(incoming.getParentFolderId());
        record.setFolder(incoming.isFolder());
        record.setWebUrl(incoming.getWebUrl());
        record.setDownloadUrl(incoming.getDownloadUrl());
        return fileRecordRepository.save(record);
    }

    // 프로젝트 코드, 경로 일부로 조회
    public List<FileIndexResponse> search(String projectCode, String pathContains, Integer limit) {
        Pageable page = PageRequest.of(0, limit == null || limit <= 0 ? DEFAULT_LIMIT : limit,
                Sort.by(Sort.Direction.DESC, "updatedAt"));
        boolean byCode = StringUtils.hasText(projectCode);
        boolean byPath = StringUtils.hasText(pathContains);

        List<RemoteFileRecord> records;
        if (byCode && byPath) {
            records = fileRecordRepository.findByProjectCodeAndPathContaining(projectCode, pathContains, page);
        } else if (byCode) {
            records = fileRecordRepository.findByProjectCode(projectCode, page);
        } else if (byPath) {
            records = fileRecordRepository.findByPathContaining(pathContains, page);
        } else {
            records = fileRecordRepository.findAll(page).getContent();
        }
        return records.stream().map(FileIndexResponse::new).toList();
    }

    // 원격 이동/이름 변경 후 색인도 같이 갱신. 색인에 없는 파일이면 무시
    @Transactional
    public Optional<RemoteFileRecord> applyMove(MoveResult result) {
        Optional<RemoteFileRecord> record = fileRecordRepository.findByDriveItemId(result.getFileId());
        record.ifPresent(r -> {
            r.setName(result.getName());
            r.setPath(result.getPath());
            r.setParentFolderId(result.getParentFolderId());
            fileRecordRepository.save(r);
        });
        return record;
    }

    @Transactional
    public boolean delete(String driveItemId) {
        Optional<RemoteFileRecord> record = fileRecordRepository.findByDriveItemId(driveItemId);
        record.ifPresent(fileRecordRepository::delete);
        return record.isPresent();
    }

    /**
     * 다운로드 URL은 금방 만료되므로 원격에서 다시 받아 온다.
     */
    @Transactional
    public FileIndexResponse refreshLinks(String driveItemId) {
        RemoteFileRecord record = fileRecordRepository.findByDriveItemId(driveItemId)
                .orElseThrow(() -> new ResourceNotFoundException("색인에 없는 파일입니다: " + driveItemId));
        RemoteDriveClient client = clientFactory.open();
        DriveItem item = folderPathResolver.find(client, driveItemId)
                .orElseThrow(() -> DriveSyncException.of(ErrorKind.NOT_FOUND, "원격 파일을 찾을 수 없습니다: " + driveItemId));
        record.setWebUrl(item.webUrl());
        record.setDownloadUrl(item.downloadUrl());
        if (item.size() != null) {
            record.setSize(item.size());
        }
        if (item.lastModifiedDateTime() != null) {
            record.setLastModified(toLocal(item));
        }
        return new FileIndexResponse(fileRecordRepository.save(record));
    }

    static LocalDateTime toLocal(DriveItem item) {
        return item.lastModifiedDateTime() == null ? null
                : item.lastModifiedDateTime().atZoneSameInstant(ZoneId.systemDefault()).toLocalDateTime();
    }
}
