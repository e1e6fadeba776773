package com.capstone.drivesync.controller;

import com.capstone.drivesync.dto.BulkRenameResult;
import com.capstone.drivesync.dto.FileIndexResponse;
import com.capstone.drivesync.dto.MoveRequest;
import com.capstone.drivesync.dto.MoveResult;
import com.capstone.drivesync.dto.RenameOperation;
import com.capstone.drivesync.remote.DriveItem;
import com.capstone.drivesync.service.DriveContentService;
import com.capstone.drivesync.service.FileIndexService;
import com.capstone.drivesync.service.FileMoveService;
import com.capstone.drivesync.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;

@RestController
@RequestMapping("/drive")
@RequiredArgsConstructor
public class DriveFileController {

    private final FileMoveService fileMoveService;
    private final FileIndexService fileIndexService;
    private final DriveContentService contentService;

    @PostMapping("/files/{fileId}/move") // 파일 이동 또는 이름 변경
    public ResponseEntity<MoveResult> moveFile(@PathVariable String fileId, @RequestBody MoveRequest request) {
        MoveResult result = fileMoveService.moveOrRename(fileId, request.getTargetFolderId(),
                request.getTargetPath(), request.getNewFileName());
        return ResponseEntity.ok(result);
    }

    @PostMapping("/files/bulk-rename")
    public ResponseEntity<BulkRenameResult> bulkRename(@RequestBody List<RenameOperation> operations) {
        return ResponseEntity.ok(fileMoveService.bulkRename(operations));
    }

    @GetMapping("/files/{fileId}/content")
    public ResponseEntity<byte[]> download(@PathVariable String fileId) {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_OCTET_STREAM_VALUE)
                .body(contentService.download(fileId));
    }

    @PostMapping("/files/upload")
    public ResponseEntity<FileIndexResponse> upload(@RequestParam("file") MultipartFile file,
                                                    @RequestParam("targetPath") String targetPath,
                                                    @RequestParam(value = "projectCode", required = false) String projectCode)
            throws IOException {
        FileIndexResponse uploaded = contentService.upload(projectCode, targetPath,
                file.getOriginalFilename(), file.getBytes());
        return ResponseEntity.status(201).body(uploaded);
    }

    @GetMapping("/files/search")
    public ResponseEntity<List<DriveItem>> search(@RequestParam("q") String query) {
        return ResponseEntity.ok(contentService.search(query));
    }

    @GetMapping("/files-index") // 로컬 파일 색인 조회
    public ResponseEntity<List<FileIndexResponse>> listIndex(
            @RequestParam(required = false) String projectCode,
            @RequestParam(required = false) String path,
            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(fileIndexService.search(projectCode, path, limit));
    }

    @DeleteMapping("/files-index/{driveItemId}")
    public ResponseEntity<String> deleteIndex(@PathVariable String driveItemId) {
        if (!fileIndexService.delete(driveItemId)) {
            throw new ResourceNotFoundException("색인에 없는 파일입니다: " + driveItemId);
        }
        return ResponseEntity.ok("색인에서 삭제되었습니다.");
    }

    @PostMapping("/files-index/{driveItemId}/refresh") // 다운로드 링크 갱신
    public ResponseEntity<FileIndexResponse> refreshLinks(@PathVariable String driveItemId) {
        return ResponseEntity.ok(fileIndexService.refreshLinks(driveItemId));
    }
}
