package com.capstone.drivesync.controller;

import com.capstone.drivesync.dto.FolderMappingResponse;
import com.capstone.drivesync.dto.ProjectProvisionRequest;
import com.capstone.drivesync.dto.ProjectProvisionResponse;
import com.capstone.drivesync.dto.ScanOptions;
import com.capstone.drivesync.dto.ScanReport;
import com.capstone.drivesync.service.ProjectFolderMappingService;
import com.capstone.drivesync.service.ProjectFolderService;
import com.capstone.drivesync.service.RemoteFolderScanService;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.Setter;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/drive")
@RequiredArgsConstructor
public class ProjectFolderController {

    private final ProjectFolderService projectFolderService;
    private final ProjectFolderMappingService mappingService;
    private final RemoteFolderScanService scanService;

    @PostMapping("/projects") // 프로젝트 폴더 생성 (템플릿)
    public ResponseEntity<ProjectProvisionResponse> provisionProject(@RequestBody ProjectProvisionRequest request) {
        ProjectProvisionResponse response = projectFolderService.provisionProject(
                request.getProjectCode(), request.getTemplate(), request.getDescription());
        return ResponseEntity.status(201).body(response);
    }

    @PostMapping("/projects/{code}/link") // 기존 원격 폴더에 연결
    public ResponseEntity<FolderMappingResponse> linkProject(@PathVariable String code, @RequestBody LinkRequest request) {
        FolderMappingResponse mapping = new FolderMappingResponse(
                mappingService.linkProjectToFolder(code, request.getFolderIdOrPath()));
        return ResponseEntity.status(201).body(mapping);
    }

    @PostMapping("/projects/{code}/scan") // 프로젝트 폴더 스캔 후 색인
    public ResponseEntity<ScanReport> scanProject(@PathVariable String code,
                                                  @RequestBody(required = false) ScanOptions options) {
        return ResponseEntity.ok(scanService.scanProject(code, options));
    }

    @PostMapping("/scan") // 임의 경로 스캔 후 색인
    public ResponseEntity<ScanReport> scanFolder(@RequestBody ScanRequest request) {
        ScanOptions options = new ScanOptions(request.isIncludeSubfolders(),
                request.isIncludeSubfolders() ? 5 : 1, false);
        return ResponseEntity.ok(scanService.scanAndIndex(request.getFolderPath(), request.getProjectCode(), options));
    }

    @Setter
    @Getter
    public static class LinkRequest {
        private String folderIdOrPath;
    }

    @Setter
    @Getter
    public static class ScanRequest {
        private String folderPath;
        private String projectCode;
        private boolean includeSubfolders = true;
    }
}
