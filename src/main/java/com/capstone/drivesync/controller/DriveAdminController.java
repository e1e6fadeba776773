package com.capstone.drivesync.controller;

import com.capstone.drivesync.dto.ReconcileReport;
import com.capstone.drivesync.dto.RootFolderConfiguration;
import com.capstone.drivesync.service.ReconciliationService;
import com.capstone.drivesync.service.RootFolderService;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.Setter;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/drive")
@RequiredArgsConstructor
public class DriveAdminController {

    private final ReconciliationService reconciliationService;
    private final RootFolderService rootFolderService;

    @PostMapping("/reconcile") // 매핑 없는 프로젝트 정리
    public ResponseEntity<ReconcileReport> reconcile() {
        return ResponseEntity.ok(reconciliationService.reconcileOrphans());
    }

    @GetMapping("/root-folder")
    public ResponseEntity<RootFolderConfiguration> getRootFolder() {
        // 설정이 없으면 기존 루트 경로만 채워서 돌려준다
        RootFolderConfiguration configuration = rootFolderService.getRootFolder()
                .orElseGet(() -> {
                    RootFolderConfiguration legacy = new RootFolderConfiguration();
                    legacy.setFolderPath(rootFolderService.resolveRootPath());
                    return legacy;
                });
        return ResponseEntity.ok(configuration);
    }

    @PutMapping("/root-folder")
    public ResponseEntity<RootFolderConfiguration> setRootFolder(@RequestBody RootFolderRequest request) {
        return ResponseEntity.ok(rootFolderService.setRootFolder(request.getFolderPath(), request.getFolderId()));
    }

    @Setter
    @Getter
    public static class RootFolderRequest {
        private String folderPath;
        private String folderId;
    }
}
