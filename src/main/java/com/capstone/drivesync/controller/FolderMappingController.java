package com.capstone.drivesync.controller;

import com.capstone.drivesync.dto.FolderMappingRequest;
import com.capstone.drivesync.dto.FolderMappingResponse;
import com.capstone.drivesync.dto.MappingVerification;
import com.capstone.drivesync.entity.Project;
import com.capstone.drivesync.exception.ResourceNotFoundException;
import com.capstone.drivesync.service.ProjectFolderMappingService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/drive/mappings")
@RequiredArgsConstructor
public class FolderMappingController {

    private final ProjectFolderMappingService mappingService;

    @GetMapping // 전체 매핑 조회
    public ResponseEntity<List<FolderMappingResponse>> getAll() {
        return ResponseEntity.ok(mappingService.getAll().stream().map(FolderMappingResponse::new).toList());
    }

    @GetMapping("/orphans") // 매핑 없는 프로젝트 코드
    public ResponseEntity<List<String>> getOrphans() {
        return ResponseEntity.ok(mappingService.findOrphanProjects().stream().map(Project::getCode).toList());
    }

    @GetMapping("/{code}")
    public ResponseEntity<FolderMappingResponse> get(@PathVariable String code) {
        return ResponseEntity.ok(new FolderMappingResponse(mappingService.getOrThrow(code)));
    }

    @PostMapping // 매핑 직접 추가
    public ResponseEntity<FolderMappingResponse> create(@RequestBody FolderMappingRequest request) {
        FolderMappingResponse saved = new FolderMappingResponse(mappingService.create(request.getProjectCode(),
                request.getRemoteFolderId(), request.getRemoteFolderPath(), request.getRemoteFolderName()));
        return ResponseEntity.status(201).body(saved);
    }

    @DeleteMapping("/{code}")
    public ResponseEntity<String> delete(@PathVariable String code) {
        if (!mappingService.delete(code)) {
            throw new ResourceNotFoundException("프로젝트 폴더 매핑이 없습니다: " + code);
        }
        return ResponseEntity.ok("매핑이 삭제되었습니다.");
    }

    @PostMapping("/{code}/verify") // 원격 폴더 이동/삭제 확인
    public ResponseEntity<MappingVerification> verify(@PathVariable String code) {
        return ResponseEntity.ok(mappingService.verifyMapping(code));
    }
}
