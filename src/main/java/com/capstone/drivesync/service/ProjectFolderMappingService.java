package com.capstone.drivesync.service;

import com.capstone.drivesync.domain.ErrorKind;
import com.capstone.drivesync.domain.MappingHealth;
import com.capstone.drivesync.dto.FolderMappingResponse;
import com.capstone.drivesync.dto.MappingVerification;
import com.capstone.drivesync.entity.Project;
import com.capstone.drivesync.entity.ProjectFolderMapping;
import com.capstone.drivesync.exception.DriveSyncException;
import com.capstone.drivesync.exception.ResourceNotFoundException;
import com.capstone.drivesync.remote.DriveItem;
import com.capstone.drivesync.remote.RemoteDriveClient;
import com.capstone.drivesync.remote.RemoteDriveClientFactory;
import com.capstone.drivesync.repository.ProjectFolderMappingRepository;
import com.capstone.drivesync.repository.ProjectRepository;
import com.capstone.drivesync.util.DrivePaths;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 프로젝트 코드와 원격 폴더의 연결 정보 관리.
 * 생성은 멱등이 아니며 중복이면 DUPLICATE_MAPPING 으로 실패한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProjectFolderMappingService {

    private final ProjectFolderMappingRepository mappingRepository;
    private final ProjectRepository projectRepository;
    private final RemoteDriveClientFactory clientFactory;
    private final FolderPathResolver folderPathResolver;

    public Optional<ProjectFolderMapping> get(String projectCode) {
        return mappingRepository.findByProjectCode(projectCode);
    }

    public ProjectFolderMapping getOrThrow(String projectCode) {
        return get(projectCode)
                .orElseThrow(() -> new ResourceNotFoundException("프로젝트 폴더 매핑이 없습니다: " + projectCode));
    }

    public List<ProjectFolderMapping> getAll() {
        return mappingRepository.findAll();
    }

    // 매핑 생성
    @Transactional
    public ProjectFolderMapping create(String projectCode, String remoteFolderId, String remoteFolderPath,
                                       String remoteFolderName) {
        if (!StringUtils.hasText(projectCode)) {
            throw DriveSyncException.of(ErrorKind.MISSING_PARAMETER, "프로젝트 코드가 필요합니다.");
        }
        if (mappingRepository.existsByProjectCode(projectCode)) {
            throw DriveSyncException.of(ErrorKind.DUPLICATE_MAPPING, "이미 매핑된 프로젝트입니다: " + projectCode);
        }
        // 빈 문자열 ID는 "아직 모름"으로 저장
        String folderId = StringUtils.hasText(remoteFolderId) ? remoteFolderId : null;
        if (folderId != null && mappingRepository.existsByRemoteFolderId(folderId)) {
            throw DriveSyncException.of(ErrorKind.DUPLICATE_MAPPING, "다른 프로젝트에 이미 연결된 폴더입니다: " + folderId);
        }

        ProjectFolderMapping mapping = ProjectFolderMapping.builder()
                .projectCode(projectCode)
                .remoteFolderId(folderId)
                .remoteFolderPath(remoteFolderPath)
                .remoteFolderName(remoteFolderName)
                .build();
        ProjectFolderMapping saved = mappingRepository.save(mapping);
        log.info("프로젝트 폴더 매핑 생성: {} -> {}", projectCode, remoteFolderPath);
        return saved;
    }

    // 매핑 삭제, 없으면 false
    @Transactional
    public boolean delete(String projectCode) {
        Optional<ProjectFolderMapping> mapping = mappingRepository.findByProjectCode(projectCode);
        if (mapping.isEmpty()) {
            return false;
        }
        mappingRepository.delete(mapping.get());
        log.info("프로젝트 폴더 매핑 삭제: {}", projectCode);
        return true;
    }

    public List<Project> findOrphanProjects(Collection<Project> allProjects) {
        Set<String> mappedCodes = mappingRepository.findAll().stream()
                .map(ProjectFolderMapping::getProjectCode)
                .collect(Collectors.toSet());
        return allProjects.stream()
                .filter(project -> !mappedCodes.contains(project.getCode()))
                .toList();
    }

    public List<Project> findOrphanProjects() {
        return findOrphanProjects(projectRepository.findAll());
    }

    /**
     * 이미 있는 원격 폴더를 프로젝트에 연결한다. 폴더가 실제로 있는지 먼저 확인한다.
     */
    @Transactional
    public ProjectFolderMapping linkProjectToFolder(String projectCode, String folderIdOrPath) {
        if (!StringUtils.hasText(folderIdOrPath)) {
            throw DriveSyncException.of(ErrorKind.MISSING_PARAMETER, "연결할 폴더 ID 또는 경로가 필요합니다.");
        }
        String target = DrivePaths.isPath(folderIdOrPath) ? DrivePaths.normalize(folderIdOrPath) : folderIdOrPath;
        RemoteDriveClient client = clientFactory.open();
        DriveItem folder = folderPathResolver.find(client, target)
                .orElseThrow(() -> DriveSyncException.of(ErrorKind.NOT_FOUND, "원격 폴더를 찾을 수 없습니다: " + folderIdOrPath));
        if (!folder.isDirectory()) {
            throw DriveSyncException.of(ErrorKind.INVALID_NAME, "폴더가 아닌 항목입니다: " + folderIdOrPath);
        }
        String path = DrivePaths.isPath(target) ? target : DrivePaths.join(folder.parentPath(), folder.name());
        return create(projectCode, folder.id(), path, folder.name());
    }

    /**
     * 저장된 매핑과 원격 상태를 비교한다.
     * 폴더가 옮겨졌으면 경로를 갱신하고, 삭제되었으면 LOST 를 돌려준다.
     */
    @Transactional
    public MappingVerification verifyMapping(String projectCode) {
        ProjectFolderMapping mapping = getOrThrow(projectCode);
        RemoteDriveClient client = clientFactory.open();

        if (!StringUtils.hasText(mapping.getRemoteFolderId())) {
            Optional<DriveItem> byPath = StringUtils.hasText(mapping.getRemoteFolderPath())
                    ? folderPathResolver.find(client, mapping.getRemoteFolderPath())
                    : Optional.empty();
            if (byPath.isEmpty()) {
                return new MappingVerification(projectCode, MappingHealth.LOST, new FolderMappingResponse(mapping));
            }
            mapping.setRemoteFolderId(byPath.get().id());
            mapping.setRemoteFolderName(byPath.get().name());
            return new MappingVerification(projectCode, MappingHealth.RESOLVED,
                    new FolderMappingResponse(mappingRepository.save(mapping)));
        }

        Optional<DriveItem> remote = folderPathResolver.find(client, mapping.getRemoteFolderId());
        if (remote.isEmpty()) {
            log.warn("매핑된 원격 폴더가 사라짐: {} ({})", projectCode, mapping.getRemoteFolderId());
            return new MappingVerification(projectCode, MappingHealth.LOST, new FolderMappingResponse(mapping));
        }

        DriveItem folder = remote.get();
        String actualPath = folder.parentPath() != null
                ? DrivePaths.join(folder.parentPath(), folder.name())
                : mapping.getRemoteFolderPath();
        if (Objects.equals(actualPath, mapping.getRemoteFolderPath())
                && Objects.equals(folder.name(), mapping.getRemoteFolderName())) {
            return new MappingVerification(projectCode, MappingHealth.OK, new FolderMappingResponse(mapping));
        }

        log.info("원격 폴더 경로 변경 감지: {} {} -> {}", projectCode, mapping.getRemoteFolderPath(), actualPath);
        mapping.setRemoteFolderPath(actualPath);
        mapping.setRemoteFolderName(folder.name());
        return new MappingVerification(projectCode, MappingHealth.DRIFTED,
                new FolderMappingResponse(mappingRepository.save(mapping)));
    }
}
