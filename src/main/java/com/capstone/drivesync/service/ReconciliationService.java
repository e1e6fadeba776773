package com.capstone.drivesync.service;

import com.capstone.drivesync.domain.DomainError;
import com.capstone.drivesync.domain.ReconcileStatus;
import com.capstone.drivesync.dto.ProvisionResult;
import com.capstone.drivesync.dto.ReconcileOutcome;
import com.capstone.drivesync.dto.ReconcileReport;
import com.capstone.drivesync.entity.Project;
import com.capstone.drivesync.remote.DriveItem;
import com.capstone.drivesync.remote.RemoteDriveClient;
import com.capstone.drivesync.remote.RemoteDriveClientFactory;
import com.capstone.drivesync.remote.RemoteErrorClassifier;
import com.capstone.drivesync.repository.ProjectRepository;
import com.capstone.drivesync.util.DrivePaths;
import com.capstone.drivesync.util.FolderNameComposer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 폴더 매핑이 없는 프로젝트를 하나씩 처리한다.
 * 원격에 폴더가 있으면 연결하고 없으면 템플릿으로 새로 만든다.
 * 한 프로젝트의 실패는 결과에 기록하고 다음 프로젝트로 넘어간다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReconciliationService {

    private final ProjectRepository projectRepository;
    private final ProjectFolderMappingService mappingService;
    private final RootFolderService rootFolderService;
    private final TemplateProvisioningService provisioningService;
    private final FolderPathResolver folderPathResolver;
    private final RemoteDriveClientFactory clientFactory;
    private final RemoteErrorClassifier errorClassifier;

    public ReconcileReport reconcileOrphans() {
        return reconcile(projectRepository.findAll());
    }

    public ReconcileReport reconcile(List<Project> allProjects) {
        List<Project> orphans = mappingService.findOrphanProjects(allProjects);
        List<ReconcileOutcome> results = new ArrayList<>();
        if (orphans.isEmpty()) {
            return new ReconcileReport(results);
        }

        String root = rootFolderService.resolveRootPath();
        log.info("매핑 없는 프로젝트 {}건 정리 시작 (root={})", orphans.size(), root);
        for (Project project : orphans) {
            results.add(reconcileOne(root, project));
        }
        return new ReconcileReport(results);
    }

    private ReconcileOutcome reconcileOne(String root, Project project) {
        String code = project.getCode();
        try {
            Optional<DriveItem> existing = findExistingFolder(root, project);
            if (existing.isPresent()) {
                DriveItem folder = existing.get();
                String path = DrivePaths.join(root, folder.name());
                mappingService.create(code, folder.id(), path, folder.name());
                return new ReconcileOutcome(code, ReconcileStatus.MAPPED_EXISTING,
                        "기존 폴더에 연결했습니다: " + path, folder.id());
            }

            ProvisionResult provisioned = provisioningService.provision(root, code, project.getTemplate(),
                    project.getDescription());
            mappingService.create(code, provisioned.getFolder().getId(), provisioned.getFolder().getPath(),
                    provisioned.getFolder().getName());
            String message = "템플릿 " + project.getTemplate() + "으로 폴더를 만들었습니다: " + provisioned.getFolder().getPath();
            if (provisioned.getWarning() != null) {
                message += " (" + provisioned.getWarning().getDetail() + ")";
            }
            return new ReconcileOutcome(code, ReconcileStatus.CREATED_NEW, message, provisioned.getFolder().getId());
        } catch (RuntimeException e) {
            DomainError error = errorClassifier.classify(e);
            log.warn("프로젝트 {} 정리 실패: {}", code, error.describe());
            return new ReconcileOutcome(code, ReconcileStatus.ERROR, error.describe(), null);
        }
    }

    // root/CODE 와 root/CODE_DESCRIPTION 두 이름으로 찾는다
    private Optional<DriveItem> findExistingFolder(String root, Project project) {
        Set<String> candidates = new LinkedHashSet<>();
        candidates.add(FolderNameComposer.sanitizeProjectCode(project.getCode()));
        candidates.add(FolderNameComposer.compose(project.getCode(), project.getDescription()));

        RemoteDriveClient client = clientFactory.open();
        for (String name : candidates) {
            if (name.isEmpty()) {
                continue;
            }
            Optional<DriveItem> found = folderPathResolver.find(client, DrivePaths.join(root, name));
            if (found.isPresent() && found.get().isDirectory()) {
                return found;
            }
        }
        return Optional.empty();
    }
}
