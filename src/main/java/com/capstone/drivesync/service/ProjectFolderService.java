package com.capstone.drivesync.service;

import com.capstone.drivesync.domain.ErrorKind;
import com.capstone.drivesync.dto.FolderMappingResponse;
import com.capstone.drivesync.dto.ProjectProvisionResponse;
import com.capstone.drivesync.dto.ProvisionResult;
import com.capstone.drivesync.entity.ProjectFolderMapping;
import com.capstone.drivesync.exception.DriveSyncException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * 새 프로젝트의 원격 폴더 생성: 루트 확인, 템플릿 생성, 매핑 저장.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProjectFolderService {

    private final RootFolderService rootFolderService;
    private final TemplateProvisioningService provisioningService;
    private final ProjectFolderMappingService mappingService;

    public ProjectProvisionResponse provisionProject(String projectCode, String template, String description) {
        if (!StringUtils.hasText(projectCode) || !StringUtils.hasText(template)) {
            throw DriveSyncException.of(ErrorKind.MISSING_PARAMETER, "프로젝트 코드와 템플릿이 필요합니다.");
        }
        if (mappingService.get(projectCode).isPresent()) {
            throw DriveSyncException.of(ErrorKind.DUPLICATE_MAPPING, "이미 폴더가 연결된 프로젝트입니다: " + projectCode);
        }

        String root = rootFolderService.resolveRootPath();
        rootFolderService.ensureRootFolder();

        ProvisionResult result = provisioningService.provision(root, projectCode, template, description);
        ProjectFolderMapping mapping = mappingService.create(projectCode, result.getFolder().getId(),
                result.getFolder().getPath(), result.getFolder().getName());

        if (result.getWarning() != null) {
            log.warn("프로젝트 {} 폴더 일부 누락: {}", projectCode, result.getWarning().getDetail());
        }
        return new ProjectProvisionResponse(result, new FolderMappingResponse(mapping));
    }
}
