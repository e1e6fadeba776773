package com.capstone.drivesync.service;

import com.capstone.drivesync.domain.DomainError;
import com.capstone.drivesync.domain.ErrorKind;
import com.capstone.drivesync.domain.FailureRecord;
import com.capstone.drivesync.domain.PartialResult;
import com.capstone.drivesync.domain.ProjectTemplate;
import com.capstone.drivesync.dto.ProvisionResult;
import com.capstone.drivesync.dto.ProvisionedFolder;
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

import java.util.stream.Collectors;

/**
 * 템플릿대로 프로젝트 폴더와 하위 폴더를 만든다.
 * 프로젝트 폴더 생성 실패는 치명적이고, 하위 폴더 실패는 모아서 경고로 돌려준다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TemplateProvisioningService {

    private final RemoteDriveClientFactory clientFactory;
    private final RemoteErrorClassifier errorClassifier;
    private final FolderPathResolver folderPathResolver;
    private final DriveNameValidator nameValidator;

    public ProvisionResult provision(String rootPath, String projectCode, String templateId, String description) {
        // 네트워크 호출 전 로컬 검사
        ProjectTemplate template = ProjectTemplate.resolve(templateId)
                .orElseThrow(() -> DriveSyncException.of(ErrorKind.MISSING_PARAMETER, "알 수 없는 템플릿입니다: " + templateId));
        String root = DrivePaths.normalize(rootPath);
        nameValidator.requireValidPath(root);

        String code = FolderNameComposer.sanitizeProjectCode(projectCode);
        if (code.isEmpty()) {
            throw DriveSyncException.of(ErrorKind.INVALID_NAME, "프로젝트 코드가 올바르지 않습니다: " + projectCode);
        }
        String folderName = FolderNameComposer.compose(code, description);
        nameValidator.requireValidName(folderName);
        String projectPath = DrivePaths.join(root, folderName);

        RemoteDriveClient client = clientFactory.open();

        // 프로젝트 폴더는 엄격: 이미 있으면 충돌
        if (folderPathResolver.find(client, projectPath).isPresent()) {
            throw DriveSyncException.of(ErrorKind.NAME_CONFLICT, "이미 존재하는 프로젝트 폴더입니다: " + projectPath);
        }

        DriveItem created;
        try {
            created = client.createFolder(root, folderName);
        } catch (RemoteDriveException e) {
            DomainError error = errorClassifier.classify(e);
            log.error("프로젝트 폴더 생성 실패: {} ({})", projectPath, error.getKind());
            throw new DriveSyncException(error, e);
        }
        log.info("프로젝트 폴더 생성: {} (template={})", projectPath, template);

        PartialResult<String> subfolders = new PartialResult<>();
        for (String subfolder : template.getSubfolders()) {
            try {
                client.createFolder(created.id(), subfolder);
                subfolders.addSuccess(subfolder);
            } catch (RemoteDriveException e) {
                DomainError error = errorClassifier.classify(e);
                log.warn("하위 폴더 생성 실패: {}/{} ({})", projectPath, subfolder, error.getKind());
                subfolders.addFailure(new FailureRecord(subfolder, error));
            }
        }

        DomainError warning = null;
        if (subfolders.hasFailures()) {
            String failedNames = subfolders.getFailed().stream()
                    .map(FailureRecord::getTarget)
                    .collect(Collectors.joining(", "));
            warning = DomainError.of(ErrorKind.TEMPLATE_PARTIAL_FAILURE, "생성하지 못한 하위 폴더: " + failedNames);
        }

        return new ProvisionResult(new ProvisionedFolder(created.id(), created.name(), projectPath), subfolders, warning);
    }
}
