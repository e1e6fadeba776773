package com.capstone.drivesync.service;

import com.capstone.drivesync.domain.ErrorKind;
import com.capstone.drivesync.dto.RootFolderConfiguration;
import com.capstone.drivesync.entity.SystemConfig;
import com.capstone.drivesync.exception.DriveSyncException;
import com.capstone.drivesync.remote.DriveItem;
import com.capstone.drivesync.remote.RemoteDriveClient;
import com.capstone.drivesync.remote.RemoteDriveClientFactory;
import com.capstone.drivesync.repository.SystemConfigRepository;
import com.capstone.drivesync.util.DriveNameValidator;
import com.capstone.drivesync.util.DrivePaths;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 모든 프로젝트 폴더가 만들어지는 원격 루트 폴더 설정.
 * system_config 테이블에 JSON 하나로 저장한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RootFolderService {

    public static final String ROOT_FOLDER_KEY = "drive_root_folder";

    private final SystemConfigRepository systemConfigRepository;
    private final RemoteDriveClientFactory clientFactory;
    private final FolderPathResolver folderPathResolver;
    private final DriveNameValidator nameValidator;
    private final ObjectMapper objectMapper;

    @Value("${drive.legacy-root:/G2_Progetti}")
    private String legacyRootPath;

    public Optional<RootFolderConfiguration> getRootFolder() {
        return systemConfigRepository.findByConfigKey(ROOT_FOLDER_KEY)
                .map(config -> readConfiguration(config.getConfigValue()));
    }

    // 설정이 없으면 기존 루트(/G2_Progetti) 사용
    public String resolveRootPath() {
        return getRootFolder()
                .map(RootFolderConfiguration::getFolderPath)
                .filter(StringUtils::hasText)
                .orElse(legacyRootPath);
    }

    /**
     * 루트 폴더 변경. 경로를 먼저 로컬에서 검사하고 원격에 실제로 있는지 확인한다.
     */
    @Transactional
    public RootFolderConfiguration setRootFolder(String folderPath, String folderId) {
        String path = DrivePaths.normalize(folderPath);
        nameValidator.requireValidPath(path);

        RemoteDriveClient client = clientFactory.open();
        String lookup = StringUtils.hasText(folderId) ? folderId : path;
        DriveItem folder = folderPathResolver.find(client, lookup)
                .orElseThrow(() -> DriveSyncException.of(ErrorKind.NOT_FOUND, "원격 루트 폴더를 찾을 수 없습니다: " + folderPath));
        if (!folder.isDirectory()) {
            throw DriveSyncException.of(ErrorKind.INVALID_NAME, "루트는 폴더여야 합니다: " + folderPath);
        }

        RootFolderConfiguration configuration = new RootFolderConfiguration(
                path, folder.id(), DrivePaths.lastSegment(path), LocalDateTime.now());
        String json = writeConfiguration(configuration);

        SystemConfig config = systemConfigRepository.findByConfigKey(ROOT_FOLDER_KEY)
                .orElseGet(() -> new SystemConfig(ROOT_FOLDER_KEY, json));
        config.setConfigValue(json);
        config.setUpdatedAt(LocalDateTime.now());
        systemConfigRepository.save(config);

        log.info("원격 루트 폴더 변경: {}", path);
        return configuration;
    }

    // 루트 폴더가 없으면 만든다 (여러 번 불러도 같음)
    public DriveItem ensureRootFolder() {
        String root = DrivePaths.normalize(resolveRootPath());
        nameValidator.requireValidPath(root);
        return folderPathResolver.resolveOrCreate(clientFactory.open(), root);
    }

    private RootFolderConfiguration readConfiguration(String json) {
        try {
            return objectMapper.readValue(json, RootFolderConfiguration.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("루트 폴더 설정을 읽을 수 없습니다.", e);
        }
    }

    private String writeConfiguration(RootFolderConfiguration configuration) {
        try {
            return objectMapper.writeValueAsString(configuration);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("루트 폴더 설정을 저장할 수 없습니다.", e);
        }
    }
}
