package com.capstone.drivesync.repository;

import com.capstone.drivesync.entity.ProjectFolderMapping;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface ProjectFolderMappingRepository extends JpaRepository<ProjectFolderMapping, Long> {

    Optional<ProjectFolderMapping> findByProjectCode(String projectCode);

    boolean existsByProjectCode(String projectCode);

    boolean existsByRemoteFolderId(String remoteFolderId);
}
