package com.capstone.drivesync.repository;

import com.capstone.drivesync.entity.RemoteFileRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface RemoteFileRecordRepository extends JpaRepository<RemoteFileRecord, Long> {

    Optional<RemoteFileRecord> findByDriveItemId(String driveItemId);

    List<RemoteFileRecord> findByProjectCode(String projectCode, Pageable pageable);

    List<RemoteFileRecord> findByPathContaining(String path, Pageable pageable);

    List<RemoteFileRecord> findByProjectCodeAndPathContaining(String projectCode, String path, Pageable pageable);
}
