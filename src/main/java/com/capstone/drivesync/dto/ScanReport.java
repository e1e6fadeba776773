package com.capstone.drivesync.dto;

import com.capstone.drivesync.domain.FailureRecord;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class ScanReport {
    private final String folderPath;
    private final String projectCode;
    private final int scanned; // 원격에서 찾은 항목 수
    private final int indexed; // 색인에 저장된 항목 수
    private final List<FileIndexResponse> files;
    private final List<FailureRecord> failures; // 접근하지 못한 폴더
}
