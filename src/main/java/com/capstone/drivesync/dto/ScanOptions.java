package com.capstone.drivesync.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ScanOptions {
    private boolean includeSubfolders = true;
    private int maxDepth; // 0 이하이면 기본값, 최대 10
    private boolean includeFolders; // 폴더 항목도 결과에 포함

    public static ScanOptions defaults() {
        return new ScanOptions(true, 0, false);
    }
}
