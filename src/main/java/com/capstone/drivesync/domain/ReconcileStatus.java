package com.capstone.drivesync.domain;

public enum ReconcileStatus {
    MAPPED_EXISTING, // 기존 원격 폴더에 연결
    CREATED_NEW,     // 템플릿으로 새로 생성
    ERROR
}
