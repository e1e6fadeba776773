package com.capstone.drivesync.domain;

public enum MappingHealth {
    OK,
    DRIFTED,  // 원격 폴더가 이동/이름 변경됨, 경로 갱신
    LOST,     // 원격 폴더가 삭제됨
    RESOLVED  // 경로로 폴더 ID를 찾아 채움
}
