package com.capstone.drivesync.exception;

// 로컬 저장소(매핑, 파일 색인)에 대상이 없을 때
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
