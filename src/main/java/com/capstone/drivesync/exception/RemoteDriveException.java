package com.capstone.drivesync.exception;

import lombok.Getter;

/**
 * 원격 드라이브 API 호출 실패를 그대로 담는다.
 * body는 InputStream, byte[], String, Map 등 응답 형태 그대로이며
 * {@link com.capstone.drivesync.remote.RemoteErrorClassifier}가 해석한다.
 */
@Getter
public class RemoteDriveException extends RuntimeException {

    private final int statusCode;
    private final String vendorCode;
    private final transient Object body;

    public RemoteDriveException(String message, int statusCode, String vendorCode, Object body) {
        super(message);
        this.statusCode = statusCode;
        this.vendorCode = vendorCode;
        this.body = body;
    }

    public RemoteDriveException(String message, int statusCode, String vendorCode, Object body, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.vendorCode = vendorCode;
        this.body = body;
    }
}
