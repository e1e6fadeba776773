package com.capstone.drivesync.remote;

import com.capstone.drivesync.domain.DomainError;
import com.capstone.drivesync.domain.ErrorKind;
import com.capstone.drivesync.exception.DriveSyncException;
import com.capstone.drivesync.exception.RemoteDriveException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;

/**
 * 원격 오류를 {@link ErrorKind}로 변환하는 유일한 지점.
 * 응답 본문(스트림, 바이트, 문자열, 객체)을 문자열로 정규화한 뒤
 * {"error":{"code","message"}} 형식을 해석하고 상태 코드, 벤더 코드, 메시지 순으로 분류한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RemoteErrorClassifier {

    private static final Set<String> CONFLICT_CODES = Set.of("namealreadyexists", "conflictingitemname", "nameconflict");
    private static final Set<String> QUOTA_CODES = Set.of("quotalimitreached", "insufficientstorage", "quotaexceeded");
    private static final Set<String> THROTTLE_CODES = Set.of("activitylimitreached", "throttledrequest", "toomanyrequests");
    private static final Set<String> AUTH_CODES = Set.of("unauthenticated", "invalidauthenticationtoken");
    private static final Set<String> DENIED_CODES = Set.of("accessdenied", "forbidden");
    private static final Set<String> NOT_FOUND_CODES = Set.of("itemnotfound");
    private static final Set<String> INVALID_CODES = Set.of("invalidrequest", "badrequest", "invalidname");

    private final ObjectMapper objectMapper;

    public DomainError classify(Throwable error) {
        if (error instanceof DriveSyncException classified) {
            return classified.getError();
        }
        if (!(error instanceof RemoteDriveException remote)) {
            return DomainError.builder()
                    .kind(ErrorKind.UNKNOWN)
                    .httpStatus(500)
                    .userMessage(ErrorKind.UNKNOWN.getDefaultMessage())
                    .detail(error.getMessage())
                    .build();
        }

        String body = readBody(remote.getBody());
        String vendorCode = remote.getVendorCode();
        String message = null;
        JsonNode errorNode = parseError(body);
        if (errorNode != null) {
            if (vendorCode == null && errorNode.hasNonNull("code")) {
                vendorCode = errorNode.get("code").asText();
            }
            if (errorNode.hasNonNull("message")) {
                message = errorNode.get("message").asText();
            }
        }
        if (message == null) {
            message = body != null && !body.isBlank() ? body : remote.getMessage();
        }

        int status = remote.getStatusCode();
        ErrorKind kind = resolveKind(status, vendorCode, message);
        return DomainError.builder()
                .kind(kind)
                .httpStatus(status > 0 ? status : kind.getDefaultStatus().value())
                .userMessage(kind.getDefaultMessage())
                .vendorCode(vendorCode)
                .detail(message)
                .build();
    }

    ErrorKind resolveKind(int status, String vendorCode, String message) {
        String code = vendorCode == null ? "" : vendorCode.toLowerCase(Locale.ROOT);

        // 벤더 코드가 가장 구체적이다
        if (CONFLICT_CODES.contains(code)) return ErrorKind.NAME_CONFLICT;
        if (QUOTA_CODES.contains(code)) return ErrorKind.QUOTA_EXCEEDED;
        if (THROTTLE_CODES.contains(code)) return ErrorKind.RATE_LIMITED;
        if (AUTH_CODES.contains(code)) return ErrorKind.AUTH_EXPIRED;
        if (DENIED_CODES.contains(code)) return ErrorKind.PERMISSION_DENIED;
        if (NOT_FOUND_CODES.contains(code)) return ErrorKind.NOT_FOUND;

        switch (status) {
            case 400:
                return INVALID_CODES.contains(code) || code.isEmpty() ? ErrorKind.INVALID_NAME : ErrorKind.UNKNOWN;
            case 401:
                return ErrorKind.AUTH_EXPIRED;
            case 403:
                return ErrorKind.PERMISSION_DENIED;
            case 404:
                return ErrorKind.NOT_FOUND;
            case 409:
                return ErrorKind.NAME_CONFLICT;
            case 429:
            case 503:
                return ErrorKind.RATE_LIMITED;
            case 507:
                return ErrorKind.QUOTA_EXCEEDED;
            default:
                break;
        }

        String lower = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (lower.contains("throttl") || lower.contains("too many requests")) return ErrorKind.RATE_LIMITED;
        if (lower.contains("quota") || lower.contains("insufficient storage")) return ErrorKind.QUOTA_EXCEEDED;
        if (lower.contains("already exists")) return ErrorKind.NAME_CONFLICT;
        if (lower.contains("authentication") || lower.contains("token expired")) return ErrorKind.AUTH_EXPIRED;
        return ErrorKind.UNKNOWN;
    }

    String readBody(Object body) {
        if (body == null) {
            return null;
        }
        if (body instanceof InputStream stream) {
            return readStream(stream);
        }
        if (body instanceof byte[] bytes) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
        if (body instanceof String text) {
            return text;
        }
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            log.debug("오류 본문 직렬화 실패: {}", e.getMessage());
            return String.valueOf(body);
        }
    }

    // 청크 단위로 UTF-8 디코딩
    private String readStream(InputStream stream) {
        StringBuilder sb = new StringBuilder();
        char[] buffer = new char[4096];
        try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            int read;
            while ((read = reader.read(buffer)) != -1) {
                sb.append(buffer, 0, read);
            }
        } catch (IOException e) {
            log.debug("오류 본문 스트림 읽기 실패: {}", e.getMessage());
        }
        return sb.toString();
    }

    private JsonNode parseError(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode error = root.path("error");
            return error.isObject() ? error : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
