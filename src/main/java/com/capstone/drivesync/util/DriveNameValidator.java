package com.capstone.drivesync.util;

import com.capstone.drivesync.domain.ErrorKind;
import com.capstone.drivesync.domain.ValidationResult;
import com.capstone.drivesync.exception.DriveSyncException;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 원격 드라이브 이름 규칙 검사. 네트워크 호출 전에 항상 먼저 실행한다.
 */
@Component
public class DriveNameValidator {

    public static final int MAX_NAME_LENGTH = 256;
    public static final int MAX_PATH_LENGTH = 400;

    private static final Pattern INVALID_CHARS = Pattern.compile("[\\\\/:*?\"<>|]");
    private static final Set<String> RESERVED_NAMES = Set.of(
            "CON", "PRN", "AUX", "NUL",
            "COM1", "COM2", "COM3", "COM4", "COM5", "COM6", "COM7", "COM8", "COM9",
            "LPT1", "LPT2", "LPT3", "LPT4", "LPT5", "LPT6", "LPT7", "LPT8", "LPT9");

    public ValidationResult validateName(String name) {
        if (name == null || name.trim().isEmpty()) {
            return ValidationResult.invalid("이름이 비어 있습니다.");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            return ValidationResult.invalid("이름이 너무 깁니다. (최대 " + MAX_NAME_LENGTH + "자)");
        }
        if (INVALID_CHARS.matcher(name).find()) {
            return ValidationResult.invalid("사용할 수 없는 문자가 포함되어 있습니다: \\ / : * ? \" < > |");
        }
        if (RESERVED_NAMES.contains(name.toUpperCase(Locale.ROOT))) {
            return ValidationResult.invalid("예약된 이름은 사용할 수 없습니다: " + name);
        }
        if (name.endsWith(".") || name.endsWith(" ")) {
            return ValidationResult.invalid("이름은 마침표나 공백으로 끝날 수 없습니다.");
        }
        if (name.startsWith(".")) {
            return ValidationResult.invalid("이름은 마침표로 시작할 수 없습니다.");
        }
        return ValidationResult.ok();
    }

    public ValidationResult validatePath(String path) {
        if (path == null || path.trim().isEmpty()) {
            return ValidationResult.invalid("경로가 비어 있습니다.");
        }
        if (path.length() > MAX_PATH_LENGTH) {
            return ValidationResult.invalid("경로가 너무 깁니다. (최대 " + MAX_PATH_LENGTH + "자)");
        }
        for (String segment : path.split("/")) {
            if (segment.isEmpty()) {
                continue;
            }
            ValidationResult result = validateName(segment);
            if (!result.isValid()) {
                return ValidationResult.invalid("잘못된 경로 구간 \"" + segment + "\": " + result.getReason(), segment);
            }
        }
        return ValidationResult.ok();
    }

    public void requireValidName(String name) {
        ValidationResult result = validateName(name);
        if (!result.isValid()) {
            throw DriveSyncException.of(ErrorKind.INVALID_NAME, result.getReason());
        }
    }

    public void requireValidPath(String path) {
        ValidationResult result = validatePath(path);
        if (!result.isValid()) {
            throw DriveSyncException.of(ErrorKind.INVALID_NAME, result.getReason());
        }
    }
}
