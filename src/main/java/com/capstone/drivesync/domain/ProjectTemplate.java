package com.capstone.drivesync.domain;

import lombok.Getter;

import java.util.List;
import java.util.Optional;

/**
 * 프로젝트 폴더 아래에 생성되는 하위 폴더 구성.
 */
@Getter
public enum ProjectTemplate {

    LUNGO("long", List.of(
            "1_CONSEGNA",
            "2_PERMIT",
            "3_PROGETTO",
            "4_MATERIALE_RICEVUTO",
            "5_CANTIERE",
            "6_VERBALI_NOTIFICHE_COMUNICAZIONI",
            "7_SOPRALLUOGHI",
            "8_VARIANTI",
            "9_PARCELLA",
            "10_INCARICO")),
    BREVE("short", List.of(
            "CONSEGNA",
            "ELABORAZIONI",
            "MATERIALE_RICEVUTO",
            "SOPRALLUOGHI"));

    private final String alias;
    private final List<String> subfolders;

    ProjectTemplate(String alias, List<String> subfolders) {
        this.alias = alias;
        this.subfolders = subfolders;
    }

    // "LUNGO" / "long", "BREVE" / "short" 모두 허용 (대소문자 무시)
    public static Optional<ProjectTemplate> resolve(String identifier) {
        if (identifier == null) {
            return Optional.empty();
        }
        String trimmed = identifier.trim();
        for (ProjectTemplate template : values()) {
            if (template.name().equalsIgnoreCase(trimmed) || template.alias.equalsIgnoreCase(trimmed)) {
                return Optional.of(template);
            }
        }
        return Optional.empty();
    }
}
