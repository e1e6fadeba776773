package com.capstone.drivesync.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FolderNameComposerTest {

    private final DriveNameValidator validator = new DriveNameValidator();

    @Test
    void compose_shouldJoinCodeAndSanitizedDescription() {
        assertThat(FolderNameComposer.compose("24ABCXYZ01", "Ponte sul Po")).isEqualTo("24ABCXYZ01_Ponte_sul_Po");
    }

    @Test
    void compose_shouldReturnCodeWhenDescriptionMissing() {
        assertThat(FolderNameComposer.compose("24ABC", null)).isEqualTo("24ABC");
        assertThat(FolderNameComposer.compose("24ABC", "  ")).isEqualTo("24ABC");
        assertThat(FolderNameComposer.compose("24ABC", "???")).isEqualTo("24ABC");
    }

    @Test
    void sanitizeDescription_shouldKeepAccentedLettersAndCollapseUnderscores() {
        assertThat(FolderNameComposer.sanitizeDescription("  Città  di   Forlì / lotto #2 "))
                .isEqualTo("Città_di_Forlì_lotto_2");
        assertThat(FolderNameComposer.sanitizeDescription("__ciao__")).isEqualTo("ciao");
    }

    @Test
    void sanitizeProjectCode_shouldStripDisallowedCharacters() {
        assertThat(FolderNameComposer.sanitizeProjectCode("24/AB:C-01_x")).isEqualTo("24ABC-01_x");
    }

    @Test
    void compose_shouldTruncateDescriptionAndKeepCodePrefix() {
        String name = FolderNameComposer.compose("24ABCXYZ01", "lungo ".repeat(80));

        assertThat(name).startsWith("24ABCXYZ01_");
        assertThat(name.length()).isLessThanOrEqualTo(255);
        assertThat(name).doesNotEndWith("_");
    }

    @Test
    void compose_resultShouldAlwaysPassNameValidation() {
        String[] descriptions = {"Ponte sul Po", "a:b*c?d", "...", "CON", "x".repeat(400), "fine. ", "  .inizio"};
        for (String description : descriptions) {
            String name = FolderNameComposer.compose("24ABCXYZ01", description);
            assertThat(validator.validateName(name).isValid())
                    .as("name for description '%s'", description)
                    .isTrue();
        }
    }
}
