package com.capstone.drivesync.util;

import com.capstone.drivesync.exception.DriveSyncException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DrivePathsTest {

    @Test
    void normalize_shouldCollapseSlashesAndAddLeadingSlash() {
        assertThat(DrivePaths.normalize("Progetti//2024///")).isEqualTo("/Progetti/2024");
        assertThat(DrivePaths.normalize("/")).isEqualTo("/");
    }

    @Test
    void normalize_shouldRejectParentSegments() {
        assertThatThrownBy(() -> DrivePaths.normalize("/Progetti/../segreti"))
                .isInstanceOf(DriveSyncException.class);
    }

    @Test
    void join_shouldHandleRoot() {
        assertThat(DrivePaths.join("/", "A")).isEqualTo("/A");
        assertThat(DrivePaths.join("/G2_Progetti", "A")).isEqualTo("/G2_Progetti/A");
    }

    @Test
    void lastSegment_shouldFallBackToRoot() {
        assertThat(DrivePaths.lastSegment("/Studio/Progetti")).isEqualTo("Progetti");
        assertThat(DrivePaths.lastSegment("/")).isEqualTo("Root");
    }
}
