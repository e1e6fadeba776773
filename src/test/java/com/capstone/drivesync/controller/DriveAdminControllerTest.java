package com.capstone.drivesync.controller;

import com.capstone.drivesync.domain.ReconcileStatus;
import com.capstone.drivesync.dto.ReconcileOutcome;
import com.capstone.drivesync.dto.ReconcileReport;
import com.capstone.drivesync.dto.RootFolderConfiguration;
import com.capstone.drivesync.remote.RemoteErrorClassifier;
import com.capstone.drivesync.service.ReconciliationService;
import com.capstone.drivesync.service.RootFolderService;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(DriveAdminController.class)
@Import(RemoteErrorClassifier.class)
class DriveAdminControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ReconciliationService reconciliationService;

    @MockitoBean
    private RootFolderService rootFolderService;

    // 정리 결과: 오류 항목은 성공 수에서 빠진다
    @Test
    void reconcile_shouldReportPerProjectOutcome() throws Exception {
        Mockito.when(reconciliationService.reconcileOrphans()).thenReturn(new ReconcileReport(List.of(
                new ReconcileOutcome("P1", ReconcileStatus.MAPPED_EXISTING, "기존 폴더에 연결", "F1"),
                new ReconcileOutcome("P2", ReconcileStatus.ERROR, "요청 제한", null))));

        mockMvc.perform(post("/drive/reconcile"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.processed").value(2))
                .andExpect(jsonPath("$.successful").value(1))
                .andExpect(jsonPath("$.results[1].status").value("ERROR"));
    }

    @Test
    void getRootFolder_shouldFallBackToLegacyPath() throws Exception {
        Mockito.when(rootFolderService.getRootFolder()).thenReturn(Optional.empty());
        Mockito.when(rootFolderService.resolveRootPath()).thenReturn("/G2_Progetti");

        mockMvc.perform(get("/drive/root-folder"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.folderPath").value("/G2_Progetti"));
    }

    @Test
    void setRootFolder_shouldReturnSavedConfiguration() throws Exception {
        Mockito.when(rootFolderService.setRootFolder("/Progetti", "R1"))
                .thenReturn(new RootFolderConfiguration("/Progetti", "R1", "Progetti", LocalDateTime.now()));

        mockMvc.perform(put("/drive/root-folder")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"folderPath\":\"/Progetti\",\"folderId\":\"R1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.folderName").value("Progetti"));
    }
}
