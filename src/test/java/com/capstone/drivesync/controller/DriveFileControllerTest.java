package com.capstone.drivesync.controller;

import com.capstone.drivesync.domain.DomainError;
import com.capstone.drivesync.domain.ErrorKind;
import com.capstone.drivesync.dto.BulkRenameResult;
import com.capstone.drivesync.dto.MoveRequest;
import com.capstone.drivesync.dto.MoveResult;
import com.capstone.drivesync.dto.RenameOperation;
import com.capstone.drivesync.exception.DriveSyncException;
import com.capstone.drivesync.exception.RemoteDriveException;
import com.capstone.drivesync.remote.RemoteErrorClassifier;
import com.capstone.drivesync.service.DriveContentService;
import com.capstone.drivesync.service.FileIndexService;
import com.capstone.drivesync.service.FileMoveService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(DriveFileController.class)
@Import(RemoteErrorClassifier.class)
class DriveFileControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private FileMoveService fileMoveService;

    @MockitoBean
    private FileIndexService fileIndexService;

    @MockitoBean
    private DriveContentService contentService;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void moveFile_shouldReturnFinalLocation() throws Exception {
        //given
        MoveRequest request = new MoveRequest(null, "/G2_Progetti/24ABC/CONSEGNA", "report.pdf");
        Mockito.when(fileMoveService.moveOrRename(eq("F1"), isNull(), eq("/G2_Progetti/24ABC/CONSEGNA"), eq("report.pdf")))
                .thenReturn(new MoveResult("F1", "report_1.pdf", "/G2_Progetti/24ABC/CONSEGNA/report_1.pdf", "P9"));

        //when & then
        mockMvc.perform(post("/drive/files/F1/move")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("report_1.pdf"))
                .andExpect(jsonPath("$.parentFolderId").value("P9"));
    }

    @Test
    void moveFile_shouldMapClassifiedErrorToStatus() throws Exception {
        Mockito.when(fileMoveService.moveOrRename(any(), any(), any(), any()))
                .thenThrow(DriveSyncException.of(ErrorKind.MISSING_PARAMETER, "제자리 이름 변경에는 새 파일명이 필요합니다."));

        mockMvc.perform(post("/drive/files/F1/move")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("MISSING_PARAMETER"));
    }

    @Test
    void unclassifiedRemoteError_shouldStillBeClassified() throws Exception {
        Mockito.when(fileMoveService.moveOrRename(any(), any(), any(), any()))
                .thenThrow(new RemoteDriveException("throttled", 429, null,
                        "{\"error\":{\"code\":\"activityLimitReached\",\"message\":\"slow down\"}}"));

        mockMvc.perform(post("/drive/files/F1/move")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"newFileName\":\"a.pdf\"}"))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.kind").value("RATE_LIMITED"))
                .andExpect(jsonPath("$.retryable").value(true));
    }

    @Test
    void bulkRename_shouldReturnSummary() throws Exception {
        BulkRenameResult result = new BulkRenameResult(List.of(
                new BulkRenameResult.Item("F1", true, "uno.txt", null),
                new BulkRenameResult.Item("F2", false, null, DomainError.of(ErrorKind.NOT_FOUND, "F2"))));
        Mockito.when(fileMoveService.bulkRename(anyList())).thenReturn(result);

        mockMvc.perform(post("/drive/files/bulk-rename")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(List.of(
                                new RenameOperation("F1", "uno.txt"), new RenameOperation("F2", "due.txt")))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.summary.total").value(2))
                .andExpect(jsonPath("$.summary.failed").value(1))
                .andExpect(jsonPath("$.results[1].error.kind").value("NOT_FOUND"));
    }

    @Test
    void listIndex_shouldPassFilters() throws Exception {
        Mockito.when(fileIndexService.search("24ABC", "CONSEGNA", 20)).thenReturn(List.of());

        mockMvc.perform(get("/drive/files-index")
                        .param("projectCode", "24ABC")
                        .param("path", "CONSEGNA")
                        .param("limit", "20"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    void deleteIndex_shouldReturnNotFoundWhenMissing() throws Exception {
        Mockito.when(fileIndexService.delete("D9")).thenReturn(false);

        mockMvc.perform(delete("/drive/files-index/D9"))
                .andExpect(status().isNotFound());
    }
}
