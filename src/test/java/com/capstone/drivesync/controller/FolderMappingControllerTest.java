package com.capstone.drivesync.controller;

import com.capstone.drivesync.domain.ErrorKind;
import com.capstone.drivesync.domain.MappingHealth;
import com.capstone.drivesync.dto.FolderMappingRequest;
import com.capstone.drivesync.dto.FolderMappingResponse;
import com.capstone.drivesync.dto.MappingVerification;
import com.capstone.drivesync.entity.ProjectFolderMapping;
import com.capstone.drivesync.exception.DriveSyncException;
import com.capstone.drivesync.exception.ResourceNotFoundException;
import com.capstone.drivesync.remote.RemoteErrorClassifier;
import com.capstone.drivesync.service.ProjectFolderMappingService;
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
import static org.mockito.ArgumentMatchers.eq;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(FolderMappingController.class)
@Import(RemoteErrorClassifier.class)
class FolderMappingControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ProjectFolderMappingService mappingService;

    @Autowired
    private ObjectMapper objectMapper;

    private static ProjectFolderMapping mapping(String code) {
        return ProjectFolderMapping.builder()
                .projectCode(code)
                .remoteFolderId("F-" + code)
                .remoteFolderPath("/G2_Progetti/" + code)
                .remoteFolderName(code)
                .build();
    }

    // 매핑 추가 테스트
    @Test
    void create_shouldReturnCreatedMapping() throws Exception {
        //given
        FolderMappingRequest request = new FolderMappingRequest("24ABC", "F-24ABC", "/G2_Progetti/24ABC", "24ABC");
        Mockito.when(mappingService.create(eq("24ABC"), eq("F-24ABC"), eq("/G2_Progetti/24ABC"), eq("24ABC")))
                .thenReturn(mapping("24ABC"));

        //when & then
        mockMvc.perform(post("/drive/mappings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.projectCode").value("24ABC"))
                .andExpect(jsonPath("$.remoteFolderPath").value("/G2_Progetti/24ABC"));
    }

    @Test
    void create_shouldReturnConflictForDuplicate() throws Exception {
        FolderMappingRequest request = new FolderMappingRequest("24ABC", "F1", "/G2_Progetti/24ABC", "24ABC");
        Mockito.when(mappingService.create(any(), any(), any(), any()))
                .thenThrow(DriveSyncException.of(ErrorKind.DUPLICATE_MAPPING, "이미 매핑된 프로젝트입니다: 24ABC"));

        mockMvc.perform(post("/drive/mappings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.kind").value("DUPLICATE_MAPPING"))
                .andExpect(jsonPath("$.detail").value("이미 매핑된 프로젝트입니다: 24ABC"));
    }

    @Test
    void getAll_shouldListMappings() throws Exception {
        Mockito.when(mappingService.getAll()).thenReturn(List.of(mapping("A"), mapping("B")));

        mockMvc.perform(get("/drive/mappings"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[1].remoteFolderId").value("F-B"));
    }

    @Test
    void get_shouldReturnNotFoundWhenMissing() throws Exception {
        Mockito.when(mappingService.getOrThrow("NONE")).thenThrow(new ResourceNotFoundException("프로젝트 폴더 매핑이 없습니다: NONE"));

        mockMvc.perform(get("/drive/mappings/NONE"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.kind").value("NOT_FOUND"));
    }

    @Test
    void delete_shouldReturnOkOrNotFound() throws Exception {
        Mockito.when(mappingService.delete("A")).thenReturn(true);
        Mockito.when(mappingService.delete("B")).thenReturn(false);

        mockMvc.perform(delete("/drive/mappings/A")).andExpect(status().isOk());
        mockMvc.perform(delete("/drive/mappings/B")).andExpect(status().isNotFound());
    }

    @Test
    void verify_shouldReturnHealth() throws Exception {
        Mockito.when(mappingService.verifyMapping("A"))
                .thenReturn(new MappingVerification("A", MappingHealth.DRIFTED, new FolderMappingResponse(mapping("A"))));

        mockMvc.perform(post("/drive/mappings/A/verify"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.health").value("DRIFTED"));
    }
}
