package com.capstone.drivesync.service;

import com.capstone.drivesync.domain.ErrorKind;
import com.capstone.drivesync.domain.MappingHealth;
import com.capstone.drivesync.dto.MappingVerification;
import com.capstone.drivesync.entity.Project;
import com.capstone.drivesync.entity.ProjectFolderMapping;
import com.capstone.drivesync.exception.DriveSyncException;
import com.capstone.drivesync.remote.DriveItem;
import com.capstone.drivesync.remote.RemoteDriveClient;
import com.capstone.drivesync.remote.RemoteDriveClientFactory;
import com.capstone.drivesync.repository.ProjectFolderMappingRepository;
import com.capstone.drivesync.repository.ProjectRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProjectFolderMappingServiceTest {

    @Mock
    private ProjectFolderMappingRepository mappingRepository;

    @Mock
    private ProjectRepository projectRepository;

    @Mock
    private RemoteDriveClientFactory clientFactory;

    @Mock
    private FolderPathResolver folderPathResolver;

    @Mock
    private RemoteDriveClient client;

    @InjectMocks
    private ProjectFolderMappingService mappingService;

    private static DriveItem folder(String id, String name, String parentPath) {
        return new DriveItem(id, name, 0L, null, null, new DriveItem.Folder(0), null,
                new DriveItem.ParentReference("parent", "drive-1", "/drive/root:" + parentPath), null);
    }

    private static ProjectFolderMapping mapping(String code, String folderId, String path) {
        return ProjectFolderMapping.builder()
                .projectCode(code)
                .remoteFolderId(folderId)
                .remoteFolderPath(path)
                .remoteFolderName(path == null ? null : path.substring(path.lastIndexOf('/') + 1))
                .build();
    }

    // 매핑 생성 테스트
    @Test
    void create_shouldSaveMapping() {
        //given
        when(mappingRepository.existsByProjectCode("24ABC")).thenReturn(false);
        when(mappingRepository.existsByRemoteFolderId("F1")).thenReturn(false);
        when(mappingRepository.save(any(ProjectFolderMapping.class))).thenAnswer(inv -> inv.getArgument(0));

        //when
        ProjectFolderMapping saved = mappingService.create("24ABC", "F1", "/G2_Progetti/24ABC", "24ABC");

        //then
        assertEquals("24ABC", saved.getProjectCode());
        assertEquals("F1", saved.getRemoteFolderId());
        assertEquals("/G2_Progetti/24ABC", saved.getRemoteFolderPath());
    }

    @Test
    void create_shouldRejectSecondMappingForSameCode() {
        //given: 이미 매핑된 프로젝트
        when(mappingRepository.existsByProjectCode("24ABC")).thenReturn(true);

        //when & then
        DriveSyncException exception = assertThrows(DriveSyncException.class,
                () -> mappingService.create("24ABC", "F2", "/G2_Progetti/altro", "altro"));
        assertEquals(ErrorKind.DUPLICATE_MAPPING, exception.getKind());
        verify(mappingRepository, never()).save(any());
    }

    @Test
    void create_shouldRejectFolderMappedToAnotherProject() {
        when(mappingRepository.existsByProjectCode("24XYZ")).thenReturn(false);
        when(mappingRepository.existsByRemoteFolderId("F1")).thenReturn(true);

        DriveSyncException exception = assertThrows(DriveSyncException.class,
                () -> mappingService.create("24XYZ", "F1", "/G2_Progetti/24XYZ", "24XYZ"));
        assertEquals(ErrorKind.DUPLICATE_MAPPING, exception.getKind());
    }

    @Test
    void create_shouldStoreBlankFolderIdAsUnresolved() {
        when(mappingRepository.existsByProjectCode("24ABC")).thenReturn(false);
        when(mappingRepository.save(any(ProjectFolderMapping.class))).thenAnswer(inv -> inv.getArgument(0));

        ProjectFolderMapping saved = mappingService.create("24ABC", "", "/G2_Progetti/24ABC", "24ABC");

        assertNull(saved.getRemoteFolderId());
        verify(mappingRepository, never()).existsByRemoteFolderId(any());
    }

    @Test
    void deleteThenCreate_shouldSucceed() {
        //given
        ProjectFolderMapping existing = mapping("24ABC", "F1", "/G2_Progetti/24ABC");
        when(mappingRepository.findByProjectCode("24ABC")).thenReturn(Optional.of(existing));
        when(mappingRepository.existsByProjectCode("24ABC")).thenReturn(false);
        when(mappingRepository.existsByRemoteFolderId("F1")).thenReturn(false);
        when(mappingRepository.save(any(ProjectFolderMapping.class))).thenAnswer(inv -> inv.getArgument(0));

        //when
        boolean deleted = mappingService.delete("24ABC");
        ProjectFolderMapping recreated = mappingService.create("24ABC", "F1", "/G2_Progetti/24ABC", "24ABC");

        //then
        assertTrue(deleted);
        verify(mappingRepository).delete(existing);
        assertEquals("F1", recreated.getRemoteFolderId());
    }

    @Test
    void delete_shouldReturnFalseWhenMissing() {
        when(mappingRepository.findByProjectCode("NONE")).thenReturn(Optional.empty());

        assertFalse(mappingService.delete("NONE"));
        verify(mappingRepository, never()).delete(any());
    }

    @Test
    void findOrphanProjects_shouldReturnProjectsWithoutMapping() {
        //given
        List<Project> projects = List.of(
                Project.builder().code("A").template("BREVE").build(),
                Project.builder().code("B").template("BREVE").build(),
                Project.builder().code("C").template("LUNGO").build());
        when(mappingRepository.findAll()).thenReturn(List.of(mapping("B", "F-B", "/G2_Progetti/B")));

        //when
        List<Project> orphans = mappingService.findOrphanProjects(projects);

        //then
        assertEquals(List.of("A", "C"), orphans.stream().map(Project::getCode).toList());
    }

    @Test
    void linkProjectToFolder_shouldRequireExistingRemoteFolder() {
        when(clientFactory.open()).thenReturn(client);
        when(folderPathResolver.find(client, "/Archivio/24ABC")).thenReturn(Optional.empty());

        DriveSyncException exception = assertThrows(DriveSyncException.class,
                () -> mappingService.linkProjectToFolder("24ABC", "/Archivio//24ABC"));
        assertEquals(ErrorKind.NOT_FOUND, exception.getKind());
        verify(mappingRepository, never()).save(any());
    }

    @Test
    void linkProjectToFolder_shouldStoreRemoteIdentity() {
        when(clientFactory.open()).thenReturn(client);
        when(folderPathResolver.find(client, "F77")).thenReturn(Optional.of(folder("F77", "24ABC_Vecchio", "/Archivio")));
        when(mappingRepository.existsByProjectCode("24ABC")).thenReturn(false);
        when(mappingRepository.existsByRemoteFolderId("F77")).thenReturn(false);
        when(mappingRepository.save(any(ProjectFolderMapping.class))).thenAnswer(inv -> inv.getArgument(0));

        ProjectFolderMapping linked = mappingService.linkProjectToFolder("24ABC", "F77");

        assertEquals("/Archivio/24ABC_Vecchio", linked.getRemoteFolderPath());
        assertEquals("24ABC_Vecchio", linked.getRemoteFolderName());
    }

    @Test
    void verifyMapping_shouldRefreshPathWhenFolderMoved() {
        //given: 원격에서 폴더가 다른 위치로 옮겨짐
        ProjectFolderMapping stored = mapping("24ABC", "F1", "/G2_Progetti/24ABC");
        when(mappingRepository.findByProjectCode("24ABC")).thenReturn(Optional.of(stored));
        when(clientFactory.open()).thenReturn(client);
        when(folderPathResolver.find(client, "F1")).thenReturn(Optional.of(folder("F1", "24ABC", "/Archivio/2024")));
        when(mappingRepository.save(any(ProjectFolderMapping.class))).thenAnswer(inv -> inv.getArgument(0));

        //when
        MappingVerification result = mappingService.verifyMapping("24ABC");

        //then
        assertEquals(MappingHealth.DRIFTED, result.getHealth());
        assertEquals("/Archivio/2024/24ABC", result.getMapping().getRemoteFolderPath());
    }

    @Test
    void verifyMapping_shouldReportLostFolder() {
        ProjectFolderMapping stored = mapping("24ABC", "F1", "/G2_Progetti/24ABC");
        when(mappingRepository.findByProjectCode("24ABC")).thenReturn(Optional.of(stored));
        when(clientFactory.open()).thenReturn(client);
        when(folderPathResolver.find(client, "F1")).thenReturn(Optional.empty());

        MappingVerification result = mappingService.verifyMapping("24ABC");

        assertEquals(MappingHealth.LOST, result.getHealth());
        Mockito.verify(mappingRepository, never()).save(any());
    }

    @Test
    void verifyMapping_shouldResolveMissingIdFromPath() {
        ProjectFolderMapping stored = mapping("24ABC", null, "/G2_Progetti/24ABC");
        when(mappingRepository.findByProjectCode("24ABC")).thenReturn(Optional.of(stored));
        when(clientFactory.open()).thenReturn(client);
        when(folderPathResolver.find(client, "/G2_Progetti/24ABC"))
                .thenReturn(Optional.of(folder("F9", "24ABC", "/G2_Progetti")));
        when(mappingRepository.save(any(ProjectFolderMapping.class))).thenAnswer(inv -> inv.getArgument(0));

        MappingVerification result = mappingService.verifyMapping("24ABC");

        assertEquals(MappingHealth.RESOLVED, result.getHealth());
        assertEquals("F9", result.getMapping().getRemoteFolderId());
    }
}
