package com.capstone.drivesync.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * 원격 드라이브 항목의 로컬 색인.
 */
@Entity
@Table(name = "files_index")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RemoteFileRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 256)
    private String driveItemId;

    @Column(nullable = false, length = 256)
    private String name;

    @Column(nullable = false, length = 1024)
    private String path;

    private long size;

    @Column(length = 128)
    private String mimeType;

    private LocalDateTime lastModified;

    @Column(length = 64)
    private String projectCode;

    @Column(length = 256)
    private String parentFolderId;

    private boolean folder;

    @Column(length = 2048)
    private String webUrl;

    // 임시 다운로드 URL. 오래 신뢰하지 말고 필요할 때 갱신한다
    @Column(length = 2048)
    private String downloadUrl;

    @CreationTimestamp
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
