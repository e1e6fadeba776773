package com.capstone.drivesync.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * 장부 앱의 프로젝트. 이 모듈에서는 조회만 한다.
 */
@Entity
@Table(name = "projects")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Project {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 64)
    private String code;

    @Column(nullable = false, length = 16)
    private String template; // LUNGO or BREVE

    @Column(length = 512)
    private String description;

    @Builder.Default
    private LocalDateTime createdAt = LocalDateTime.now();
}
