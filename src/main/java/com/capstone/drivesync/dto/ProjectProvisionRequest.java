package com.capstone.drivesync.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ProjectProvisionRequest {
    private String projectCode;
    private String template; // LUNGO/long, BREVE/short
    private String description; // 폴더 이름에 붙는 프로젝트 설명
}
