package com.capstone.drivesync.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ProvisionedFolder {
    private final String id;
    private final String name;
    private final String path;
}
