package com.capstone.drivesync.dto;

import com.capstone.drivesync.domain.DomainError;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
public class BulkRenameResult {

    private final List<Item> results;
    private final Summary summary;

    public BulkRenameResult(List<Item> results) {
        this.results = results;
        long successful = results.stream().filter(Item::isSuccess).count();
        this.summary = new Summary(results.size(), (int) successful, results.size() - (int) successful);
    }

    @Getter
    @AllArgsConstructor
    public static class Item {
        private final String fileId;
        private final boolean success;
        private final String name; // 변경된 이름, 실패 시 null
        private final DomainError error;
    }

    @Getter
    @AllArgsConstructor
    public static class Summary {
        private final int total;
        private final int successful;
        private final int failed;
    }
}
