package com.capstone.drivesync.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 일부 단계가 실패해도 계속 진행하는 작업의 결과.
 * 성공한 항목과 실패 기록을 함께 보관한다.
 */
public class PartialResult<T> {

    private final List<T> succeeded = new ArrayList<>();
    private final List<FailureRecord> failed = new ArrayList<>();

    public void addSuccess(T item) {
        succeeded.add(item);
    }

    public void addFailure(FailureRecord failure) {
        failed.add(failure);
    }

    public List<T> getSucceeded() {
        return Collections.unmodifiableList(succeeded);
    }

    public List<FailureRecord> getFailed() {
        return Collections.unmodifiableList(failed);
    }

    public boolean hasFailures() {
        return !failed.isEmpty();
    }

    public boolean isComplete() {
        return failed.isEmpty();
    }
}
