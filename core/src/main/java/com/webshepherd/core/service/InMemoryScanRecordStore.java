package com.webshepherd.core.service;

import com.webshepherd.core.api.ScanRecordStore;
import com.webshepherd.core.model.ScanRecord;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** 프로세스 메모리 저장소. 배치 스캔 워커들이 동시에 쓰므로 동기화한다. */
public final class InMemoryScanRecordStore implements ScanRecordStore {

    private final Map<String, ScanRecord> records = new LinkedHashMap<>();

    @Override
    public synchronized void save(ScanRecord record) {
        Objects.requireNonNull(record, "record");
        records.put(record.getScanId(), record); // 기존 키 덮어쓰기는 삽입 순서 유지
    }

    @Override
    public synchronized Optional<ScanRecord> find(String scanId) {
        return Optional.ofNullable(records.get(scanId));
    }

    @Override
    public synchronized List<ScanRecord> findAll() {
        return List.copyOf(records.values());
    }
}
