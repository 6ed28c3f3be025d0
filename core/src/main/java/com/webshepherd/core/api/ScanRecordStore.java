package com.webshepherd.core.api;

import com.webshepherd.core.model.ScanRecord;

import java.util.List;
import java.util.Optional;

/**
 * 스캔 레코드 저장소 계약. 같은 scanId 로 저장하면 최신 스냅샷으로 덮어쓴다.
 * 쓰기는 ScanService 만 한다.
 */
public interface ScanRecordStore {
    void save(ScanRecord record);

    Optional<ScanRecord> find(String scanId);

    /** 생성 순서(최초 save 순서) */
    List<ScanRecord> findAll();
}
