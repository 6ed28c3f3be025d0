package com.webshepherd.core.service.export;

import com.webshepherd.core.model.ScanRecord;

import java.io.IOException;
import java.nio.file.Path;

/** 스캔 레코드를 보고서 파일로 내보내는 책임 */
public interface ReportExporter {
    /**
     * @param baseDir 출력 루트 (null이면 "out")
     * @param record  종료 상태 레코드(진행 중 레코드도 그대로 직렬화한다)
     * @return 생성된 파일의 경로
     */
    Path export(Path baseDir, ScanRecord record) throws IOException;
}
