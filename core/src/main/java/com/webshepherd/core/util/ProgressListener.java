package com.webshepherd.core.util;

@FunctionalInterface
public interface ProgressListener {
    /**
     * @param progress 0.0~1.0
     * @param phase    "scan" | "export"
     * @param done     완료된 스캔 수
     * @param total    전체 스캔 수
     */
    void onProgress(double progress, String phase, long done, long total);

    ProgressListener NONE = (p, phase, d, t) -> {};
}
