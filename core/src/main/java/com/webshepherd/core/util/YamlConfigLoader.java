package com.webshepherd.core.util;

import com.webshepherd.core.model.ScanConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * scan.yml 을 읽어 ScanConfig 로 변환. 없는 키는 기본값 유지.
 *
 * 예상 YAML 키:
 * timeoutMs: 10000
 * maxRedirects: 5
 * maxHtmlSizeMb: 5
 * userAgent: "WebShepherd/1.0 (...)"
 * concurrency: 4
 * output:
 *   dir: "out"
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static final String DEFAULT_FILE = "scan.yml";

    /** workDir/scan.yml 이 있으면 읽고, 없으면 기본값 */
    public static ScanConfig loadDefault(Path workDir) throws IOException {
        Path yml = workDir.resolve(DEFAULT_FILE);
        if (!Files.exists(yml)) return ScanConfig.defaults();
        return load(yml);
    }

    /**
     * @throws IOException 파일 없음/읽기 실패/YAML 문법 오류
     * @throws IllegalArgumentException 값 검증 실패(ScanConfig.validate)
     */
    public static ScanConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("scan.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            Object root;
            try {
                root = new Yaml(new SafeConstructor(new LoaderOptions())).load(in);
            } catch (YAMLException e) {
                throw new IOException("Invalid YAML in " + yamlPath + ": " + e.getMessage(), e);
            }
            return fromMap(root);
        }
    }

    static ScanConfig fromMap(Object root) {
        ScanConfig cfg = ScanConfig.defaults();
        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            cfg.validate();
            return cfg;
        }

        setLong(map, "timeoutMs", cfg::setTimeoutMs);
        setInt(map, "maxRedirects", cfg::setMaxRedirects);
        setInt(map, "maxHtmlSizeMb", cfg::setMaxHtmlSizeMb);
        setString(map, "userAgent", cfg::setUserAgent);
        setInt(map, "concurrency", cfg::setConcurrency);

        Object output = map.get("output");
        if (output instanceof Map<?, ?> out) {
            setString(out, "dir", s -> cfg.setOutputDir(Path.of(s)));
        }

        cfg.validate();
        return cfg;
    }

    // ------------ helpers ------------
    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(parse(key, v).intValue());
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(parse(key, v));
    }

    private static Long parse(String key, Object v) {
        try {
            return Long.parseLong(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number: " + v, e);
        }
    }
}
