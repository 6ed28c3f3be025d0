package com.webshepherd.core.util;

import com.webshepherd.core.model.ScanConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YamlConfigLoaderTest {

    @TempDir Path tmp;

    @Test
    void loads_all_known_keys() throws Exception {
        Path yml = tmp.resolve("scan.yml");
        Files.writeString(yml, String.join("\n",
                "timeoutMs: 2500",
                "maxRedirects: 2",
                "maxHtmlSizeMb: 1",
                "userAgent: \"TestAgent/2.0\"",
                "concurrency: 8",
                "output:",
                "  dir: \"reports-out\"",
                ""));

        ScanConfig c = YamlConfigLoader.load(yml);

        assertThat(c.getTimeout()).isEqualTo(Duration.ofMillis(2500));
        assertThat(c.getMaxRedirects()).isEqualTo(2);
        assertThat(c.getMaxBodyBytes()).isEqualTo(1024L * 1024);
        assertThat(c.getUserAgent()).isEqualTo("TestAgent/2.0");
        assertThat(c.getConcurrency()).isEqualTo(8);
        assertThat(c.getOutputDir()).isEqualTo(Path.of("reports-out"));
    }

    @Test
    void missing_keys_keep_defaults() {
        ScanConfig c = YamlConfigLoader.fromMap(Map.of("maxRedirects", "3"));

        assertThat(c.getMaxRedirects()).isEqualTo(3);
        assertThat(c.getTimeout()).isEqualTo(ScanConfig.defaults().getTimeout());
        assertThat(YamlConfigLoader.fromMap(null).getMaxRedirects()).isEqualTo(5);
    }

    @Test
    void bad_values_and_files_are_reported() throws Exception {
        assertThatThrownBy(() -> YamlConfigLoader.fromMap(Map.of("timeoutMs", "soon")))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("timeoutMs");
        assertThatThrownBy(() -> YamlConfigLoader.fromMap(Map.of("maxRedirects", -1)))
                .isInstanceOf(IllegalArgumentException.class);

        assertThatThrownBy(() -> YamlConfigLoader.load(tmp.resolve("nope.yml")))
                .isInstanceOf(IOException.class).hasMessageContaining("not found");

        Path broken = tmp.resolve("broken.yml");
        Files.writeString(broken, "timeoutMs: [1, 2\n");
        assertThatThrownBy(() -> YamlConfigLoader.load(broken))
                .isInstanceOf(IOException.class).hasMessageContaining("Invalid YAML");
    }

    @Test
    void default_file_is_optional() throws Exception {
        assertThat(YamlConfigLoader.loadDefault(tmp).getMaxRedirects()).isEqualTo(5);

        Files.writeString(tmp.resolve(YamlConfigLoader.DEFAULT_FILE), "maxRedirects: 1\n");
        assertThat(YamlConfigLoader.loadDefault(tmp).getMaxRedirects()).isEqualTo(1);
    }

    @Test
    void zero_or_negative_limits_are_rejected_not_clamped() {
        assertThatThrownBy(() -> YamlConfigLoader.fromMap(Map.of("maxHtmlSizeMb", 0)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> YamlConfigLoader.fromMap(Map.of("concurrency", -2)))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("concurrency");
        assertThatThrownBy(() -> YamlConfigLoader.fromMap(Map.of("timeoutMs", 0)))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("timeout");
    }
}
