package com.metaget.core.util;

import com.metaget.core.model.ExtractorConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.LongConsumer;

/**
 * extractor.yml 을 읽어 ExtractorConfig 로 변환. 호출자가 경로를 명시적으로 넘길 때만 읽는다.
 *
 * 예상 YAML 키:
 * connectTimeoutMs: 10000
 * requestTimeoutMs: 30000
 * followRedirects: true
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static ExtractorConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("extractor.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    public static ExtractorConfig load(InputStream in) {
        Objects.requireNonNull(in, "in");
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(in);

        ExtractorConfig cfg = ExtractorConfig.defaults();
        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            cfg.validate();
            return cfg;
        }

        setMillis(map, "connectTimeoutMs", cfg::setConnectTimeoutMs);
        setMillis(map, "requestTimeoutMs", cfg::setRequestTimeoutMs);
        setBoolean(map, "followRedirects", cfg::setFollowRedirects);

        cfg.validate();
        return cfg;
    }

    // ------------ helpers ------------
    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v).trim()));
    }

    private static void setMillis(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms;
        if (v instanceof Number n) {
            ms = n.longValue();
        } else {
            try {
                ms = Long.parseLong(String.valueOf(v).trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " must be a number of milliseconds: " + v, e);
            }
        }
        if (ms <= 0) throw new IllegalArgumentException(key + " must be > 0");
        setter.accept(ms);
    }
}
