package com.nekopara.core.util;

import com.nekopara.core.model.NekoparaOptions;
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
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * nekopara.yml 을 읽어 NekoparaOptions 로 변환.
 *
 * 예상 YAML 키:
 * thread: 4
 * intervalMs: 500
 * distinct: true
 */
public final class YamlOptionsLoader {

    public static final String DEFAULT_FILE = "nekopara.yml";

    private YamlOptionsLoader() {}

    public static NekoparaOptions loadDefault() throws IOException {
        return load(Path.of(DEFAULT_FILE));
    }

    public static NekoparaOptions load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException(DEFAULT_FILE + " not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    public static NekoparaOptions load(InputStream in) {
        Objects.requireNonNull(in, "in");
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(in);

        NekoparaOptions opts = NekoparaOptions.defaults();
        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            opts.validate();
            return opts;
        }

        setInt(map, "thread", opts::setThread);
        setLong(map, "intervalMs", opts::setIntervalMs);
        setBoolean(map, "distinct", opts::setDistinct);

        opts.validate();
        return opts;
    }

    // ------------ helpers ------------
    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v == null) return;
        if (v instanceof Boolean b) {
            setter.accept(b);
            return;
        }
        String s = String.valueOf(v).trim();
        if (!s.equalsIgnoreCase("true") && !s.equalsIgnoreCase("false")) {
            throw new IllegalArgumentException(key + " must be a boolean: " + s);
        }
        setter.accept(Boolean.parseBoolean(s));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }
}
