package com.nekopara.core.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON 라인 기반 구조화 로거 (java.util.logging 출력).
 * withContext 로 고정 필드(예: 실행 id)를 붙인 인스턴스를 만들 수 있다.
 */
public final class StructuredLog {

    private static final ObjectMapper OM = new ObjectMapper();

    /** 라인마다 자동으로 붙는 필드. 같은 이름의 kv 는 kv_ 접두어로 옮겨 적는다 */
    static final Set<String> BUILT_IN = Set.of("ts", "lvl", "comp", "thread", "event");

    private final Logger jul;
    private final String comp;
    private final Map<String, Object> context;

    private StructuredLog(Logger jul, String comp, Map<String, Object> context) {
        this.jul = jul;
        this.comp = comp;
        this.context = context;
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(Logger.getLogger(cls.getName()), cls.getSimpleName(), Map.of());
    }

    /** 모든 라인에 key=value 를 추가한 새 인스턴스 */
    public StructuredLog withContext(String key, Object value) {
        Map<String, Object> ctx = new LinkedHashMap<>(context);
        ctx.put(key, value);
        return new StructuredLog(jul, comp, ctx);
    }

    public void debug(String event, Object... kvs) { log(Level.FINE,    event, null, kvs); }
    public void info (String event, Object... kvs) { log(Level.INFO,    event, null, kvs); }
    public void warn (String event, Object... kvs) { log(Level.WARNING, event, null, kvs); }
    public void error(String event, Throwable t, Object... kvs) { log(Level.SEVERE, event, t, kvs); }

    private void log(Level lvl, String event, Throwable t, Object... kvs) {
        if (!jul.isLoggable(lvl)) return;
        String line = buildJson(lvl, event, t, kvs);
        if (t == null) jul.log(lvl, line); else jul.log(lvl, line, t);
    }

    String buildJson(Level lvl, String event, Throwable t, Object... kvs) {
        ObjectNode n = OM.createObjectNode();
        n.put("ts", Instant.now().toString());
        n.put("lvl", lvl.getName());
        n.put("comp", comp);
        n.put("thread", Thread.currentThread().getName());
        n.put("event", event);
        context.forEach((k, v) -> put(n, k, v));

        // kvs: "key", value, ...
        if (kvs != null && kvs.length > 0) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                put(n, String.valueOf(kvs[i]), kvs[i + 1]);
            }
            if (kvs.length % 2 == 1) n.put("_kv_mismatch", true);
        }
        if (t != null) {
            n.put("error", t.getClass().getSimpleName());
            n.put("message", t.getMessage());
        }
        return n.toString();
    }

    private static void put(ObjectNode n, String k, Object v) {
        if (BUILT_IN.contains(k)) k = "kv_" + k;
        if (v == null) n.putNull(k);
        else if (v instanceof Integer i) n.put(k, i);
        else if (v instanceof Long l) n.put(k, l);
        else if (v instanceof Double d) n.put(k, d);
        else if (v instanceof Boolean b) n.put(k, b);
        else n.put(k, String.valueOf(v));
    }
}
