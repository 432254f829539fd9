package com.nekopara.core.model;

import java.util.Locale;

/** 크롤 트리 노드 종류. 스냅샷의 `kind` 필드 값과 1:1 대응 */
public enum NodeKind {
    TASK, DATA;

    /** 스냅샷 포맷상의 이름("task" | "data") */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static NodeKind fromWire(String s) {
        if (s != null) {
            for (NodeKind k : values()) {
                if (k.wireName().equals(s)) return k;
            }
        }
        throw new IllegalArgumentException("Unknown node kind: " + s);
    }
}
