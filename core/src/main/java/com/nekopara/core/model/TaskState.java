package com.nekopara.core.model;

import java.util.Locale;

/**
 * 태스크 노드 상태.
 * - WAITING : 실행 대기(또는 실행 중). children 비어 있음
 * - DONE    : 템플릿 성공. children 확정, 이후 불변
 * - FAIL    : 템플릿 실패. children 비어 있음 (재개 시 재시도 대상)
 */
public enum TaskState {
    WAITING, DONE, FAIL;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TaskState fromWire(String s) {
        if (s != null) {
            for (TaskState st : values()) {
                if (st.wireName().equals(s)) return st;
            }
        }
        throw new IllegalArgumentException("Unknown task state: " + s);
    }
}
