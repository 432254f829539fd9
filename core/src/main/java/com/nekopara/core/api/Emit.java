package com.nekopara.core.api;

import java.util.Objects;

/**
 * 템플릿이 Emitter 로 넘기는 값: 데이터 하나 또는 새 크롤 태스크 하나.
 */
public sealed interface Emit permits Emit.Data, Emit.Task {

    /** 데이터 노드가 될 payload (null 허용) */
    record Data(Object payload) implements Emit {}

    /** 태스크 노드가 될 (template, url) */
    record Task(String template, String url) implements Emit {
        public Task {
            Objects.requireNonNull(template, "template");
            Objects.requireNonNull(url, "url");
        }
    }

    static Emit data(Object payload) { return new Data(payload); }

    static Emit task(String template, String url) { return new Task(template, url); }
}
