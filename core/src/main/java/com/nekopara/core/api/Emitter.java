package com.nekopara.core.api;

/**
 * 템플릿에 주입되는 수집 핸들.
 * 호출은 즉시 트리에 반영되지 않고 버퍼링되며, 템플릿이 성공으로 끝난 뒤 호출 순서대로 한 번에 커밋된다.
 * 템플릿이 끝난 뒤의 호출은 버려진다.
 */
@FunctionalInterface
public interface Emitter {

    void emit(Emit e);

    default void data(Object payload) { emit(Emit.data(payload)); }

    default void task(String template, String url) { emit(Emit.task(template, url)); }
}
