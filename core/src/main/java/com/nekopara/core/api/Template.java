package com.nekopara.core.api;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * 크롤 템플릿. 해당 템플릿을 쓰는 태스크가 실행될 때 url 과 emitter 를 받아 호출된다.
 *
 * 반환한 stage 가 정상 완료되면 성공, 예외 완료(또는 run 자체의 throw)면 실패.
 * null 반환은 즉시 성공으로 본다. emitter 는 stage 가 끝나기 전까지만 유효하다.
 */
@FunctionalInterface
public interface Template {

    CompletionStage<?> run(String url, Emitter emitter) throws Exception;

    /** 동기 본문용 */
    @FunctionalInterface
    interface Blocking {
        void run(String url, Emitter emitter) throws Exception;
    }

    /** 워커 스레드에서 그대로 실행되는 동기 템플릿을 감싼다. */
    static Template blocking(Blocking body) {
        return (url, emitter) -> {
            body.run(url, emitter);
            return CompletableFuture.completedFuture(null);
        };
    }
}
