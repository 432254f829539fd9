package com.nekopara.core.api;

/**
 * 스케줄러 이벤트 구독자. 모든 콜백은 전용 이벤트 스레드에서 비동기로 호출된다.
 */
public interface CrawlListener {

    /** 데이터 노드가 커밋될 때마다 */
    default void onData(Object payload) {}

    /** 태스크 노드가 FAIL 로 바뀔 때마다 */
    default void onFail(String template, String url, Throwable error) {}

    /** 워커 풀이 비었을 때, 실행당 최대 한 번. stop() 이후에는 호출되지 않는다. */
    default void onDone() {}

    CrawlListener NONE = new CrawlListener() {};
}
