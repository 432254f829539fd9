package com.nekopara.core.dedupe;

import java.util.HashSet;
import java.util.Set;

/**
 * 이미 태스크로 받아들인 URL 집합.
 * - distinct=false 면 항상 허용
 * - 제거 없음: 한 실행 동안 단조 증가
 * 호출 측(커밋 단계)이 락을 잡은 상태에서 쓰지만, 단독 사용도 안전하도록 동기화.
 */
public final class UrlRegistry {

    private final boolean distinct;
    private final Set<String> seen = new HashSet<>();

    public UrlRegistry(boolean distinct) {
        this.distinct = distinct;
    }

    /** 확인과 기록을 한 번에. 새 태스크 노드를 만들어야 하면 true */
    public synchronized boolean admit(String url) {
        boolean fresh = seen.add(url);
        return !distinct || fresh;
    }

    /** 재개 시 기존 트리의 URL 을 다시 기록 */
    public synchronized void record(String url) {
        seen.add(url);
    }

    public synchronized boolean contains(String url) {
        return seen.contains(url);
    }

    public synchronized int size() {
        return seen.size();
    }

    public boolean isDistinct() {
        return distinct;
    }
}
