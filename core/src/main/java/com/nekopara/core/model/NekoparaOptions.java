package com.nekopara.core.model;

import java.time.Duration;
import java.util.Objects;

/**
 * 스케줄러 설정 (nekopara.yml 매핑 대상).
 *
 * thread   : 동시에 실행되는 태스크 수 (기본 1)
 * interval : 인접한 태스크 실행 사이 최소 간격 (기본 0)
 * distinct : URL 기준 중복 제거 (기본 true)
 */
public final class NekoparaOptions {

    private int thread = 1;
    private Duration interval = Duration.ZERO;
    private boolean distinct = true;

    public static NekoparaOptions defaults() { return new NekoparaOptions(); }

    // ---------- getters ----------
    public int getThread() { return thread; }
    public Duration getInterval() { return interval; }
    public long getIntervalMs() { return interval.toMillis(); }
    public boolean isDistinct() { return distinct; }

    // ---------- fluent setters ----------
    public NekoparaOptions setThread(int thread) { this.thread = Math.max(1, thread); return this; }
    public NekoparaOptions setInterval(Duration interval) { this.interval = interval; return this; }
    public NekoparaOptions setIntervalMs(long ms) { this.interval = Duration.ofMillis(ms); return this; }
    public NekoparaOptions setDistinct(boolean distinct) { this.distinct = distinct; return this; }

    public NekoparaOptions copy() {
        return new NekoparaOptions()
                .setThread(thread)
                .setInterval(interval)
                .setDistinct(distinct);
    }

    public void validate() {
        if (thread < 1) throw new IllegalArgumentException("thread must be >= 1");
        Objects.requireNonNull(interval, "interval");
        if (interval.isNegative()) throw new IllegalArgumentException("interval must be >= 0");
    }

    @Override
    public String toString() {
        return "NekoparaOptions{thread=" + thread + ", intervalMs=" + getIntervalMs() + ", distinct=" + distinct + "}";
    }
}
