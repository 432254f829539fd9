package com.nekopara.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 런타임 텔레메트리 누적기 (스레드 세이프). */
public final class CrawlStats {
    private final AtomicLong dispatched = new AtomicLong(0);   // 워커 풀에 제출된 태스크 수
    private final AtomicLong done = new AtomicLong(0);
    private final AtomicLong failed = new AtomicLong(0);
    private final AtomicLong skipped = new AtomicLong(0);      // stop 이후 버려진 태스크
    private final AtomicLong dedupHits = new AtomicLong(0);
    private final AtomicLong dataNodes = new AtomicLong(0);
    private final AtomicInteger inFlight = new AtomicInteger(0);
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    public void onDispatched() { dispatched.incrementAndGet(); }
    public void onDone() { done.incrementAndGet(); }
    public void onFailed() { failed.incrementAndGet(); }
    public void onSkipped() { skipped.incrementAndGet(); }
    public void onDedupHit() { dedupHits.incrementAndGet(); }
    public void onData() { dataNodes.incrementAndGet(); }

    /** 템플릿 실행 진입. 현재 실행 수를 관측해 최대값 갱신 */
    public void enter() {
        int cur = inFlight.incrementAndGet();
        maxObservedConcurrency.accumulateAndGet(cur, Math::max);
    }

    public void leave() { inFlight.decrementAndGet(); }

    public Snapshot snapshot() {
        return new Snapshot(dispatched.get(), done.get(), failed.get(), skipped.get(),
                dedupHits.get(), dataNodes.get(), maxObservedConcurrency.get());
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final long dispatched;
        public final long done;
        public final long failed;
        public final long skipped;
        public final long dedupHits;
        public final long dataNodes;
        public final int  maxObservedConcurrency;
        public Snapshot(long dispatched, long done, long failed, long skipped,
                        long dedupHits, long dataNodes, int maxCC) {
            this.dispatched = dispatched;
            this.done = done;
            this.failed = failed;
            this.skipped = skipped;
            this.dedupHits = dedupHits;
            this.dataNodes = dataNodes;
            this.maxObservedConcurrency = maxCC;
        }
    }
}
