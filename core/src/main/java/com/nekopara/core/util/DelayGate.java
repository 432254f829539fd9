package com.nekopara.core.util;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 실행 간격 게이트.
 * acquire() 로 받은 future 들은 호출 순서(FIFO)대로, 서로 최소 interval 간격을 두고 완료된다.
 *
 * 동시성 1 짜리 전용 큐에 (즉시 통과, interval 대기) 두 단계를 넣는 방식이라
 * 워커 풀 슬롯을 얼마나 오래 잡든 게이트 순서에는 영향이 없다.
 * interval=0 이면 순서만 보장한다.
 * close() 하면 아직 열리지 않은 future 는 취소되고, 이후 acquire 는 취소된 future 를 돌려준다.
 */
public final class DelayGate implements AutoCloseable {

    private final long intervalMs;
    private final ScheduledExecutorService timer;
    private final TaskQueue serial;
    private final Set<CompletableFuture<Void>> waiting = ConcurrentHashMap.newKeySet();
    private boolean closed;

    public DelayGate(Duration interval) {
        Objects.requireNonNull(interval, "interval");
        if (interval.isNegative()) throw new IllegalArgumentException("interval must be >= 0");
        this.intervalMs = interval.toMillis();
        ScheduledThreadPoolExecutor stpe = new ScheduledThreadPoolExecutor(1, new NamedThreadFactory("nekopara-gate"));
        stpe.setRemoveOnCancelPolicy(true);
        this.timer = stpe;
        this.serial = new TaskQueue(1, timer);
    }

    /** 내 차례가 되면 완료되는 future */
    public CompletableFuture<Void> acquire() {
        CompletableFuture<Void> turn = new CompletableFuture<>();
        // 두 단계가 다른 acquire 와 섞이지 않도록
        synchronized (this) {
            if (closed) {
                turn.cancel(false);
                return turn;
            }
            waiting.add(turn);
            serial.add(() -> {
                waiting.remove(turn);
                turn.complete(null);
                return null;
            });
            serial.add(this::pause);
        }
        return turn;
    }

    public long intervalMs() { return intervalMs; }

    private CompletableFuture<Void> pause() {
        if (intervalMs <= 0) return CompletableFuture.completedFuture(null);
        CompletableFuture<Void> f = new CompletableFuture<>();
        timer.schedule(() -> f.complete(null), intervalMs, TimeUnit.MILLISECONDS);
        return f;
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) return;
            closed = true;
        }
        serial.shutdown();
        timer.shutdownNow();
        for (CompletableFuture<Void> turn : waiting) {
            turn.cancel(false);
        }
        waiting.clear();
    }

    public synchronized boolean isClosed() { return closed; }
}
