package com.nekopara.core.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 동시 실행 수 제한 큐.
 * - 비동기 작업(Job)을 제출 순서대로 시작하되, 반환한 stage 가 끝나기 전까지 슬롯을 점유
 * - 동시에 점유된 슬롯은 최대 concurrency 개
 * - 대기/실행 중인 작업이 모두 없어지는 순간 onEmpty 리스너 호출
 *
 * 스레드를 직접 막지 않으므로 슬롯 수와 executor 의 스레드 수는 독립적이다.
 */
public final class TaskQueue {

    private static final Logger LOG = LoggerFactory.getLogger(TaskQueue.class);

    /** 큐에 들어가는 작업. 반환한 stage 가 끝날 때 슬롯 반납 (null 이면 즉시 반납) */
    @FunctionalInterface
    public interface Job {
        CompletionStage<?> start() throws Exception;
    }

    private final int concurrency;
    private final Executor executor;
    private final Deque<Job> pending = new ArrayDeque<>();
    private final List<Runnable> emptyListeners = new CopyOnWriteArrayList<>();
    private int running;
    private boolean shutdown;

    public TaskQueue(int concurrency, Executor executor) {
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");
        this.concurrency = concurrency;
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public void add(Job job) {
        Objects.requireNonNull(job, "job");
        synchronized (this) {
            if (shutdown) {
                LOG.debug("Job added after shutdown, dropping");
                return;
            }
            pending.addLast(job);
        }
        drain();
    }

    /**
     * 대기 중인 작업을 버리고 이후 add 는 무시한다. 실행 중인 작업은 그대로 끝난다.
     * executor 를 내리기 전에 불러야 거절 경고가 나지 않는다.
     * @return 버려진 대기 작업 수
     */
    public int shutdown() {
        synchronized (this) {
            shutdown = true;
            int dropped = pending.size();
            pending.clear();
            notifyAll();
            return dropped;
        }
    }

    public synchronized boolean isShutdown() { return shutdown; }

    /** 큐가 빌 때마다 호출된다. 호출 스레드는 마지막 작업을 끝낸 스레드. */
    public void onEmpty(Runnable listener) {
        emptyListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public synchronized boolean isIdle() {
        return running == 0 && pending.isEmpty();
    }

    public synchronized int runningCount() { return running; }

    public synchronized int pendingCount() { return pending.size(); }

    public int concurrency() { return concurrency; }

    /** 큐가 빌 때까지 대기. 시간 안에 비면 true */
    public synchronized boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!(running == 0 && pending.isEmpty())) {
            long leftMs = (deadline - System.nanoTime()) / 1_000_000L;
            if (leftMs <= 0) return false;
            wait(leftMs);
        }
        return true;
    }

    private void drain() {
        List<Job> toStart = new ArrayList<>();
        synchronized (this) {
            while (!shutdown && running < concurrency && !pending.isEmpty()) {
                running++;
                toStart.add(pending.pollFirst());
            }
        }
        for (Job job : toStart) {
            try {
                executor.execute(() -> runJob(job));
            } catch (RejectedExecutionException e) {
                if (isShutdown()) LOG.debug("Job rejected after shutdown: {}", e.toString());
                else LOG.warn("Job rejected by executor, dropping: {}", e.toString());
                release();
            }
        }
    }

    private void runJob(Job job) {
        CompletionStage<?> stage;
        try {
            stage = job.start();
        } catch (Throwable t) {
            stage = CompletableFuture.failedFuture(t);
        }
        if (stage == null) {
            release();
            return;
        }
        stage.whenComplete((r, e) -> {
            if (e != null) LOG.debug("Job completed exceptionally: {}", e.toString());
            release();
        });
    }

    private void release() {
        boolean empty;
        synchronized (this) {
            running--;
            empty = running == 0 && pending.isEmpty();
            if (empty) notifyAll();
        }
        if (empty) {
            for (Runnable l : emptyListeners) {
                try {
                    l.run();
                } catch (RuntimeException e) {
                    LOG.error("Empty listener failed", e);
                }
            }
        } else {
            drain();
        }
    }
}
