// core/src/main/java/com/nekopara/core/service/Nekopara.java
package com.nekopara.core.service;

import com.nekopara.core.api.CrawlListener;
import com.nekopara.core.api.Emit;
import com.nekopara.core.api.Emitter;
import com.nekopara.core.api.Template;
import com.nekopara.core.dedupe.UrlRegistry;
import com.nekopara.core.model.CrawlResults;
import com.nekopara.core.model.CrawlStats;
import com.nekopara.core.model.DataNode;
import com.nekopara.core.model.NekoparaOptions;
import com.nekopara.core.model.TaskNode;
import com.nekopara.core.model.TaskState;
import com.nekopara.core.snapshot.SnapshotCodec;
import com.nekopara.core.tree.TreeWalker;
import com.nekopara.core.util.DelayGate;
import com.nekopara.core.util.NamedThreadFactory;
import com.nekopara.core.util.StructuredLog;
import com.nekopara.core.util.TaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * 재개 가능한 크롤 스케줄러.
 *  - 템플릿 등록 → start(template, url) 또는 start(snapshot)
 *  - 각 태스크: stop 확인 → 템플릿 조회 → DelayGate 대기 → 템플릿 실행 → emit 버퍼를 한 번에 커밋
 *  - 동시 실행은 TaskQueue(thread) 로 제한, 큐가 비면 done 이벤트
 *  - snapshot() 은 언제든 일관된 트리 복사본을 돌려준다 (children 은 전부 아니면 전무)
 *
 * 인스턴스마다 독립: 템플릿 맵, URL 집합, stop 플래그 모두 인스턴스 필드.
 */
public final class Nekopara implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(Nekopara.class);

    private final NekoparaOptions options;
    private final Map<String, Template> templates = new ConcurrentHashMap<>();
    private final List<CrawlListener> listeners = new CopyOnWriteArrayList<>();
    private final UrlRegistry urls;
    private final ExecutorService workers;
    private final TaskQueue taskQueue;
    private final DelayGate delayGate;
    private final ExecutorService events;
    private final SnapshotCodec codec = new SnapshotCodec();
    private final CrawlStats stats = new CrawlStats();
    private final StructuredLog slog;

    // 트리와 노드 상태는 treeLock 아래에서만 읽고 쓴다
    private final Object treeLock = new Object();
    private TaskNode crawlTree;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean doneFired = new AtomicBoolean(false);
    private volatile boolean stopped;

    public Nekopara() {
        this(NekoparaOptions.defaults());
    }

    public Nekopara(NekoparaOptions options) {
        Objects.requireNonNull(options, "options");
        this.options = options.copy();
        this.options.validate();

        int thread = this.options.getThread();
        this.urls = new UrlRegistry(this.options.isDistinct());
        this.workers = Executors.newFixedThreadPool(thread, new NamedThreadFactory("nekopara-worker"));
        this.taskQueue = new TaskQueue(thread, workers);
        this.taskQueue.onEmpty(this::onIdle);
        this.delayGate = new DelayGate(this.options.getInterval());
        this.events = Executors.newSingleThreadExecutor(new NamedThreadFactory("nekopara-events"));
        this.slog = StructuredLog.get(Nekopara.class)
                .withContext("run", Integer.toHexString(System.identityHashCode(this)));
    }

    /* =========================
       공개 API
       ========================= */

    /** 템플릿 등록. 같은 이름은 다시 등록할 수 없다. */
    public void register(String template, Template fn) {
        requireText(template, "template");
        Objects.requireNonNull(fn, "fn");
        if (templates.putIfAbsent(template, fn) != null) {
            throw new IllegalArgumentException("Template '" + template + "' has been registered");
        }
        LOG.debug("Template registered: {}", template);
    }

    public void addListener(CrawlListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(CrawlListener listener) {
        listeners.remove(listener);
    }

    /**
     * 입구 페이지에서 새 크롤을 시작한다. 인스턴스당 start 는 한 번만.
     * @throws IllegalStateException 이미 start 된 경우
     */
    public void start(String template, String url) {
        requireText(template, "template");
        requireText(url, "url");
        markStarted();

        LOG.info("Crawl start: template={}, url={}, {}", template, url, options);
        slog.info("run-start",
                "template", template,
                "url", url,
                "threads", options.getThread(),
                "intervalMs", options.getIntervalMs(),
                "distinct", options.isDistinct());

        // 부모 없는 커밋 = 루트 생성
        commit(null, List.of(Emit.task(template, url)));
    }

    /**
     * 저장한 스냅샷에서 이어서 크롤한다. waiting/fail 노드는 waiting 으로 되돌려 다시 실행한다.
     * 모든 노드가 done 이면 아무 작업 없이 done 이벤트만 (비동기로) 발생.
     */
    public void start(TaskNode snapshot) {
        if (snapshot == null) throw new IllegalArgumentException("snapshot must not be null");
        TaskNode tree = codec.copy(snapshot);
        validateResumable(tree);
        markStarted();

        List<TaskNode> retry = new ArrayList<>();
        synchronized (treeLock) {
            crawlTree = tree;
            TreeWalker.preOrder(tree, node -> {
                if (node instanceof TaskNode t) {
                    urls.record(t.url());
                    if (!t.isDone()) {
                        t.setState(TaskState.WAITING);
                        retry.add(t);
                    }
                }
            });
            for (TaskNode t : retry) dispatch(t);
        }

        LOG.info("Crawl resume: pending={}, knownUrls={}, {}", retry.size(), urls.size(), options);
        slog.info("run-resume", "pending", retry.size(), "knownUrls", urls.size());

        if (retry.isEmpty()) {
            onDone();
        }
    }

    /** 현재 트리의 데이터 목록과 완료 여부. 실행 중에도 호출 가능 */
    public CrawlResults getResults() {
        synchronized (treeLock) {
            return TreeWalker.collect(crawlTree);
        }
    }

    /** 현재 트리의 깊은 복사본. 시작 전이면 null */
    public TaskNode snapshot() {
        synchronized (treeLock) {
            return codec.copy(crawlTree);
        }
    }

    /**
     * 크롤 중단. 대기 중인 태스크는 실행되지 않고, 실행 중인 템플릿은 끝까지 돌아 커밋된다.
     * 이후 done 이벤트는 발생하지 않는다.
     */
    public void stop() {
        if (stopped) return;
        stopped = true;
        LOG.info("Crawl stop requested: inFlight={}, queued={}", taskQueue.runningCount(), taskQueue.pendingCount());
        slog.info("run-stop", "inFlight", taskQueue.runningCount(), "queued", taskQueue.pendingCount());
    }

    /** 워커 풀이 빌 때까지 대기. stop 된 실행에도 쓸 수 있다. */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        return taskQueue.awaitIdle(timeout);
    }

    public boolean isStarted() { return started.get(); }

    public boolean isStopped() { return stopped; }

    public NekoparaOptions getOptions() { return options.copy(); }

    public CrawlStats.Snapshot getRuntimeSnapshot() { return stats.snapshot(); }

    @Override
    public void close() {
        stop();
        taskQueue.shutdown();
        workers.shutdownNow();
        delayGate.close();
        events.shutdown();
    }

    /* =========================
       디스패치 & 커밋
       ========================= */

    private void dispatch(TaskNode node) {
        stats.onDispatched();
        LOG.debug("Dispatch: template={}, url={}", node.template(), node.url());
        taskQueue.add(() -> runTask(node));
    }

    private CompletionStage<?> runTask(TaskNode node) {
        if (stopped) {
            // stop 이후: 상태 변화 없이 버림
            stats.onSkipped();
            return null;
        }

        Template fn = templates.get(node.template());
        if (fn == null) {
            fail(node, new TemplateNotFoundException(node.template()));
            return null;
        }

        return delayGate.acquire()
                .thenComposeAsync(v -> invoke(fn, node), workers)
                .handle((calls, err) -> {
                    if (err != null && unwrap(err) instanceof CancellationException && delayGate.isClosed()) {
                        // close 로 게이트가 닫힘: 실행 전이므로 waiting 유지
                        stats.onSkipped();
                    } else if (err != null) {
                        fail(node, unwrap(err));
                    } else {
                        commit(node, calls);
                    }
                    return null;
                });
    }

    /** 템플릿 실행. 성공 시 버퍼링된 emit 목록으로 완료 */
    private CompletionStage<List<Emit>> invoke(Template fn, TaskNode node) {
        BufferedEmitter emitter = new BufferedEmitter(node);
        stats.enter();
        CompletionStage<?> stage;
        try {
            stage = fn.run(node.url(), emitter);
        } catch (Throwable t) {
            // Error 포함: 카운터와 emitter 는 항상 정리
            stats.leave();
            emitter.close();
            return CompletableFuture.failedFuture(t);
        }
        if (stage == null) stage = CompletableFuture.completedFuture(null);

        return stage.handle((r, e) -> {
            stats.leave();
            List<Emit> calls = emitter.close();
            if (e != null) throw new CompletionException(unwrap(e));
            return calls;
        });
    }

    /**
     * emit 버퍼를 호출 순서대로 트리에 반영. 락 안에서 한 번에 끝나므로 외부에서는 중간 상태가 보이지 않는다.
     * parent 가 null 이면 입구 커밋(루트 생성).
     */
    private void commit(TaskNode parent, List<Emit> calls) {
        int data = 0, tasks = 0, dup = 0;
        synchronized (treeLock) {
            for (Emit e : calls) {
                if (e instanceof Emit.Data d) {
                    if (parent == null) {
                        throw new IllegalStateException("Entry commit cannot carry data");
                    }
                    parent.addChild(new DataNode(d.payload()));
                    stats.onData();
                    data++;
                    Object payload = d.payload();
                    fire(l -> l.onData(payload));
                } else if (e instanceof Emit.Task t) {
                    if (!urls.admit(t.url())) {
                        stats.onDedupHit();
                        dup++;
                        continue;
                    }
                    TaskNode child = new TaskNode(t.template(), t.url());
                    if (parent == null) {
                        crawlTree = child;
                    } else {
                        parent.addChild(child);
                    }
                    tasks++;
                    dispatch(child);
                }
            }
            if (parent != null) parent.setState(TaskState.DONE);
        }

        if (parent != null) {
            stats.onDone();
            LOG.debug("Done {} -> data={}, tasks={}, dedup={}", parent.url(), data, tasks, dup);
            slog.debug("task-done",
                    "template", parent.template(),
                    "url", parent.url(),
                    "data", data,
                    "tasks", tasks,
                    "dedup", dup);
        }
    }

    private void fail(TaskNode node, Throwable err) {
        synchronized (treeLock) {
            node.setState(TaskState.FAIL);
        }
        stats.onFailed();
        LOG.warn("Task failed: template={}, url={}, cause={}", node.template(), node.url(), err.toString());
        slog.warn("task-fail",
                "template", node.template(),
                "url", node.url(),
                "error", err.getClass().getSimpleName(),
                "message", err.getMessage());
        fire(l -> l.onFail(node.template(), node.url(), err));
    }

    /* =========================
       이벤트
       ========================= */

    private void onIdle() {
        onDone();
    }

    private void onDone() {
        if (stopped) return;
        if (!doneFired.compareAndSet(false, true)) return;

        var rt = stats.snapshot();
        LOG.info("Crawl done. dispatched={}, done={}, failed={}, data={}, maxObservedCC={}",
                rt.dispatched, rt.done, rt.failed, rt.dataNodes, rt.maxObservedConcurrency);
        slog.info("run-done",
                "dispatched", rt.dispatched,
                "done", rt.done,
                "failed", rt.failed,
                "data", rt.dataNodes,
                "maxObservedCC", rt.maxObservedConcurrency);
        fire(CrawlListener::onDone);
    }

    /** 이벤트 스레드에서 비동기로 전달. 리스너 예외는 실행에 영향 없음 */
    private void fire(Consumer<CrawlListener> call) {
        try {
            events.execute(() -> {
                for (CrawlListener l : listeners) {
                    try {
                        call.accept(l);
                    } catch (RuntimeException e) {
                        LOG.error("Listener failed", e);
                        slog.error("listener-failed", e);
                    }
                }
            });
        } catch (RejectedExecutionException e) {
            LOG.debug("Event dropped after close: {}", e.toString());
        }
    }

    /* =========================
       유틸
       ========================= */

    private void markStarted() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Cannot call start again");
        }
    }

    /** waiting/fail 노드가 자식을 갖고 있으면 재실행 시 자식이 중복되므로 거부 */
    private static void validateResumable(TaskNode tree) {
        TreeWalker.preOrder(tree, node -> {
            if (node instanceof TaskNode t && !t.isDone() && !t.children().isEmpty()) {
                throw new IllegalArgumentException("Task node " + t.url() + " is "
                        + t.state().wireName() + " but already has children");
            }
        });
    }

    private static void requireText(String s, String name) {
        Objects.requireNonNull(s, name);
        if (s.isBlank()) throw new IllegalArgumentException(name + " must not be blank");
    }

    static Throwable unwrap(Throwable t) {
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    /** 실행 한 번 동안의 emit 버퍼. 템플릿 종료 후 호출은 버린다 */
    private static final class BufferedEmitter implements Emitter {
        private final TaskNode owner;
        private final List<Emit> calls = new ArrayList<>();
        private boolean closed;

        BufferedEmitter(TaskNode owner) { this.owner = owner; }

        @Override
        public synchronized void emit(Emit e) {
            Objects.requireNonNull(e, "emit");
            if (closed) {
                LOG.warn("Emit after template settled is ignored: url={}, emit={}", owner.url(), e);
                return;
            }
            calls.add(e);
        }

        synchronized List<Emit> close() {
            closed = true;
            return List.copyOf(calls);
        }
    }
}
