package com.nekopara.core.service;

import com.nekopara.core.api.Template;
import com.nekopara.core.model.DataNode;
import com.nekopara.core.model.NekoparaOptions;
import com.nekopara.core.model.Node;
import com.nekopara.core.model.TaskNode;
import com.nekopara.core.model.TaskState;
import com.nekopara.core.snapshot.SnapshotCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("스냅샷 저장 → 재개")
class NekoparaResumeTest {

    private static final Duration WAIT = Duration.ofSeconds(10);

    private final SnapshotCodec codec = new SnapshotCodec();
    private Nekopara first;
    private Nekopara second;

    @AfterEach
    void tearDown() {
        if (first != null) first.close();
        if (second != null) second.close();
    }

    private static TaskNode task(String template, String url, TaskState st, Node... children) {
        return new TaskNode(template, url, st, List.of(children));
    }

    @Test
    void snapshotSurvivesJsonRoundTrip() throws Exception {
        first = new Nekopara(NekoparaOptions.defaults().setThread(2));
        RecordingListener rec = new RecordingListener();
        first.addListener(rec);
        first.register("list", Template.blocking((url, emit) -> {
            emit.data(Map.of("page", url));
            for (int i = 0; i < 3; i++) emit.task("item", url + "/" + i);
        }));
        first.register("item", Template.blocking((url, emit) -> {
            if (url.endsWith("/1")) throw new IllegalStateException("flaky");
            emit.data(url);
        }));

        first.start("list", "https://ex.com");
        assertThat(rec.awaitDone(WAIT)).isTrue();

        TaskNode snap = first.snapshot();
        TaskNode back = codec.fromJson(codec.toJson(snap));

        assertThat(back).isEqualTo(snap);
        assertThat(((TaskNode) back.children().get(2)).state()).isEqualTo(TaskState.FAIL);
    }

    @Test
    @DisplayName("모든 노드가 done 인 스냅샷 → 실행 없이 done")
    void fullyDoneSnapshotFiresDoneWithoutWork() throws Exception {
        TaskNode done = task("root", "a", TaskState.DONE,
                new DataNode(1),
                task("leaf", "b", TaskState.DONE, new DataNode(2)));

        AtomicInteger runs = new AtomicInteger();
        second = new Nekopara();
        RecordingListener rec = new RecordingListener();
        second.addListener(rec);
        second.register("root", Template.blocking((url, emit) -> runs.incrementAndGet()));
        second.register("leaf", Template.blocking((url, emit) -> runs.incrementAndGet()));

        second.start(done);

        assertThat(rec.awaitDone(WAIT)).isTrue();
        assertThat(runs.get()).isZero();
        assertThat(second.getRuntimeSnapshot().dispatched).isZero();
        assertThat(second.snapshot()).isEqualTo(done);
        assertThat(second.getResults().list()).containsExactly(1, 2);
        assertThat(second.getResults().complete()).isTrue();
    }

    @Test
    @DisplayName("fail 노드 하나만 다시 실행, done 형제는 그대로")
    void resumeRetriesOnlyFailedNode() throws Exception {
        TaskNode snap = task("root", "a", TaskState.DONE,
                new DataNode(1),
                task("leaf", "b", TaskState.DONE, new DataNode(2)),
                task("leaf", "c", TaskState.FAIL));

        List<String> ran = new CopyOnWriteArrayList<>();
        second = new Nekopara();
        RecordingListener rec = new RecordingListener();
        second.addListener(rec);
        second.register("root", Template.blocking((url, emit) -> ran.add(url)));
        second.register("leaf", Template.blocking((url, emit) -> {
            ran.add(url);
            emit.data(url + "!");
            emit.task("deep", url + "/deep");
        }));
        second.register("deep", Template.blocking((url, emit) -> {
            ran.add(url);
            emit.data(3);
        }));

        second.start(snap);

        assertThat(rec.awaitDone(WAIT)).isTrue();
        assertThat(ran).containsExactly("c", "c/deep");
        assertThat(second.getResults().list()).containsExactly(1, 2, "c!", 3);
        assertThat(second.getResults().complete()).isTrue();

        TaskNode after = second.snapshot();
        assertThat(after.children().get(1)).isEqualTo(snap.children().get(1));
        assertThat(((TaskNode) after.children().get(2)).state()).isEqualTo(TaskState.DONE);
    }

    @Test
    void waitingNodesAreDispatchedAgain() throws Exception {
        TaskNode snap = task("root", "a", TaskState.DONE,
                task("leaf", "b", TaskState.WAITING),
                task("leaf", "c", TaskState.WAITING));

        second = new Nekopara(NekoparaOptions.defaults().setThread(2));
        RecordingListener rec = new RecordingListener();
        second.addListener(rec);
        second.register("leaf", Template.blocking((url, emit) -> emit.data(url)));

        second.start(snap);

        assertThat(rec.awaitDone(WAIT)).isTrue();
        assertThat(second.getResults().list()).containsExactly("b", "c");
        assertThat(second.getRuntimeSnapshot().dispatched).isEqualTo(2);
    }

    @Test
    void restoredUrlsStayDeduplicated() throws Exception {
        TaskNode snap = task("root", "a", TaskState.DONE,
                task("leaf", "b", TaskState.DONE),
                task("leaf", "c", TaskState.FAIL));

        Map<String, AtomicInteger> runs = new ConcurrentHashMap<>();
        second = new Nekopara();
        RecordingListener rec = new RecordingListener();
        second.addListener(rec);
        second.register("leaf", Template.blocking((url, emit) -> {
            runs.computeIfAbsent(url, k -> new AtomicInteger()).incrementAndGet();
            emit.task("leaf", "a");
            emit.task("leaf", "b");
            emit.task("leaf", "d");
        }));

        second.start(snap);

        assertThat(rec.awaitDone(WAIT)).isTrue();
        assertThat(runs.keySet()).containsExactlyInAnyOrder("c", "d");
        TaskNode c = (TaskNode) second.snapshot().children().get(1);
        assertThat(c.children()).hasSize(1);
        assertThat(((TaskNode) c.children().get(0)).url()).isEqualTo("d");
    }

    @Test
    void resumeWorksAcrossInstancesAfterFailure() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        Template flaky = Template.blocking((url, emit) -> {
            if (attempts.incrementAndGet() == 1) throw new IllegalStateException("timeout");
            emit.data("ok");
        });

        first = new Nekopara();
        RecordingListener r1 = new RecordingListener();
        first.addListener(r1);
        first.register("page", flaky);
        first.start("page", "u");
        assertThat(r1.awaitDone(WAIT)).isTrue();
        assertThat(first.getResults().complete()).isFalse();

        String saved = codec.toJson(first.snapshot());

        second = new Nekopara();
        RecordingListener r2 = new RecordingListener();
        second.addListener(r2);
        second.register("page", flaky);
        second.start(codec.fromJson(saved));

        assertThat(r2.awaitDone(WAIT)).isTrue();
        assertThat(second.getResults().list()).containsExactly("ok");
        assertThat(second.getResults().complete()).isTrue();
    }

    @Test
    void inputSnapshotIsCopied() throws Exception {
        TaskNode snap = task("leaf", "a", TaskState.FAIL);

        second = new Nekopara();
        RecordingListener rec = new RecordingListener();
        second.addListener(rec);
        second.register("leaf", Template.blocking((url, emit) -> emit.data("x")));
        second.start(snap);
        assertThat(rec.awaitDone(WAIT)).isTrue();

        assertThat(snap.state()).isEqualTo(TaskState.FAIL);
        assertThat(snap.children()).isEmpty();
        assertThat(second.snapshot().children()).hasSize(1);
    }

    @Test
    void rejectsSnapshotWithChildrenUnderUnfinishedNode() {
        TaskNode broken = task("root", "a", TaskState.DONE,
                task("leaf", "b", TaskState.WAITING, new DataNode("partial")));

        second = new Nekopara();

        assertThatThrownBy(() -> second.start(broken))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("already has children");
        assertThat(second.isStarted()).isFalse();
    }
}
