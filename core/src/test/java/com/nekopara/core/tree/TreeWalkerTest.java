package com.nekopara.core.tree;

import com.nekopara.core.model.CrawlResults;
import com.nekopara.core.model.DataNode;
import com.nekopara.core.model.Node;
import com.nekopara.core.model.TaskNode;
import com.nekopara.core.model.TaskState;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TreeWalkerTest {

    private static TaskNode task(String url, TaskState st, Node... children) {
        return new TaskNode("t", url, st, List.of(children));
    }

    @Test
    void visitsPreOrderLeftToRight() {
        TaskNode root = task("a", TaskState.DONE,
                new DataNode(1),
                task("b", TaskState.DONE, new DataNode(2), task("d", TaskState.DONE, new DataNode(3))),
                new DataNode(4),
                task("c", TaskState.DONE, new DataNode(5)));

        List<String> order = new ArrayList<>();
        TreeWalker.preOrder(root, n -> order.add(
                n instanceof TaskNode t ? t.url() : String.valueOf(((DataNode) n).data())));

        assertThat(order).containsExactly("a", "1", "b", "2", "d", "3", "4", "c", "5");
    }

    @Test
    void collectGathersPayloadsAndCompletion() {
        TaskNode root = task("a", TaskState.DONE,
                new DataNode("x"),
                task("b", TaskState.DONE, new DataNode("y")));

        CrawlResults r = TreeWalker.collect(root);
        assertThat(r.list()).containsExactly("x", "y");
        assertThat(r.complete()).isTrue();
    }

    @Test
    void anyWaitingOrFailedTaskMakesResultIncomplete() {
        TaskNode withFail = task("a", TaskState.DONE, new DataNode(1), task("b", TaskState.FAIL));
        TaskNode withWaiting = task("a", TaskState.DONE, task("b", TaskState.WAITING), new DataNode(2));

        assertThat(TreeWalker.collect(withFail).complete()).isFalse();
        assertThat(TreeWalker.collect(withWaiting).complete()).isFalse();
        assertThat(TreeWalker.collect(withWaiting).list()).containsExactly(2);
    }

    @Test
    void emptyTreeIsEmptyAndIncomplete() {
        List<Node> seen = new ArrayList<>();
        TreeWalker.preOrder(null, seen::add);

        assertThat(seen).isEmpty();
        assertThat(TreeWalker.collect(null).list()).isEmpty();
        assertThat(TreeWalker.collect(null).complete()).isFalse();
    }

    @Test
    void deepTreeDoesNotOverflowStack() {
        TaskNode root = task("0", TaskState.DONE);
        TaskNode cur = root;
        for (int i = 1; i < 50_000; i++) {
            TaskNode next = task(String.valueOf(i), TaskState.DONE);
            cur.addChild(next);
            cur = next;
        }
        cur.addChild(new DataNode("bottom"));

        assertThat(TreeWalker.tasks(root)).hasSize(50_000);
        assertThat(TreeWalker.collect(root).list()).containsExactly("bottom");
    }
}
