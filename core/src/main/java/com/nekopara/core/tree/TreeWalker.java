package com.nekopara.core.tree;

import com.nekopara.core.model.CrawlResults;
import com.nekopara.core.model.DataNode;
import com.nekopara.core.model.Node;
import com.nekopara.core.model.TaskNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

/**
 * 크롤 트리 전위 순회(자식은 왼쪽 → 오른쪽).
 * 깊은 트리에서도 스택 오버플로가 나지 않도록 명시적 스택 사용.
 */
public final class TreeWalker {

    private TreeWalker() {}

    /** root 부터 모든 노드를 정확히 한 번씩 방문. root 가 null 이면 아무것도 하지 않는다. */
    public static void preOrder(TaskNode root, Consumer<Node> visitor) {
        if (root == null) return;

        Deque<Cursor> stack = new ArrayDeque<>();
        visitor.accept(root);
        stack.push(new Cursor(root));

        while (!stack.isEmpty()) {
            Cursor top = stack.peek();
            List<Node> children = top.node.children();
            if (top.next >= children.size()) {
                stack.pop();
                continue;
            }
            Node child = children.get(top.next++);
            visitor.accept(child);
            if (child instanceof TaskNode t) {
                stack.push(new Cursor(t));
            }
        }
    }

    /** 데이터 payload 를 순회 순서대로 모으고, 모든 태스크가 DONE 인지 함께 판정 */
    public static CrawlResults collect(TaskNode root) {
        if (root == null) return CrawlResults.empty();

        List<Object> list = new ArrayList<>();
        boolean[] complete = { true };
        preOrder(root, node -> {
            if (node instanceof TaskNode t) {
                if (!t.isDone()) complete[0] = false;
            } else if (node instanceof DataNode d) {
                list.add(d.data());
            }
        });
        return new CrawlResults(list, complete[0]);
    }

    /** 순회 순서대로 태스크 노드만 */
    public static List<TaskNode> tasks(TaskNode root) {
        List<TaskNode> out = new ArrayList<>();
        preOrder(root, node -> {
            if (node instanceof TaskNode t) out.add(t);
        });
        return out;
    }

    private static final class Cursor {
        final TaskNode node;
        int next;
        Cursor(TaskNode node) { this.node = node; }
    }
}
