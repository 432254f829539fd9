package com.nekopara.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 태스크 노드: (template, url) 로 한 번의 템플릿 실행을 나타낸다.
 *
 * children 은 원자적으로 채워진다: 비어 있거나(미실행/실패) 한 번의 성공 실행이 만든 전체 목록이거나.
 * 실행 중인 트리의 노드는 스케줄러가 소유하며, 외부로는 스냅샷(깊은 복사)만 나간다.
 */
public final class TaskNode implements Node {

    private final String template;
    private final String url;
    private TaskState state;
    private final List<Node> children;

    public TaskNode(String template, String url) {
        this(template, url, TaskState.WAITING, List.of());
    }

    public TaskNode(String template, String url, TaskState state, List<? extends Node> children) {
        this.template = Objects.requireNonNull(template, "template");
        this.url = Objects.requireNonNull(url, "url");
        this.state = Objects.requireNonNull(state, "state");
        this.children = new ArrayList<>(Objects.requireNonNull(children, "children"));
    }

    @Override public NodeKind kind() { return NodeKind.TASK; }

    public String template() { return template; }
    public String url() { return url; }
    public TaskState state() { return state; }

    /** 읽기 전용 뷰 */
    public List<Node> children() { return Collections.unmodifiableList(children); }

    public void setState(TaskState state) {
        this.state = Objects.requireNonNull(state, "state");
    }

    public void addChild(Node child) {
        children.add(Objects.requireNonNull(child, "child"));
    }

    public boolean isDone() { return state == TaskState.DONE; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TaskNode other)) return false;
        return template.equals(other.template)
                && url.equals(other.url)
                && state == other.state
                && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(template, url, state, children);
    }

    @Override
    public String toString() {
        return "TaskNode{" + template + " " + url + " " + state.wireName()
                + ", children=" + children.size() + "}";
    }
}
