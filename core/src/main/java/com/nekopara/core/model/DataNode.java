package com.nekopara.core.model;

/**
 * 데이터 노드: 템플릿이 수집한 값 하나를 담는 리프.
 * 생성 후 불변. payload 는 JSON 으로 표현 가능한 값이어야 스냅샷을 통과한다.
 */
public record DataNode(Object data) implements Node {
    @Override public NodeKind kind() { return NodeKind.DATA; }
}
