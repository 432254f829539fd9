package com.nekopara.core.model;

/** 크롤 트리 노드: 태스크 노드 또는 데이터 노드. */
public sealed interface Node permits TaskNode, DataNode {
    NodeKind kind();
}
