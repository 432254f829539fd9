package com.nekopara.core.snapshot;

/** 스냅샷이 크롤 트리 포맷에 맞지 않거나 payload 를 JSON 으로 옮길 수 없을 때 */
public class SnapshotFormatException extends IllegalArgumentException {
    public SnapshotFormatException(String message) { super(message); }
    public SnapshotFormatException(String message, Throwable cause) { super(message, cause); }
}
