package com.nekopara.core.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nekopara.core.model.DataNode;
import com.nekopara.core.model.Node;
import com.nekopara.core.model.NodeKind;
import com.nekopara.core.model.TaskNode;
import com.nekopara.core.model.TaskState;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 크롤 트리 ⇄ JSON.
 *
 * 태스크: { "kind": "task", "state": "waiting"|"done"|"fail", "template": ..., "url": ..., "children": [...] }
 * 데이터: { "kind": "data", "data": <JSON 값> }
 *
 * 알 수 없는 필드는 무시. 빈 트리(null)는 JSON null 로 표현한다.
 * 저장 위치(파일/네트워크)는 호출 측 책임.
 */
public final class SnapshotCodec {

    private final ObjectMapper om;

    public SnapshotCodec() {
        this(new ObjectMapper());
    }

    public SnapshotCodec(ObjectMapper om) {
        this.om = Objects.requireNonNull(om, "om");
    }

    // ================= 직렬화 =================

    public String toJson(TaskNode root) {
        try {
            return om.writeValueAsString(toTree(root));
        } catch (JsonProcessingException e) {
            throw new SnapshotFormatException("Cannot serialize snapshot", e);
        }
    }

    public void write(TaskNode root, OutputStream out) throws IOException {
        om.writeValue(out, toTree(root));
    }

    public JsonNode toTree(TaskNode root) {
        if (root == null) return NullNode.getInstance();
        return taskToTree(root);
    }

    private ObjectNode taskToTree(TaskNode t) {
        ObjectNode n = om.createObjectNode();
        n.put("kind", NodeKind.TASK.wireName());
        n.put("state", t.state().wireName());
        n.put("template", t.template());
        n.put("url", t.url());
        ArrayNode children = n.putArray("children");
        for (Node c : t.children()) {
            if (c instanceof TaskNode ct) {
                children.add(taskToTree(ct));
            } else if (c instanceof DataNode d) {
                children.add(dataToTree(d));
            }
        }
        return n;
    }

    private ObjectNode dataToTree(DataNode d) {
        ObjectNode n = om.createObjectNode();
        n.put("kind", NodeKind.DATA.wireName());
        try {
            n.set("data", om.valueToTree(d.data()));
        } catch (IllegalArgumentException e) {
            throw new SnapshotFormatException("Data payload is not JSON-serializable: "
                    + d.data().getClass().getName(), e);
        }
        return n;
    }

    // ================= 역직렬화 =================

    public TaskNode fromJson(String json) {
        Objects.requireNonNull(json, "json");
        try {
            return fromTree(om.readTree(json));
        } catch (JsonProcessingException e) {
            throw new SnapshotFormatException("Malformed snapshot JSON: " + e.getOriginalMessage(), e);
        }
    }

    public TaskNode read(InputStream in) throws IOException {
        Objects.requireNonNull(in, "in");
        return fromTree(om.readTree(in));
    }

    public TaskNode fromTree(JsonNode json) {
        if (json == null || json.isNull() || json.isMissingNode()) return null;
        Node root = nodeFromTree(json, "$");
        if (!(root instanceof TaskNode t)) {
            throw new SnapshotFormatException("Snapshot root must be a task node");
        }
        return t;
    }

    private Node nodeFromTree(JsonNode n, String path) {
        if (!n.isObject()) throw new SnapshotFormatException(path + ": node must be an object");

        NodeKind kind;
        try {
            kind = NodeKind.fromWire(text(n, "kind", path));
        } catch (IllegalArgumentException e) {
            throw new SnapshotFormatException(path + ": " + e.getMessage(), e);
        }

        if (kind == NodeKind.DATA) {
            JsonNode data = n.get("data");
            return new DataNode(data == null ? null : payload(data, path));
        }

        TaskState state;
        try {
            state = TaskState.fromWire(text(n, "state", path));
        } catch (IllegalArgumentException e) {
            throw new SnapshotFormatException(path + ": " + e.getMessage(), e);
        }
        String template = text(n, "template", path);
        String url = text(n, "url", path);

        JsonNode arr = n.get("children");
        List<Node> children = new ArrayList<>();
        if (arr != null && !arr.isNull()) {
            if (!arr.isArray()) throw new SnapshotFormatException(path + ".children must be an array");
            for (int i = 0; i < arr.size(); i++) {
                children.add(nodeFromTree(arr.get(i), path + ".children[" + i + "]"));
            }
        }
        return new TaskNode(template, url, state, children);
    }

    private Object payload(JsonNode data, String path) {
        try {
            return om.treeToValue(data, Object.class);
        } catch (JsonProcessingException e) {
            throw new SnapshotFormatException(path + ": unreadable data payload", e);
        }
    }

    private static String text(JsonNode n, String field, String path) {
        JsonNode v = n.get(field);
        if (v == null || !v.isTextual()) {
            throw new SnapshotFormatException(path + "." + field + " must be a string");
        }
        return v.asText();
    }

    // ================= 복사 =================

    /** JSON 트리를 거친 깊은 복사. payload 는 JSON 형태의 값(Map/List/String/Number/Boolean/null)이 된다. */
    public TaskNode copy(TaskNode root) {
        return fromTree(toTree(root));
    }
}
