package com.iksanov.bootstrapkv.common.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.iksanov.bootstrapkv.common.dto.FetchRequest;
import com.iksanov.bootstrapkv.common.dto.FetchResult;
import com.iksanov.bootstrapkv.common.dto.Modification;
import com.iksanov.bootstrapkv.common.dto.NodeStatus;
import com.iksanov.bootstrapkv.common.exception.SerializationException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * JSON encoding of every message exchanged between nodes and clients.
 * <p>
 * Wire shapes:
 * <pre>
 * modification   {"Update":["key","value"]} | {"Delete":"key"}
 * insert body    [modification, ...]
 * info reply     [head, size]
 * fetch request  [begin, end, head]
 * fetch reply    {"head":h, "entries":[modification, ...], "diff":[modification, ...]}
 * </pre>
 * Decoding failures of any kind are reported as {@link SerializationException}.
 * Instances are immutable and thread-safe.
 */
public final class JsonCodec {

    private static final String UPDATE_TAG = "Update";
    private static final String DELETE_TAG = "Delete";
    private static final String HEAD_FIELD = "head";
    private static final String ENTRIES_FIELD = "entries";
    private static final String DIFF_FIELD = "diff";

    private final ObjectMapper mapper;
    private final JsonNodeFactory nodes;

    public JsonCodec() {
        this(new ObjectMapper());
    }

    public JsonCodec(ObjectMapper mapper) {
        this.mapper = mapper;
        this.nodes = mapper.getNodeFactory();
    }

    public byte[] encodeModifications(List<Modification> modifications) {
        return write(modificationsNode(modifications));
    }

    public List<Modification> decodeModifications(byte[] body) {
        return readModifications(read(body), "insert body");
    }

    public byte[] encodeStatus(NodeStatus status) {
        ArrayNode array = nodes.arrayNode();
        array.add(status.head());
        array.add(status.size());
        return write(array);
    }

    public NodeStatus decodeStatus(byte[] body) {
        JsonNode root = read(body);
        requireArray(root, 2, "info reply");
        try {
            return new NodeStatus(readLong(root.get(0), "head"), readLong(root.get(1), "size"));
        } catch (IllegalArgumentException e) {
            throw new SerializationException("Invalid info reply: " + e.getMessage(), e);
        }
    }

    public byte[] encodeFetchRequest(FetchRequest request) {
        ArrayNode array = nodes.arrayNode();
        array.add(request.begin());
        array.add(request.end());
        array.add(request.head());
        return write(array);
    }

    public FetchRequest decodeFetchRequest(byte[] body) {
        JsonNode root = read(body);
        requireArray(root, 3, "fetch request");
        return new FetchRequest(
                readLong(root.get(0), "begin"),
                readLong(root.get(1), "end"),
                readLong(root.get(2), "head"));
    }

    public byte[] encodeFetchResult(FetchResult result) {
        ObjectNode object = nodes.objectNode();
        object.put(HEAD_FIELD, result.head());
        object.set(ENTRIES_FIELD, modificationsNode(result.entries()));
        object.set(DIFF_FIELD, modificationsNode(result.diff()));
        return write(object);
    }

    public FetchResult decodeFetchResult(byte[] body) {
        JsonNode root = read(body);
        if (!root.isObject()) throw new SerializationException("fetch reply must be a JSON object");
        long head = readLong(root.get(HEAD_FIELD), HEAD_FIELD);
        List<Modification> entries = readModifications(root.get(ENTRIES_FIELD), ENTRIES_FIELD);
        List<Modification> diff = readModifications(root.get(DIFF_FIELD), DIFF_FIELD);
        try {
            return new FetchResult(head, entries, diff);
        } catch (IllegalArgumentException e) {
            throw new SerializationException("Invalid fetch reply: " + e.getMessage(), e);
        }
    }

    private ArrayNode modificationsNode(List<Modification> modifications) {
        ArrayNode array = nodes.arrayNode();
        for (Modification m : modifications) {
            ObjectNode tagged = nodes.objectNode();
            switch (m.type()) {
                case UPDATE -> {
                    ArrayNode pair = nodes.arrayNode();
                    pair.add(m.key());
                    pair.add(m.value());
                    tagged.set(UPDATE_TAG, pair);
                }
                case DELETE -> tagged.put(DELETE_TAG, m.key());
            }
            array.add(tagged);
        }
        return array;
    }

    private List<Modification> readModifications(JsonNode node, String what) {
        if (node == null || !node.isArray()) throw new SerializationException(what + " must be a JSON array");
        List<Modification> result = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            result.add(readModification(element));
        }
        return result;
    }

    private Modification readModification(JsonNode node) {
        if (node == null || !node.isObject() || node.size() != 1) {
            throw new SerializationException("Modification must be an object with exactly one tag: " + node);
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        Map.Entry<String, JsonNode> field = fields.next();
        JsonNode payload = field.getValue();
        return switch (field.getKey()) {
            case UPDATE_TAG -> {
                requireArray(payload, 2, "Update payload");
                yield Modification.update(readText(payload.get(0), "key"), readText(payload.get(1), "value"));
            }
            case DELETE_TAG -> Modification.delete(readText(payload, "key"));
            default -> throw new SerializationException("Unknown modification tag: " + field.getKey());
        };
    }

    private static void requireArray(JsonNode node, int length, String what) {
        if (node == null || !node.isArray() || node.size() != length) {
            throw new SerializationException(what + " must be a JSON array of " + length + " elements");
        }
    }

    private static long readLong(JsonNode node, String what) {
        if (node == null || !node.isIntegralNumber() || !node.canConvertToLong()) {
            throw new SerializationException(what + " must be an integer");
        }
        long value = node.asLong();
        if (value < 0) throw new SerializationException(what + " must not be negative: " + value);
        return value;
    }

    private static String readText(JsonNode node, String what) {
        if (node == null || !node.isTextual()) throw new SerializationException(what + " must be a string");
        return node.asText();
    }

    private JsonNode read(byte[] body) {
        if (body == null || body.length == 0) throw new SerializationException("Empty body");
        try {
            JsonNode root = mapper.readTree(body);
            if (root == null || root.isMissingNode()) throw new SerializationException("Empty body");
            return root;
        } catch (IOException e) {
            throw new SerializationException("Malformed JSON: " + e.getMessage(), e);
        }
    }

    private byte[] write(JsonNode node) {
        try {
            return mapper.writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to encode message", e);
        }
    }
}
