package com.sourcelint.core.sourcekit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sourcelint.core.syntax.ByteRange;
import com.sourcelint.core.syntax.CallArgument;
import com.sourcelint.core.syntax.SyntaxKind;
import com.sourcelint.core.syntax.SyntaxTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Reads the JSON produced by {@code sourcekitten structure} into a {@link SyntaxTree}.
 *
 * <p><b>Input shape:</b>
 * <pre>{@code
 * {
 *   "key.offset": 0, "key.length": 64,
 *   "key.substructure": [
 *     { "key.kind": "source.lang.swift.decl.function.free", "key.name": "f()",
 *       "key.offset": 0, "key.length": 63, "key.bodyoffset": 10, "key.bodylength": 52,
 *       "key.substructure": [ ... ] }
 *   ]
 * }
 * }</pre>
 *
 * <p>Argument entries ({@code source.lang.swift.expr.argument}) become the
 * {@link CallArgument}s of their call; whatever they contain becomes a child of the
 * call. Entries without {@code key.offset}/{@code key.length} are dropped and their
 * children attached to the nearest kept ancestor.
 */
public class SourceKitStructureReader {

    private static final Logger log = LoggerFactory.getLogger(SourceKitStructureReader.class);

    static final String KIND = "key.kind";
    static final String NAME = "key.name";
    static final String OFFSET = "key.offset";
    static final String LENGTH = "key.length";
    static final String BODY_OFFSET = "key.bodyoffset";
    static final String BODY_LENGTH = "key.bodylength";
    static final String SUBSTRUCTURE = "key.substructure";

    private final ObjectMapper objectMapper;

    public SourceKitStructureReader() {
        this(new ObjectMapper());
    }

    public SourceKitStructureReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Reads a structure dump from disk.
     *
     * @param file JSON file
     * @return syntax tree
     * @throws SyntaxReadException if the file cannot be read or is not a structure dump
     */
    public SyntaxTree read(Path file) throws SyntaxReadException {
        try {
            return read(Files.readString(file));
        } catch (IOException e) {
            throw new SyntaxReadException("Failed to read structure file " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads a structure dump from JSON text.
     *
     * @param json JSON text
     * @return syntax tree
     * @throws SyntaxReadException if the text is not a structure dump
     */
    public SyntaxTree read(String json) throws SyntaxReadException {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (IOException e) {
            throw new SyntaxReadException("Malformed structure JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new SyntaxReadException("Structure root must be a JSON object");
        }

        SyntaxTree.Builder builder = SyntaxTree.builder();
        Deque<Pending> stack = new ArrayDeque<>();
        pushReversed(stack, substructure(root), SyntaxTree.ROOT);

        while (!stack.isEmpty()) {
            Pending pending = stack.pop();
            JsonNode entry = pending.entry();
            ByteRange range = range(entry, OFFSET, LENGTH);
            if (range == null) {
                log.debug("Skipping structure entry without offset/length: {}", entry.path(KIND).asText("?"));
                pushReversed(stack, substructure(entry), pending.parent());
                continue;
            }

            String rawKind = text(entry, KIND);
            SyntaxKind kind = SyntaxKind.fromIdentifier(rawKind);
            List<JsonNode> children = new ArrayList<>();
            List<CallArgument> arguments = new ArrayList<>();
            for (JsonNode child : substructure(entry)) {
                if (kind == SyntaxKind.CALL
                        && SyntaxKind.fromIdentifier(text(child, KIND)) == SyntaxKind.ARGUMENT) {
                    arguments.add(new CallArgument(text(child, NAME), range(child, BODY_OFFSET, BODY_LENGTH)));
                    children.addAll(substructure(child));
                } else {
                    children.add(child);
                }
            }

            int id = builder.add(pending.parent(), kind, rawKind, text(entry, NAME), range,
                range(entry, BODY_OFFSET, BODY_LENGTH), arguments);
            pushReversed(stack, children, id);
        }

        SyntaxTree tree = builder.build();
        log.debug("Read structure with {} nodes", tree.size());
        return tree;
    }

    private static List<JsonNode> substructure(JsonNode entry) {
        JsonNode items = entry.get(SUBSTRUCTURE);
        List<JsonNode> result = new ArrayList<>();
        if (items != null && items.isArray()) {
            for (JsonNode item : items) {
                if (item.isObject()) {
                    result.add(item);
                }
            }
        }
        return result;
    }

    private static void pushReversed(Deque<Pending> stack, List<JsonNode> entries, int parent) {
        for (int i = entries.size() - 1; i >= 0; i--) {
            stack.push(new Pending(entries.get(i), parent));
        }
    }

    private static ByteRange range(JsonNode entry, String offsetKey, String lengthKey) {
        JsonNode offset = entry.get(offsetKey);
        JsonNode length = entry.get(lengthKey);
        if (offset == null || length == null || !offset.canConvertToInt() || !length.canConvertToInt()) {
            return null;
        }
        if (offset.asInt() < 0 || length.asInt() < 0) {
            return null;
        }
        return ByteRange.of(offset.asInt(), length.asInt());
    }

    private static String text(JsonNode entry, String key) {
        JsonNode value = entry.get(key);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private record Pending(JsonNode entry, int parent) {
    }
}
