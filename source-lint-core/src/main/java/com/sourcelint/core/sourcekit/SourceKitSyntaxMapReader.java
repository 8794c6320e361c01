package com.sourcelint.core.sourcekit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sourcelint.core.syntax.SyntaxMap;
import com.sourcelint.core.syntax.SyntaxToken;
import com.sourcelint.core.syntax.TokenKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the JSON produced by {@code sourcekitten syntax} into a {@link SyntaxMap}.
 *
 * <p>Input is an array of {@code {"offset": 12, "length": 5, "type": "source.lang.swift.syntaxtype.string"}}
 * entries. Entries with missing or negative offsets are skipped.
 */
public class SourceKitSyntaxMapReader {

    private static final Logger log = LoggerFactory.getLogger(SourceKitSyntaxMapReader.class);

    private final ObjectMapper objectMapper;

    public SourceKitSyntaxMapReader() {
        this(new ObjectMapper());
    }

    public SourceKitSyntaxMapReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public SyntaxMap read(Path file) throws SyntaxReadException {
        try {
            return read(Files.readString(file));
        } catch (IOException e) {
            throw new SyntaxReadException("Failed to read syntax file " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads a syntax map from JSON text.
     *
     * @param json JSON text
     * @return syntax map
     * @throws SyntaxReadException if the text is not a JSON array
     */
    public SyntaxMap read(String json) throws SyntaxReadException {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (IOException e) {
            throw new SyntaxReadException("Malformed syntax JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new SyntaxReadException("Syntax map root must be a JSON array");
        }

        List<SyntaxToken> tokens = new ArrayList<>(root.size());
        int skipped = 0;
        for (JsonNode entry : root) {
            JsonNode offset = entry.get("offset");
            JsonNode length = entry.get("length");
            if (offset == null || length == null || !offset.canConvertToInt() || !length.canConvertToInt()
                    || offset.asInt() < 0 || length.asInt() < 0) {
                skipped++;
                continue;
            }
            TokenKind kind = TokenKind.fromIdentifier(entry.path("type").asText(null));
            tokens.add(SyntaxToken.of(kind, offset.asInt(), length.asInt()));
        }

        if (skipped > 0) {
            log.debug("Skipped {} malformed syntax map entries", skipped);
        }
        return SyntaxMap.of(tokens);
    }
}
