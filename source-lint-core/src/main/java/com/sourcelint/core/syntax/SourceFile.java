package com.sourcelint.core.syntax;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable view of one source file: its path, text, lines and UTF-8 bytes.
 *
 * <p>Syntax trees and syntax maps address the file by UTF-8 byte offsets; this class
 * translates those offsets back to text and to line/character positions.
 */
public final class SourceFile {

    private final String path;
    private final String contents;
    private final byte[] utf8;
    private final List<Line> lines;
    private final int[] lineStarts;

    private SourceFile(String path, String contents) {
        this.path = path;
        this.contents = Objects.requireNonNull(contents, "contents must not be null");
        this.utf8 = contents.getBytes(StandardCharsets.UTF_8);
        this.lines = splitLines(contents);
        this.lineStarts = lines.stream().mapToInt(line -> line.range().offset()).toArray();
    }

    /**
     * Creates a source file backed by a path on disk.
     *
     * @param path file path used in violation locations, may be null
     * @param contents file contents
     * @return source file
     */
    public static SourceFile of(String path, String contents) {
        return new SourceFile(path, contents);
    }

    /**
     * Creates an in-memory source file without a path.
     *
     * @param contents file contents
     * @return source file
     */
    public static SourceFile ofContents(String contents) {
        return new SourceFile(null, contents);
    }

    public Optional<String> path() {
        return Optional.ofNullable(path);
    }

    public String contents() {
        return contents;
    }

    public List<Line> lines() {
        return lines;
    }

    public int byteLength() {
        return utf8.length;
    }

    /**
     * Returns the text covered by a byte range.
     *
     * @param range byte range
     * @return text, or empty if the range falls outside the file
     */
    public Optional<String> substring(ByteRange range) {
        if (range.end() > utf8.length) {
            return Optional.empty();
        }
        return Optional.of(new String(utf8, range.offset(), range.length(), StandardCharsets.UTF_8));
    }

    /**
     * Resolves a byte offset to a 1-based line and character.
     *
     * @param byteOffset UTF-8 byte offset
     * @return position, or empty if the offset lies outside the file
     */
    public Optional<Position> positionOf(int byteOffset) {
        if (byteOffset < 0 || byteOffset > utf8.length || lines.isEmpty()) {
            return Optional.empty();
        }
        int search = Arrays.binarySearch(lineStarts, byteOffset);
        int lineIndex = search >= 0 ? search : -search - 2;
        Line line = lines.get(lineIndex);
        int prefixLength = Math.min(byteOffset, line.range().end()) - line.range().offset();
        String prefix = new String(utf8, line.range().offset(), prefixLength, StandardCharsets.UTF_8);
        return Optional.of(new Position(line.index(), prefix.codePointCount(0, prefix.length()) + 1));
    }

    private static List<Line> splitLines(String contents) {
        List<Line> result = new ArrayList<>();
        int byteOffset = 0;
        int start = 0;
        int index = 1;
        int i = 0;
        while (i <= contents.length()) {
            boolean atEnd = i == contents.length();
            char c = atEnd ? '\n' : contents.charAt(i);
            if (c != '\n' && c != '\r') {
                i++;
                continue;
            }
            String content = contents.substring(start, i);
            int contentBytes = content.getBytes(StandardCharsets.UTF_8).length;
            result.add(new Line(index++, content, ByteRange.of(byteOffset, contentBytes)));
            if (atEnd) {
                break;
            }
            int terminatorLength = (c == '\r' && i + 1 < contents.length() && contents.charAt(i + 1) == '\n') ? 2 : 1;
            byteOffset += contentBytes + terminatorLength;
            i += terminatorLength;
            start = i;
        }
        // A trailing terminator does not open a new line
        if (result.size() > 1 && result.get(result.size() - 1).content().isEmpty()
                && !contents.isEmpty()) {
            result.remove(result.size() - 1);
        }
        return List.copyOf(result);
    }

    /**
     * A 1-based line and character position.
     *
     * @param line line number
     * @param character character within the line
     */
    public record Position(int line, int character) {
    }
}
