package com.sourcelint.core.syntax;

import java.util.Objects;

/**
 * A physical source line.
 *
 * @param index 1-based line number
 * @param content line text without its terminator
 * @param range UTF-8 byte range of {@code content} in the file
 */
public record Line(int index, String content, ByteRange range) {

    public Line {
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(range, "range must not be null");
    }

    /**
     * Returns the UTF-8 byte length of the line, never smaller than its character count.
     *
     * @return byte length
     */
    public int byteLength() {
        return range.length();
    }
}
