package com.sourcelint.core.syntax;

/**
 * Half-open range of UTF-8 bytes in a source file.
 *
 * @param offset first byte of the range
 * @param length number of bytes covered
 */
public record ByteRange(int offset, int length) {

    public ByteRange {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative: " + offset);
        }
        if (length < 0) {
            throw new IllegalArgumentException("length must not be negative: " + length);
        }
    }

    public static ByteRange of(int offset, int length) {
        return new ByteRange(offset, length);
    }

    /**
     * Returns the first byte after this range.
     *
     * @return exclusive end offset
     */
    public int end() {
        return offset + length;
    }

    /**
     * Returns true if the two ranges share at least one byte.
     *
     * @param other range to test
     * @return true on overlap
     */
    public boolean intersects(ByteRange other) {
        return offset < other.end() && other.offset < end();
    }
}
