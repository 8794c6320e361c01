package com.sourcelint.core.model;

/**
 * Where a violation was found.
 *
 * <p>AST rules locate violations by byte offset, which is resolved to a line and
 * character when the source is available. Line rules locate by line only, leaving
 * {@code byteOffset} and {@code character} null.
 *
 * @param file file path, null for in-memory sources
 * @param byteOffset UTF-8 byte offset, null for line-based locations
 * @param line 1-based line, null when unresolved
 * @param character 1-based character in the line, null when unknown
 */
public record Location(
    String file,
    Integer byteOffset,
    Integer line,
    Integer character
) {

    /**
     * Creates a line-based location.
     *
     * @param file file path
     * @param line 1-based line number
     * @return location without offset and character
     */
    public static Location atLine(String file, int line) {
        return new Location(file, null, line, null);
    }

    /**
     * Creates an offset-based location with its resolved position.
     *
     * @param file file path
     * @param byteOffset byte offset
     * @param line resolved line, may be null
     * @param character resolved character, may be null
     * @return location
     */
    public static Location atOffset(String file, int byteOffset, Integer line, Integer character) {
        return new Location(file, byteOffset, line, character);
    }

    /**
     * Formats the location as {@code file:line:character}, omitting missing parts.
     *
     * @return human readable location
     */
    public String describe() {
        StringBuilder builder = new StringBuilder(file != null ? file : "<nopath>");
        if (line != null) {
            builder.append(':').append(line);
            if (character != null) {
                builder.append(':').append(character);
            }
        }
        return builder.toString();
    }
}
