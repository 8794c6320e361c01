package com.sourcelint.core.rule;

import com.sourcelint.core.model.Location;
import com.sourcelint.core.syntax.SourceFile;
import com.sourcelint.core.syntax.SyntaxMap;
import com.sourcelint.core.syntax.SyntaxTree;

import java.util.Objects;
import java.util.Optional;

/**
 * Everything a rule may look at for one file.
 *
 * @param file source text and lines
 * @param tree syntax tree, empty when no structure is available
 * @param syntaxMap token classification, empty when unavailable
 */
public record LintContext(
    SourceFile file,
    SyntaxTree tree,
    SyntaxMap syntaxMap
) {
    /**
     * Compact constructor with validation.
     */
    public LintContext {
        Objects.requireNonNull(file, "file must not be null");
        if (tree == null) {
            tree = SyntaxTree.empty();
        }
        if (syntaxMap == null) {
            syntaxMap = SyntaxMap.empty();
        }
    }

    /**
     * Creates a context for line-based rules only.
     *
     * @param file source file
     * @return context with an empty tree and syntax map
     */
    public static LintContext ofFile(SourceFile file) {
        return new LintContext(file, SyntaxTree.empty(), SyntaxMap.empty());
    }

    /**
     * Returns the file path used in locations, null for in-memory sources.
     *
     * @return file path or null
     */
    public String path() {
        return file.path().orElse(null);
    }

    /**
     * Creates a location for a byte offset, resolving line and character.
     *
     * @param byteOffset byte offset
     * @return location
     */
    public Location locationAt(int byteOffset) {
        Optional<SourceFile.Position> position = file.positionOf(byteOffset);
        return Location.atOffset(
            path(),
            byteOffset,
            position.map(SourceFile.Position::line).orElse(null),
            position.map(SourceFile.Position::character).orElse(null));
    }

    /**
     * Creates a line-based location.
     *
     * @param line 1-based line number
     * @return location
     */
    public Location locationAtLine(int line) {
        return Location.atLine(path(), line);
    }
}
