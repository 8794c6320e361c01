package com.sourcelint.core.lint;

import com.sourcelint.core.model.Violation;
import com.sourcelint.core.rule.AstRule;
import com.sourcelint.core.rule.LintContext;
import com.sourcelint.core.rule.Rule;
import com.sourcelint.core.rule.RuleRegistry;
import com.sourcelint.core.sourcekit.SourceKitStructureReader;
import com.sourcelint.core.sourcekit.SourceKitSyntaxMapReader;
import com.sourcelint.core.sourcekit.SyntaxReadException;
import com.sourcelint.core.syntax.SourceFile;
import com.sourcelint.core.syntax.SyntaxMap;
import com.sourcelint.core.syntax.SyntaxNode;
import com.sourcelint.core.syntax.SyntaxTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the enabled rules over source files.
 *
 * <p>For each file the syntax tree is walked once; every AST rule registered for a
 * node's kind is invoked at that node. Rules that are not AST rules run once per
 * file. Violations are grouped by rule, in source order within each rule.
 *
 * <p>Syntax trees come from SourceKitten dumps stored next to the source file:
 * {@code Foo.swift.structure.json} and {@code Foo.swift.syntax.json}. A file without
 * dumps is still checked by line-based rules and its result carries a warning.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Linter linter = new Linter(RuleRegistry.fromConfig(config));
 * List<LintResult> results = linter.lintFiles(files, true);
 * }</pre>
 */
public class Linter {

    private static final Logger log = LoggerFactory.getLogger(Linter.class);

    /**
     * Suffix of the structure dump stored next to a source file.
     */
    public static final String STRUCTURE_SUFFIX = ".structure.json";

    /**
     * Suffix of the syntax-map dump stored next to a source file.
     */
    public static final String SYNTAX_SUFFIX = ".syntax.json";

    private final RuleRegistry registry;
    private final SourceKitStructureReader structureReader;
    private final SourceKitSyntaxMapReader syntaxMapReader;

    public Linter(RuleRegistry registry) {
        this(registry, new SourceKitStructureReader(), new SourceKitSyntaxMapReader());
    }

    public Linter(RuleRegistry registry,
                  SourceKitStructureReader structureReader,
                  SourceKitSyntaxMapReader syntaxMapReader) {
        this.registry = registry;
        this.structureReader = structureReader;
        this.syntaxMapReader = syntaxMapReader;
    }

    /**
     * Lints an in-memory context with every enabled rule.
     *
     * @param context file, tree and syntax map
     * @return violations grouped by rule
     */
    public List<Violation> lint(LintContext context) {
        Map<Rule, List<Violation>> byRule = new LinkedHashMap<>();
        for (Rule rule : registry.getRules()) {
            byRule.put(rule, new ArrayList<>());
        }

        List<AstRule> astRules = registry.getAstRules();
        if (!astRules.isEmpty()) {
            for (SyntaxNode node : context.tree().preorder()) {
                for (AstRule rule : astRules) {
                    if (rule.getKinds().contains(node.kind())) {
                        byRule.get(rule).addAll(rule.validate(context, node));
                    }
                }
            }
        }

        for (Rule rule : registry.getFileRules()) {
            byRule.get(rule).addAll(rule.validate(context));
        }

        List<Violation> violations = new ArrayList<>();
        byRule.values().forEach(violations::addAll);
        return violations;
    }

    /**
     * Reads and lints one source file.
     *
     * @param sourcePath path to the source file
     * @return lint result; failed if the file cannot be read
     */
    public LintResult lintFile(Path sourcePath) {
        String file = sourcePath.toString();
        String contents;
        try {
            contents = Files.readString(sourcePath);
        } catch (IOException e) {
            log.warn("Failed to read source file: {} - {}", sourcePath, e.getMessage());
            return LintResult.failed(file, List.of("Failed to read file: " + e.getMessage()));
        }

        List<String> warnings = new ArrayList<>();
        SyntaxTree tree = readStructure(sourcePath, warnings);
        SyntaxMap syntaxMap = readSyntaxMap(sourcePath, warnings);

        LintContext context = new LintContext(SourceFile.of(file, contents), tree, syntaxMap);
        List<Violation> violations = lint(context);
        log.debug("Linted {}: {} violations", file, violations.size());
        return LintResult.of(file, violations, warnings);
    }

    /**
     * Lints several files, optionally in parallel. Results keep the input order.
     *
     * @param sourcePaths files to lint
     * @param parallel whether files may be linted concurrently
     * @return one result per file
     */
    public List<LintResult> lintFiles(List<Path> sourcePaths, boolean parallel) {
        log.info("Linting {} files{}", sourcePaths.size(), parallel ? " in parallel" : "");
        if (parallel) {
            return sourcePaths.parallelStream().map(this::lintFile).toList();
        }
        return sourcePaths.stream().map(this::lintFile).toList();
    }

    private SyntaxTree readStructure(Path sourcePath, List<String> warnings) {
        Path structurePath = sibling(sourcePath, STRUCTURE_SUFFIX);
        if (!Files.isRegularFile(structurePath)) {
            if (!registry.getAstRules().isEmpty()) {
                warnings.add("No structure dump found (" + structurePath.getFileName()
                    + "); syntax tree rules skipped");
            }
            return SyntaxTree.empty();
        }
        try {
            return structureReader.read(structurePath);
        } catch (SyntaxReadException e) {
            log.warn("Ignoring structure dump {}: {}", structurePath, e.getMessage());
            warnings.add(e.getMessage());
            return SyntaxTree.empty();
        }
    }

    private SyntaxMap readSyntaxMap(Path sourcePath, List<String> warnings) {
        Path syntaxPath = sibling(sourcePath, SYNTAX_SUFFIX);
        if (!Files.isRegularFile(syntaxPath)) {
            return SyntaxMap.empty();
        }
        try {
            return syntaxMapReader.read(syntaxPath);
        } catch (SyntaxReadException e) {
            log.warn("Ignoring syntax dump {}: {}", syntaxPath, e.getMessage());
            warnings.add(e.getMessage());
            return SyntaxMap.empty();
        }
    }

    private static Path sibling(Path sourcePath, String suffix) {
        return sourcePath.resolveSibling(sourcePath.getFileName().toString() + suffix);
    }
}
