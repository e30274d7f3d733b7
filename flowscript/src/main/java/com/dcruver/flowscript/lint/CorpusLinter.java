package com.dcruver.flowscript.lint;

import com.dcruver.flowscript.exception.LocatedException;
import com.dcruver.flowscript.ir.FlowGraph;
import com.dcruver.flowscript.parse.FlowScriptParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Lints every FlowScript document under a directory.
 * A document that fails to parse is reported as a single ERROR finding; the scan continues.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CorpusLinter {

    public static final String SOURCE_EXTENSION = ".fs";

    private final FlowScriptParser parser;
    private final SemanticLinter linter;

    /**
     * Lint all .fs files below {@code root}, keyed by path relative to it, in path order
     */
    public Map<String, LintReport> lintDirectory(Path root) throws IOException {
        Path dir = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(dir)) {
            throw new IOException("Not a directory: " + dir);
        }

        List<Path> sources;
        try (Stream<Path> paths = Files.walk(dir)) {
            sources = paths
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().endsWith(SOURCE_EXTENSION))
                .sorted()
                .toList();
        }
        log.info("Found {} FlowScript files under {}", sources.size(), dir);

        Map<String, LintReport> reports = new LinkedHashMap<>();
        for (Path source : sources) {
            String name = dir.relativize(source).toString();
            reports.put(name, lintFile(source, name));
        }
        return reports;
    }

    private LintReport lintFile(Path source, String name) throws IOException {
        try {
            FlowGraph graph = parser.parse(Files.readString(source), name);
            return linter.lint(graph);
        } catch (LocatedException e) {
            log.warn("Failed to compile {}: {}", name, e.getMessage());
            return new LintReport(List.of(Finding.builder()
                .severity(Severity.ERROR)
                .code(e.getCode().name())
                .rule("compile")
                .message(e.getDetail())
                .location(new SourceLocation(name, e.getLine()))
                .build()));
        }
    }
}
