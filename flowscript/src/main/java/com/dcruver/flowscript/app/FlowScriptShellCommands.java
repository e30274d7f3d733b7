package com.dcruver.flowscript.app;

import com.dcruver.flowscript.exception.ErrorCode;
import com.dcruver.flowscript.exception.FlowScriptException;
import com.dcruver.flowscript.io.IrJsonCodec;
import com.dcruver.flowscript.io.IrSchemaValidator;
import com.dcruver.flowscript.ir.FlowGraph;
import com.dcruver.flowscript.ir.Node;
import com.dcruver.flowscript.lint.CorpusLinter;
import com.dcruver.flowscript.lint.LintReport;
import com.dcruver.flowscript.lint.SemanticLinter;
import com.dcruver.flowscript.parse.FlowScriptParser;
import com.dcruver.flowscript.query.AlternativesOptions;
import com.dcruver.flowscript.query.BlockedOptions;
import com.dcruver.flowscript.query.QueryEngine;
import com.dcruver.flowscript.query.TensionOptions;
import com.dcruver.flowscript.query.WhatIfOptions;
import com.dcruver.flowscript.query.WhyOptions;
import com.dcruver.flowscript.reporting.LintReportFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Spring Shell commands for the FlowScript toolchain.
 * Commands print text or JSON; failures surface through exceptions mapped to exit codes.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class FlowScriptShellCommands {

    private final FlowScriptParser parser;
    private final SemanticLinter linter;
    private final CorpusLinter corpusLinter;
    private final IrJsonCodec codec;
    private final IrSchemaValidator validator;
    private final LintReportFormatter formatter;
    private final Clock clock;

    @ShellMethod(key = "parse", value = "Compile a FlowScript file to IR JSON")
    public String parse(
            @ShellOption(help = "FlowScript source file") String file,
            @ShellOption(value = {"--output", "-o"}, defaultValue = ShellOption.NULL,
                help = "Write the IR to this file instead of printing it") String output,
            @ShellOption(defaultValue = "false", help = "Single-line JSON") boolean compact) {
        log.info("Parsing {}", file);
        FlowGraph graph = parseSource(Path.of(file));

        if (output == null) {
            return codec.toJson(graph, !compact);
        }

        try {
            codec.write(graph, Path.of(output), !compact);
        } catch (IOException e) {
            throw ioFailure("Cannot write " + output, e);
        }
        return String.format("✓ Parsed %s → %s (%d nodes, %d relationships, %d states)",
            file, output, graph.getNodes().size(), graph.getRelationships().size(), graph.getStates().size());
    }

    @ShellMethod(key = "lint", value = "Run the semantic rules over a FlowScript file")
    public String lint(
            @ShellOption(help = "FlowScript source file") String file,
            @ShellOption(defaultValue = "false", help = "Print findings as JSON") boolean json) {
        log.info("Linting {}", file);
        Path path = Path.of(file);
        LintReport report = linter.lint(parseSource(path));

        String rendered = json
            ? codec.toJson(report, true)
            : formatter.format(path.getFileName().toString(), report);
        if (!report.isClean()) {
            throw new LintFailedException(rendered, report.getErrorCount());
        }
        return rendered;
    }

    @ShellMethod(key = "lint-all", value = "Lint every .fs file under a directory")
    public String lintAll(@ShellOption(help = "Directory to scan") String dir) {
        Map<String, LintReport> reports;
        try {
            reports = corpusLinter.lintDirectory(Path.of(dir));
        } catch (IOException e) {
            throw ioFailure("Cannot scan " + dir, e);
        }

        String summary = formatter.formatSummary(reports);
        long errors = reports.values().stream().mapToLong(LintReport::getErrorCount).sum();
        if (errors > 0) {
            throw new LintFailedException(summary, errors);
        }
        return summary;
    }

    @ShellMethod(key = "validate", value = "Check an IR JSON file against the structural schema")
    public String validate(
            @ShellOption(help = "IR JSON file") String file,
            @ShellOption(defaultValue = "false", help = "Show graph statistics") boolean verbose) {
        FlowGraph graph = validator.requireValid(readIr(Path.of(file)));

        StringBuilder sb = new StringBuilder();
        sb.append(String.format("✓ %s is valid IR (version %s)\n", file, graph.getVersion()));
        if (verbose) {
            sb.append(String.format("- Nodes: %d\n", graph.getNodes().size()));
            sb.append(String.format("- Relationships: %d\n", graph.getRelationships().size()));
            sb.append(String.format("- States: %d\n", graph.getStates().size()));
            sb.append(String.format("- Causal graph acyclic: %s\n", graph.getInvariants().isCausalAcyclic()));
            sb.append(String.format("- All nodes reachable: %s\n", graph.getInvariants().isAllNodesReachable()));
            sb.append(String.format("- Tension axes labeled: %s\n", graph.getInvariants().isTensionAxesLabeled()));
            sb.append(String.format("- Required state fields present: %s\n", graph.getInvariants().isStateFieldsPresent()));
        }
        return sb.toString();
    }

    @ShellMethod(key = "query why", value = "Trace the causal ancestry of a node")
    public String why(
            @ShellOption(help = "IR JSON or FlowScript file") String file,
            @ShellOption(help = "Node id or exact content") String node,
            @ShellOption(value = "--max-depth", defaultValue = ShellOption.NULL) Integer maxDepth,
            @ShellOption(defaultValue = "chain", help = "chain, tree or minimal") String format) {
        FlowGraph graph = loadGraph(Path.of(file));
        WhyOptions options = WhyOptions.builder()
            .maxDepth(maxDepth)
            .format(parseEnum(WhyOptions.Format.class, format))
            .build();
        return codec.toJson(engine(graph).why(resolveNode(graph, node), options), true);
    }

    @ShellMethod(key = "query what-if", value = "Show what a node affects downstream")
    public String whatIf(
            @ShellOption(help = "IR JSON or FlowScript file") String file,
            @ShellOption(help = "Node id or exact content") String node,
            @ShellOption(value = "--max-depth", defaultValue = ShellOption.NULL) Integer maxDepth,
            @ShellOption(defaultValue = "tree", help = "tree, list or summary") String format,
            @ShellOption(value = "--no-temporal", defaultValue = "false") boolean noTemporal) {
        FlowGraph graph = loadGraph(Path.of(file));
        WhatIfOptions options = WhatIfOptions.builder()
            .maxDepth(maxDepth)
            .format(parseEnum(WhatIfOptions.Format.class, format))
            .includeTemporal(!noTemporal)
            .build();
        return codec.toJson(engine(graph).whatIf(resolveNode(graph, node), options), true);
    }

    @ShellMethod(key = "query tensions", value = "List tradeoffs, grouped by axis or node")
    public String tensions(
            @ShellOption(help = "IR JSON or FlowScript file") String file,
            @ShellOption(value = "--group-by", defaultValue = "axis", help = "axis, node or none") String groupBy,
            @ShellOption(value = "--axis", defaultValue = ShellOption.NULL) String axis,
            @ShellOption(value = "--with-context", defaultValue = "false") boolean withContext,
            @ShellOption(value = "--scope", defaultValue = ShellOption.NULL) String scope) {
        FlowGraph graph = loadGraph(Path.of(file));
        TensionOptions options = TensionOptions.builder()
            .groupBy(parseEnum(TensionOptions.GroupBy.class, groupBy))
            .filterByAxis(axis)
            .includeContext(withContext)
            .scope(scope == null ? null : resolveNode(graph, scope))
            .build();
        return codec.toJson(engine(graph).tensions(options), true);
    }

    @ShellMethod(key = "query blocked", value = "List blockers by impact")
    public String blocked(
            @ShellOption(help = "IR JSON or FlowScript file") String file,
            @ShellOption(value = "--since", defaultValue = ShellOption.NULL, help = "ISO date, e.g. 2025-10-01") String since,
            @ShellOption(defaultValue = "detailed", help = "detailed, summary or list") String format) {
        FlowGraph graph = loadGraph(Path.of(file));
        BlockedOptions options = BlockedOptions.builder()
            .since(since == null ? null : parseDate(since))
            .format(parseEnum(BlockedOptions.Format.class, format))
            .build();
        return codec.toJson(engine(graph).blocked(options), true);
    }

    @ShellMethod(key = "query alternatives", value = "Reconstruct the decision around a question")
    public String alternatives(
            @ShellOption(help = "IR JSON or FlowScript file") String file,
            @ShellOption(help = "Question node id or exact content") String question,
            @ShellOption(defaultValue = "comparison", help = "comparison, simple or tree") String format,
            @ShellOption(value = "--hide-reasons", defaultValue = "false") boolean hideReasons) {
        FlowGraph graph = loadGraph(Path.of(file));
        AlternativesOptions options = AlternativesOptions.builder()
            .format(parseEnum(AlternativesOptions.Format.class, format))
            .showRejectedReasons(!hideReasons)
            .build();
        return codec.toJson(engine(graph).alternatives(resolveNode(graph, question), options), true);
    }

    private QueryEngine engine(FlowGraph graph) {
        return QueryEngine.load(graph, clock);
    }

    private FlowGraph parseSource(Path file) {
        try {
            return parser.parseFile(file);
        } catch (IOException e) {
            throw ioFailure("Cannot read " + file, e);
        }
    }

    private FlowGraph readIr(Path file) {
        try {
            return codec.read(file);
        } catch (IOException e) {
            throw ioFailure("Cannot read " + file, e);
        }
    }

    /**
     * Queries accept compiled IR or, for convenience, FlowScript source
     */
    private FlowGraph loadGraph(Path file) {
        if (file.getFileName().toString().endsWith(CorpusLinter.SOURCE_EXTENSION)) {
            return parseSource(file);
        }
        return validator.requireValid(readIr(file));
    }

    /**
     * An id, or the content of exactly one node
     */
    static String resolveNode(FlowGraph graph, String reference) {
        if (graph.findNode(reference).isPresent()) {
            return reference;
        }
        List<Node> matches = graph.getNodes().stream()
            .filter(n -> n.getContent().equals(reference))
            .collect(Collectors.toList());
        if (matches.size() > 1) {
            throw new FlowScriptException(ErrorCode.NOT_FOUND,
                String.format("'%s' matches %d nodes; use a node id", reference, matches.size()));
        }
        return matches.isEmpty() ? reference : matches.get(0).getId();
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value) {
        try {
            return Enum.valueOf(type, value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(String.format("Unknown %s '%s'", type.getSimpleName(), value), e);
        }
    }

    private static LocalDate parseDate(String value) {
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Expected an ISO date such as 2025-10-01, got " + value, e);
        }
    }

    private static FlowScriptException ioFailure(String message, IOException e) {
        log.debug(message, e);
        return new FlowScriptException(ErrorCode.IO_ERROR, message + ": " + e.getMessage(), e);
    }
}
