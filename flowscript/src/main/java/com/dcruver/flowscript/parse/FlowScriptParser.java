package com.dcruver.flowscript.parse;

import com.dcruver.flowscript.ir.FlowGraph;
import com.dcruver.flowscript.ir.GraphInvariants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Compiles FlowScript source text into a {@link FlowGraph}.
 *
 * <p>Each call is independent: preprocess, tokenize, descend, assemble. Any
 * {@link com.dcruver.flowscript.exception.IndentationException} or
 * {@link com.dcruver.flowscript.exception.ParseException} fails the whole document.
 */
@Component
@Slf4j
public class FlowScriptParser {

    private static final String ANONYMOUS_SOURCE = "<input>";

    private final ParserProperties properties;
    private final IndentationScanner scanner;
    private final Clock clock;

    public FlowScriptParser() {
        this(new ParserProperties(), Clock.systemUTC());
    }

    @Autowired
    public FlowScriptParser(ParserProperties properties, Clock clock) {
        this.properties = properties;
        this.scanner = new IndentationScanner(properties.getIndentUnit());
        this.clock = clock;
    }

    /**
     * Read and parse a FlowScript file
     */
    public FlowGraph parseFile(Path file) throws IOException {
        return parse(Files.readString(file), file.getFileName().toString());
    }

    public FlowGraph parse(String text, String sourceFile) {
        String file = sourceFile == null ? ANONYMOUS_SOURCE : sourceFile;
        return parse(scanner.process(text, file), file);
    }

    /**
     * Parse text that has already been through the indentation scanner
     */
    public FlowGraph parse(ScanResult scan, String sourceFile) {
        String file = sourceFile == null ? ANONYMOUS_SOURCE : sourceFile;
        Instant parsedAt = clock.instant();

        List<Token> tokens = new FlowScriptLexer(scan, file).tokenize();
        GraphAssembler assembler = new GraphAssembler(scan, file, parsedAt,
            properties.getAuthor().toAuthor(), properties.getProducer());
        new ParseSession(tokens, scan, file, assembler, properties.isRequireTensionAxis()).parseDocument();

        FlowGraph graph = assembler.build();
        graph = graph.withInvariants(GraphInvariants.of(graph));

        log.info("Parsed {}: {} nodes, {} relationships, {} states",
            file, graph.getNodes().size(), graph.getRelationships().size(), graph.getStates().size());
        return graph;
    }
}
