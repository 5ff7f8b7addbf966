package ai.lintal.engine;

import ai.lintal.rules.CheckContext;
import ai.lintal.treesitter.JavaSourceParser;
import ai.lintal.treesitter.ParsedSource;
import ai.lintal.treesitter.SourceParseException;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** Parses one source text and runs a rule set over it. Safe to share between threads. */
public final class LintEngine {
    private static final Logger logger = LogManager.getLogger(LintEngine.class);

    private final RuleSet ruleSet;
    private final TreeDispatcher dispatcher;
    private final ThreadLocal<JavaSourceParser> threadLocalParser = ThreadLocal.withInitial(JavaSourceParser::new);

    public LintEngine(RuleSet ruleSet) {
        this.ruleSet = ruleSet;
        this.dispatcher = new TreeDispatcher(ruleSet);
    }

    public RuleSet ruleSet() {
        return ruleSet;
    }

    public ParsedSource parse(String text, @Nullable String fileName) throws SourceParseException {
        return threadLocalParser.get().parse(text, fileName);
    }

    /** Raw diagnostics in dispatch order, with byte ranges and fixes. */
    public List<RuleDiagnostic> analyze(ParsedSource parsed) {
        var ctx = new CheckContext(parsed.source(), parsed.fileName());
        return dispatcher.dispatch(ctx, parsed.root());
    }

    public List<RuleDiagnostic> analyze(String text) throws SourceParseException {
        return analyze(parse(text, null));
    }

    /** Lints one in-memory file; a parse failure yields an unanalyzable result instead of an exception. */
    public FileLintResult lint(String fileName, String text) {
        ParsedSource parsed;
        try {
            parsed = parse(text, fileName);
        } catch (SourceParseException e) {
            logger.warn("Skipping {}: {}", fileName, e.getMessage());
            return FileLintResult.unanalyzable(fileName, e.getMessage());
        }
        var reported = analyze(parsed).stream()
                .map(d -> ReportedDiagnostic.from(d, parsed.source()))
                .toList();
        logger.debug("{}: {} diagnostics", fileName, reported.size());
        return FileLintResult.analyzed(fileName, reported);
    }
}
