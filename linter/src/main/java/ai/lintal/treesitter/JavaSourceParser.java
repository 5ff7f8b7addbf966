package ai.lintal.treesitter;

import ai.lintal.cst.CstNode;
import ai.lintal.source.SourceText;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSParser;
import org.treesitter.TreeSitterJava;

/**
 * Parses Java source with the tree-sitter Java grammar.
 *
 * <p>Not thread-safe: TSParser is not threadsafe, so callers that parse concurrently keep one instance per thread.
 */
public final class JavaSourceParser {
    private static final Logger logger = LogManager.getLogger(JavaSourceParser.class);

    private static final char BOM = '\uFEFF';

    private final TSParser parser;

    public JavaSourceParser() {
        parser = new TSParser();
        if (!parser.setLanguage(new TreeSitterJava())) {
            logger.error("Failed to set language on TSParser for {}", TreeSitterJava.class.getSimpleName());
        }
    }

    /** Removes a leading byte order mark, which tree-sitter would otherwise count as source bytes. */
    public static String stripBom(String text) {
        return !text.isEmpty() && text.charAt(0) == BOM ? text.substring(1) : text;
    }

    public ParsedSource parse(String text) throws SourceParseException {
        return parse(text, null);
    }

    public ParsedSource parse(String text, @Nullable String fileName) throws SourceParseException {
        var cleaned = stripBom(text);
        var source = new SourceText(cleaned);
        try {
            var tree = parser.parseString(null, cleaned);
            if (tree == null) {
                throw new SourceParseException("parser returned no tree", fileName);
            }
            var root = TsCstNode.wrap(tree, tree.getRootNode())
                    .orElseThrow(() -> new SourceParseException("tree has no root node", fileName));
            if (root.isError() || hasErrorChild(root)) {
                logger.debug("Syntax errors in {}; analyzing the recovered tree", fileName);
            }
            return new ParsedSource(fileName, source, root);
        } catch (RuntimeException e) {
            throw new SourceParseException(String.valueOf(e.getMessage()), e, fileName);
        }
    }

    private static boolean hasErrorChild(CstNode root) {
        return root.children().stream().anyMatch(CstNode::isError);
    }
}
