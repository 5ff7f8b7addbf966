package ai.lintal.tools;

import ai.lintal.cst.CstNode;
import ai.lintal.source.SourceText;
import ai.lintal.treesitter.JavaSourceParser;
import ai.lintal.treesitter.SourceParseException;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Prints the syntax tree of the Java source read from stdin, one node per line:
 * {@code kind [startRow:startCol-endRow:endCol]}, plus a text preview for leaves. Rows are 1-indexed, columns are
 * 0-indexed byte columns.
 *
 * <p>Usage: {@code cat MyClass.java | java ai.lintal.tools.DumpJavaTree}
 */
public final class DumpJavaTree {
    private static final int PREVIEW_LENGTH = 40;

    private DumpJavaTree() {}

    public static void main(String[] args) throws IOException {
        var source = new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
        if (source.isBlank()) {
            System.err.println("Error: No input provided. Pipe a Java file to stdin.");
            System.err.println("Usage: cat MyClass.java | java ai.lintal.tools.DumpJavaTree");
            System.exit(1);
        }
        try {
            var parsed = new JavaSourceParser().parse(source);
            dump(parsed.root(), parsed.source(), System.out);
        } catch (SourceParseException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }

    public static void dump(CstNode root, SourceText source, PrintStream out) {
        print(root, source, out, 0);
    }

    private static void print(CstNode node, SourceText source, PrintStream out, int depth) {
        var line = new StringBuilder();
        line.append("  ".repeat(depth)).append(node.kind()).append(" [").append(position(source, node.startByte()))
                .append('-').append(position(source, node.endByte())).append(']');
        var children = node.children();
        if (children.isEmpty()) {
            line.append(" \"").append(preview(node.text(source))).append('"');
        }
        out.println(line);
        for (var child : children) {
            print(child, source, out, depth + 1);
        }
    }

    private static String position(SourceText source, int byteOffset) {
        int row = source.lineOf(byteOffset);
        return row + ":" + (byteOffset - source.lineStart(row));
    }

    private static String preview(String text) {
        var preview = new StringBuilder();
        text.codePoints().limit(PREVIEW_LENGTH).forEach(cp -> {
            if (cp == '\n') {
                preview.append('\u21B5');
            } else {
                preview.appendCodePoint(cp);
            }
        });
        return preview.toString();
    }
}
