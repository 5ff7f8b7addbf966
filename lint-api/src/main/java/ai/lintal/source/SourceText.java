package ai.lintal.source;

import ai.lintal.cst.TextRange;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Source text of one file together with its UTF-8 encoding and a line index. Tree-sitter reports byte offsets while
 * Java strings are indexed by UTF-16 chars, so every offset conversion in the engine goes through this class.
 *
 * <p>Immutable and safe to share between threads once constructed.
 */
public final class SourceText {
    private static final Logger logger = LogManager.getLogger(SourceText.class);

    private final String text;
    private final byte[] bytes;
    private final int[] lineStarts;

    public SourceText(String text) {
        this.text = text;
        this.bytes = text.getBytes(StandardCharsets.UTF_8);
        this.lineStarts = computeLineStarts(bytes);
    }

    private static int[] computeLineStarts(byte[] bytes) {
        var starts = new int[16];
        int count = 0;
        starts[count++] = 0;
        for (int i = 0; i < bytes.length; i++) {
            byte b = bytes[i];
            boolean lineBreak = b == '\n' || (b == '\r' && (i + 1 >= bytes.length || bytes[i + 1] != '\n'));
            if (lineBreak) {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        return Arrays.copyOf(starts, count);
    }

    public String text() {
        return text;
    }

    /** Length of the UTF-8 encoding, i.e. the exclusive upper bound for byte offsets. */
    public int byteLength() {
        return bytes.length;
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /** 1-indexed line containing the given byte offset; offsets past the end map to the last line. */
    public int lineOf(int byteOffset) {
        int clamped = Math.max(0, Math.min(byteOffset, bytes.length));
        int idx = Arrays.binarySearch(lineStarts, clamped);
        if (idx < 0) {
            idx = -idx - 2;
        }
        return idx + 1;
    }

    /** Byte offset where the given 1-indexed line starts. */
    public int lineStart(int line) {
        checkLine(line);
        return lineStarts[line - 1];
    }

    /** Byte offset of the end of the given line, excluding its terminator. */
    public int lineEnd(int line) {
        checkLine(line);
        int end = line < lineStarts.length ? lineStarts[line] : bytes.length;
        while (end > lineStarts[line - 1] && (bytes[end - 1] == '\n' || bytes[end - 1] == '\r')) {
            end--;
        }
        return end;
    }

    /** Byte offset just past the given line's terminator, or the end of the text for the last line. */
    public int nextLineStart(int line) {
        checkLine(line);
        return line < lineStarts.length ? lineStarts[line] : bytes.length;
    }

    private void checkLine(int line) {
        if (line < 1 || line > lineStarts.length) {
            throw new IllegalArgumentException("Line " + line + " outside 1.." + lineStarts.length);
        }
    }

    /** 1-indexed line and column; the column counts chars from the start of the line. */
    public SourceLocation location(int byteOffset) {
        int line = lineOf(byteOffset);
        int start = lineStarts[line - 1];
        int clamped = Math.max(start, Math.min(byteOffset, bytes.length));
        int column = new String(bytes, start, clamped - start, StandardCharsets.UTF_8).length() + 1;
        return new SourceLocation(line, column);
    }

    /** Leading spaces and tabs of the given line. */
    public String indentation(int line) {
        int start = lineStart(line);
        int end = start;
        while (end < bytes.length && (bytes[end] == ' ' || bytes[end] == '\t')) {
            end++;
        }
        return new String(bytes, start, end - start, StandardCharsets.UTF_8);
    }

    /** True if only spaces and tabs lie between the two byte offsets. */
    public boolean isBlank(int startByte, int endByte) {
        for (int i = Math.max(0, startByte); i < Math.min(endByte, bytes.length); i++) {
            if (bytes[i] != ' ' && bytes[i] != '\t') {
                return false;
            }
        }
        return true;
    }

    public String slice(TextRange range) {
        return slice(range.start(), range.end());
    }

    /**
     * Extracts the text between two UTF-8 byte offsets. Out-of-range requests are clamped and logged instead of
     * throwing, since a malformed range from one node must not abort the analysis of the file.
     */
    public String slice(int startByte, int endByte) {
        if (startByte < 0 || endByte < startByte) {
            logger.warn(
                    "Requested bytes outside valid range for source text (length: {} bytes): startByte={}, endByte={}",
                    bytes.length,
                    startByte,
                    endByte);
            return "";
        }
        if (startByte == endByte) {
            return "";
        }
        if (startByte >= bytes.length) {
            logger.warn("Start byte offset {} exceeds source byte length {}", startByte, bytes.length);
            return "";
        }
        if (endByte > bytes.length) {
            logger.warn("End byte offset {} exceeds source byte length {}, truncating", endByte, bytes.length);
            endByte = bytes.length;
        }
        return new String(bytes, startByte, endByte - startByte, StandardCharsets.UTF_8);
    }

    /** Converts a UTF-8 byte offset into a position in {@link #text()}. */
    public int charOffset(int byteOffset) {
        if (byteOffset <= 0) return 0;
        if (byteOffset >= bytes.length) return text.length();
        return new String(bytes, 0, byteOffset, StandardCharsets.UTF_8).length();
    }

    /** Converts a position in {@link #text()} into a UTF-8 byte offset. */
    public int byteOffset(int charOffset) {
        if (charOffset <= 0) return 0;
        if (charOffset >= text.length()) return bytes.length;
        return text.substring(0, charOffset).getBytes(StandardCharsets.UTF_8).length;
    }
}
