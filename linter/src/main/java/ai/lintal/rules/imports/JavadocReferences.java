package ai.lintal.rules.imports;

import com.google.common.base.Splitter;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/** Extracts the simple type names a Javadoc comment refers to through inline and block tags. */
final class JavadocReferences {
    private static final Pattern INLINE_TAG = Pattern.compile("\\{@(?:link|linkplain|value)\\s+([^}]*)}");
    private static final Pattern BLOCK_TAG = Pattern.compile("@(?:see|throws|exception)\\s+([^\\s(]+(?:\\([^)]*\\))?)");
    private static final Splitter ARGUMENT_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    private JavadocReferences() {}

    static boolean isJavadoc(String commentText) {
        return commentText.startsWith("/**");
    }

    static Set<String> collect(String commentText) {
        var names = new LinkedHashSet<String>();
        var inline = INLINE_TAG.matcher(commentText);
        while (inline.find()) {
            addReference(referenceOf(inline.group(1).trim()), names);
        }
        var block = BLOCK_TAG.matcher(commentText);
        while (block.find()) {
            addReference(block.group(1), names);
        }
        return names;
    }

    /** Drops the label of an inline tag: the reference ends at the first blank outside parentheses. */
    private static String referenceOf(String tagContent) {
        int depth = 0;
        for (int i = 0; i < tagContent.length(); i++) {
            char c = tagContent.charAt(i);
            if (c == '(') depth++;
            else if (c == ')') depth--;
            else if (Character.isWhitespace(c) && depth <= 0) return tagContent.substring(0, i);
        }
        return tagContent;
    }

    /** {@code Map.Entry#get(List, int[])} contributes {@code Map}, {@code List} and {@code int}. */
    private static void addReference(String reference, Set<String> names) {
        int paren = reference.indexOf('(');
        var target = paren < 0 ? reference : reference.substring(0, paren);
        int hash = target.indexOf('#');
        addFirstSegment(hash < 0 ? target : target.substring(0, hash), names);
        if (paren >= 0) {
            int close = reference.lastIndexOf(')');
            var arguments = reference.substring(paren + 1, close > paren ? close : reference.length());
            for (var argument : ARGUMENT_SPLITTER.split(arguments)) {
                addFirstSegment(argument, names);
            }
        }
    }

    private static void addFirstSegment(String qualifiedName, Set<String> names) {
        var trimmed = qualifiedName.trim();
        int end = 0;
        while (end < trimmed.length() && Character.isJavaIdentifierPart(trimmed.charAt(end))) {
            end++;
        }
        if (end > 0) {
            names.add(trimmed.substring(0, end));
        }
    }
}
