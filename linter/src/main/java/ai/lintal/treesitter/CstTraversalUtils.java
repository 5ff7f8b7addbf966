package ai.lintal.treesitter;

import ai.lintal.cst.CstNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/** Common syntax tree traversal patterns shared by the rules. */
public final class CstTraversalUtils {

    private CstTraversalUtils() {}

    /** Recursively finds all nodes matching the given predicate, in pre-order. */
    public static List<CstNode> findAllNodesRecursive(CstNode rootNode, Predicate<CstNode> predicate) {
        var results = new ArrayList<CstNode>();
        findAllNodesRecursiveInternal(rootNode, predicate, results);
        return results;
    }

    private static void findAllNodesRecursiveInternal(
            CstNode node, Predicate<CstNode> predicate, List<CstNode> results) {
        if (predicate.test(node)) {
            results.add(node);
        }
        for (var child : node.children()) {
            findAllNodesRecursiveInternal(child, predicate, results);
        }
    }

    public static List<CstNode> findAllNodesByType(CstNode rootNode, String nodeType) {
        return findAllNodesRecursive(rootNode, node -> nodeType.equals(node.kind()));
    }

    /** Strips any number of enclosing parentheses. */
    public static CstNode unwrapParentheses(CstNode node) {
        var current = node;
        while (current.is(JavaNodeTypes.PARENTHESIZED_EXPRESSION)) {
            var inner = current.namedChildren().stream()
                    .filter(c -> !JavaNodeTypes.isComment(c.kind()))
                    .findFirst();
            if (inner.isEmpty()) {
                break;
            }
            current = inner.get();
        }
        return current;
    }

    /** True if the declaration's modifiers include {@code final}. */
    public static boolean hasFinalModifier(CstNode declaration) {
        for (var child : declaration.children()) {
            if (child.is(JavaNodeTypes.FINAL)) {
                return true;
            }
            if (child.is(JavaNodeTypes.MODIFIERS)) {
                return child.firstChildOfKind(JavaNodeTypes.FINAL).isPresent();
            }
        }
        return false;
    }

    /** Next sibling that is not a comment, if any. */
    public static Optional<CstNode> nextSibling(CstNode node) {
        var parent = node.parent();
        if (parent.isEmpty()) {
            return Optional.empty();
        }
        boolean seen = false;
        for (var child : parent.get().children()) {
            if (seen && !JavaNodeTypes.isComment(child.kind())) {
                return Optional.of(child);
            }
            if (child.equals(node)) {
                seen = true;
            }
        }
        return Optional.empty();
    }
}
