package ai.lintal.cst;

import ai.lintal.source.SourceText;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of a concrete syntax tree node. Rules and the dispatcher depend only on this contract, never on the
 * parser's own node representation.
 *
 * <p>Implementations must be cheap to create and compare: two instances are {@code equal} iff they denote the same node
 * of the same tree. Nodes are only valid while the tree that produced them is alive.
 */
public interface CstNode {

    /**
     * Grammar kind, e.g. {@code local_variable_declaration}; anonymous tokens use their literal text, e.g.
     * {@code ;}.
     */
    String kind();

    /** False for anonymous tokens such as punctuation and keywords. */
    boolean isNamed();

    List<CstNode> children();

    Optional<CstNode> childByFieldName(String fieldName);

    Optional<CstNode> parent();

    int startByte();

    int endByte();

    default TextRange range() {
        return new TextRange(startByte(), endByte());
    }

    default List<CstNode> namedChildren() {
        var named = new ArrayList<CstNode>();
        for (var child : children()) {
            if (child.isNamed()) {
                named.add(child);
            }
        }
        return named;
    }

    /** Direct children of the given kind, in source order. */
    default List<CstNode> childrenOfKind(String kind) {
        var matching = new ArrayList<CstNode>();
        for (var child : children()) {
            if (kind.equals(child.kind())) {
                matching.add(child);
            }
        }
        return matching;
    }

    default Optional<CstNode> firstChildOfKind(String kind) {
        for (var child : children()) {
            if (kind.equals(child.kind())) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    default boolean is(String kind) {
        return kind.equals(kind());
    }

    /** Parser error-recovery node. */
    default boolean isError() {
        return "ERROR".equals(kind());
    }

    default String text(SourceText source) {
        return source.slice(range());
    }
}
