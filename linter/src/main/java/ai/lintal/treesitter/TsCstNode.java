package ai.lintal.treesitter;

import ai.lintal.cst.CstNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;
import org.treesitter.TSTree;

/**
 * {@link CstNode} backed by a tree-sitter node. Each instance keeps a reference to its {@link TSTree} so the native
 * tree stays alive for as long as any of its nodes is reachable.
 */
public final class TsCstNode implements CstNode {
    private final TSTree tree;
    private final TSNode node;
    private @Nullable List<CstNode> children;

    TsCstNode(TSTree tree, TSNode node) {
        this.tree = tree;
        this.node = node;
    }

    /** Wraps a node, returning empty for tree-sitter's null node. */
    static Optional<CstNode> wrap(TSTree tree, @Nullable TSNode node) {
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        return Optional.of(new TsCstNode(tree, node));
    }

    @Override
    public String kind() {
        return node.getType();
    }

    @Override
    public boolean isNamed() {
        return node.isNamed();
    }

    @Override
    public List<CstNode> children() {
        var cached = children;
        if (cached == null) {
            int count = node.getChildCount();
            var list = new ArrayList<CstNode>(count);
            for (int i = 0; i < count; i++) {
                wrap(tree, node.getChild(i)).ifPresent(list::add);
            }
            cached = Collections.unmodifiableList(list);
            children = cached;
        }
        return cached;
    }

    @Override
    public Optional<CstNode> childByFieldName(String fieldName) {
        return wrap(tree, node.getChildByFieldName(fieldName));
    }

    @Override
    public Optional<CstNode> parent() {
        return wrap(tree, node.getParent());
    }

    @Override
    public int startByte() {
        return node.getStartByte();
    }

    @Override
    public int endByte() {
        return node.getEndByte();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TsCstNode other)) return false;
        return tree == other.tree
                && node.getStartByte() == other.node.getStartByte()
                && node.getEndByte() == other.node.getEndByte()
                && node.getType().equals(other.node.getType());
    }

    @Override
    public int hashCode() {
        return Objects.hash(node.getStartByte(), node.getEndByte(), node.getType());
    }

    @Override
    public String toString() {
        return kind() + "[" + startByte() + ".." + endByte() + "]";
    }
}
