package ai.lintal.treesitter;

import ai.lintal.cst.CstNode;
import ai.lintal.source.SourceText;
import org.jetbrains.annotations.Nullable;

/** A parsed file: its source index and the root of its syntax tree. */
public record ParsedSource(@Nullable String fileName, SourceText source, CstNode root) {}
