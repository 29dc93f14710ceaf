package io.treexform.core.rule;

import io.treexform.core.error.MatcherCompileException;
import io.treexform.core.meta.MetaVarEnv;
import io.treexform.core.tree.Node;
import io.treexform.core.tree.Position;

/**
 * Matches the node spanning exactly the given range. Lines and columns are zero-based; columns
 * count characters.
 */
public record RangeRule(int startLine, int startColumn, int endLine, int endColumn) implements Rule {

    public RangeRule {
        if (startLine < 0 || startColumn < 0 || endLine < 0 || endColumn < 0) {
            throw new MatcherCompileException("Range lines and columns must not be negative", "range");
        }
        if (startLine > endLine || (startLine == endLine && startColumn > endColumn)) {
            throw new MatcherCompileException(
                    "Range start " + startLine + ":" + startColumn + " is after end " + endLine + ":" + endColumn,
                    "range");
        }
    }

    @Override
    public boolean matchNode(Node node, MetaVarEnv env) {
        Position start = node.start();
        Position end = node.end();
        return start.line() == startLine
                && start.column() == startColumn
                && end.line() == endLine
                && end.column() == endColumn;
    }

    @Override
    public boolean isPositive() {
        return true;
    }
}
