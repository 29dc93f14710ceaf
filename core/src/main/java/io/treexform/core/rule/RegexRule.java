package io.treexform.core.rule;

import io.treexform.core.error.MatcherCompileException;
import io.treexform.core.meta.MetaVarEnv;
import io.treexform.core.tree.Node;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/** Matches nodes whose text contains a match of a regular expression. */
public record RegexRule(Pattern regex) implements Rule {

    /**
     * Compiles {@code regex}.
     *
     * @throws MatcherCompileException if the expression is invalid
     */
    public static RegexRule of(String regex) {
        try {
            return new RegexRule(Pattern.compile(regex));
        } catch (PatternSyntaxException e) {
            throw new MatcherCompileException("Invalid regex '" + regex + "': " + e.getDescription(), e, "regex");
        }
    }

    @Override
    public boolean matchNode(Node node, MetaVarEnv env) {
        return regex.matcher(node.text()).find();
    }

    @Override
    public boolean isPositive() {
        return true;
    }
}
