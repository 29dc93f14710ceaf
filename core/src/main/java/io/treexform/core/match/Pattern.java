package io.treexform.core.match;

import io.treexform.core.error.PatternParseException;
import io.treexform.core.meta.MetaVarEnv;
import io.treexform.core.meta.MetaVariable;
import io.treexform.core.spi.Language;
import io.treexform.core.tree.Node;
import io.treexform.core.tree.SyntaxTree;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A compiled code pattern such as {@code console.log($$$ARGS)}.
 *
 * <p>
 * The pattern text is parsed with the target language and reduced to a single root: starting from
 * the top-level node, wrappers that have exactly one child covering the same text are peeled off.
 * A fragment that is not valid on its own can be given as a larger {@code context} plus a {@code
 * selector} kind naming the node to use.
 *
 * <p>
 * Immutable and thread-safe.
 */
public final class Pattern implements Matcher {

    /** Default bound on the steps one root match may spend backtracking over ellipses. */
    public static final int DEFAULT_MAX_ELLIPSIS_STEPS = 65_536;

    private final String source;
    private final PatternNode root;
    private final MatchStrictness strictness;
    private final int maxEllipsisSteps;

    private Pattern(String source, PatternNode root, MatchStrictness strictness, int maxEllipsisSteps) {
        this.source = source;
        this.root = root;
        this.strictness = strictness;
        this.maxEllipsisSteps = maxEllipsisSteps;
    }

    /** Compiles {@code pattern} with {@link MatchStrictness#SMART}. */
    public static Pattern compile(Language language, String pattern) {
        return compile(language, pattern, MatchStrictness.SMART);
    }

    /**
     * Compiles a pattern.
     *
     * @param language   the target language
     * @param pattern    the pattern text
     * @param strictness how closely candidates must follow the pattern
     * @return the compiled pattern
     * @throws PatternParseException if the pattern is empty, has syntax errors or is more than one
     *                               node
     */
    public static Pattern compile(Language language, String pattern, MatchStrictness strictness) {
        Objects.requireNonNull(language, "language must not be null");
        Objects.requireNonNull(pattern, "pattern must not be null");
        Objects.requireNonNull(strictness, "strictness must not be null");
        if (pattern.isBlank()) {
            throw new PatternParseException("Pattern must not be empty", pattern);
        }
        SyntaxTree tree = parseCleanly(language, pattern);
        List<Node> top = nonMissingChildren(tree.root());
        if (top.isEmpty()) {
            throw new PatternParseException("Pattern must not be empty", pattern);
        }
        if (top.size() > 1) {
            throw new PatternParseException(
                    "Pattern contains more than one top-level node, use context and selector", pattern);
        }
        char expando = language.expandoChar();
        Node node = top.get(0);
        while (MetaVariable.parse(node.text(), expando).isEmpty()) {
            List<Node> children = nonMissingChildren(node);
            if (children.size() != 1 || !sameRange(node, children.get(0))) {
                break;
            }
            node = children.get(0);
        }
        return new Pattern(pattern, convert(node, expando), strictness, DEFAULT_MAX_ELLIPSIS_STEPS);
    }

    /**
     * Compiles the node of kind {@code selector} found inside {@code context}.
     *
     * @param language   the target language
     * @param context    surrounding code that makes the fragment parse
     * @param selector   kind of the node to use as the pattern root
     * @param strictness how closely candidates must follow the pattern
     * @return the compiled pattern
     * @throws PatternParseException if the context does not parse or contains no such node
     */
    public static Pattern compile(Language language, String context, String selector, MatchStrictness strictness) {
        Objects.requireNonNull(language, "language must not be null");
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(selector, "selector must not be null");
        Objects.requireNonNull(strictness, "strictness must not be null");
        if (context.isBlank()) {
            throw new PatternParseException("Pattern must not be empty", context);
        }
        if (language.kindId(selector) == 0) {
            throw new PatternParseException("Unknown selector kind '" + selector + "'", context);
        }
        SyntaxTree tree = parseCleanly(language, context);
        for (Node node : tree.root().dfs()) {
            if (!node.isMissing() && node.kind().equals(selector)) {
                return new Pattern(
                        context, convert(node, language.expandoChar()), strictness, DEFAULT_MAX_ELLIPSIS_STEPS);
            }
        }
        throw new PatternParseException("Selector kind '" + selector + "' not found in context", context);
    }

    /** A copy of this pattern matching with another strictness. */
    public Pattern withStrictness(MatchStrictness newStrictness) {
        return new Pattern(source, root, Objects.requireNonNull(newStrictness), maxEllipsisSteps);
    }

    /** A copy of this pattern with another backtracking step budget. */
    public Pattern withMaxEllipsisSteps(int steps) {
        if (steps <= 0) {
            throw new IllegalArgumentException("steps must be positive: " + steps);
        }
        return new Pattern(source, root, strictness, steps);
    }

    public String source() {
        return source;
    }

    public PatternNode root() {
        return root;
    }

    public MatchStrictness strictness() {
        return strictness;
    }

    /** Names of every single and ellipsis variable the pattern captures. */
    public Set<String> definedVariables() {
        Set<String> names = new LinkedHashSet<>();
        collectVariables(root, names);
        return Collections.unmodifiableSet(names);
    }

    @Override
    public boolean matchNode(Node node, MetaVarEnv env) {
        return new TreeMatcher(strictness, maxEllipsisSteps).matchRoot(root, node, env);
    }

    @Override
    public BitSet potentialKinds() {
        int kind;
        if (root instanceof PatternNode.Terminal terminal) {
            kind = terminal.kindId();
        } else if (root instanceof PatternNode.Internal internal) {
            kind = internal.kindId();
        } else {
            return null;
        }
        if (kind == PatternNode.ERROR_KIND) {
            return null;
        }
        BitSet kinds = new BitSet();
        kinds.set(kind);
        return kinds;
    }

    @Override
    public String toString() {
        return "Pattern[" + source + "]";
    }

    // --- Compilation helpers ---

    private static SyntaxTree parseCleanly(Language language, String text) {
        SyntaxTree tree = SyntaxTree.parse(language, language.preProcessPattern(text));
        for (Node node : tree.root().dfs()) {
            if (node.isError()) {
                throw new PatternParseException("Pattern has a syntax error at byte " + node.startByte(), text);
            }
        }
        return tree;
    }

    private static PatternNode convert(Node node, char expando) {
        var variable = MetaVariable.parse(node.text(), expando);
        if (variable.isPresent()) {
            return new PatternNode.MetaVar(variable.get());
        }
        List<Node> children = nonMissingChildren(node);
        if (children.isEmpty()) {
            return new PatternNode.Terminal(node.kindId(), node.text(), node.isNamed());
        }
        List<PatternNode> converted = new ArrayList<>(children.size());
        for (Node child : children) {
            converted.add(convert(child, expando));
        }
        return new PatternNode.Internal(node.kindId(), converted);
    }

    private static List<Node> nonMissingChildren(Node node) {
        List<Node> children = new ArrayList<>();
        for (Node child : node.children()) {
            if (!child.isMissing()) {
                children.add(child);
            }
        }
        return children;
    }

    private static boolean sameRange(Node a, Node b) {
        return a.startByte() == b.startByte() && a.endByte() == b.endByte();
    }

    private static void collectVariables(PatternNode node, Set<String> names) {
        if (node instanceof PatternNode.MetaVar metaVar) {
            metaVar.variable().name().ifPresent(names::add);
        } else if (node instanceof PatternNode.Internal internal) {
            for (PatternNode child : internal.children()) {
                collectVariables(child, names);
            }
        }
    }
}
