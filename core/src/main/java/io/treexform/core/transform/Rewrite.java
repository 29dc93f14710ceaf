package io.treexform.core.transform;

import io.treexform.core.match.NodeMatch;
import io.treexform.core.meta.MetaVarEnv;
import io.treexform.core.rule.RuleCore;
import io.treexform.core.rule.RuleRegistration;
import io.treexform.core.tree.Edit;
import io.treexform.core.tree.Node;
import io.treexform.core.tree.SourceText;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Applies rewriters to the nodes of the source variable.
 *
 * <p>
 * Nodes are visited in pre-order. At each node the rewriters are tried in the listed order and
 * the first one that matches replaces the node; its subtree is not visited further. Without
 * {@code joinBy} the replacements are spliced into the source text. With {@code joinBy} only the
 * replacements are kept, joined by that string.
 */
public record Rewrite(String source, List<String> rewriters, String joinBy) implements Trans {

    public Rewrite {
        Objects.requireNonNull(source, "source must not be null");
        rewriters = List.copyOf(rewriters);
    }

    @Override
    public Optional<String> apply(MetaVarEnv env, RuleRegistration registration) {
        List<Node> nodes = env.get(source).map(List::of).orElseGet(() -> env.getMulti(source));
        if (nodes.isEmpty()) {
            return env.hasMulti(source) ? Optional.of("") : env.getTransformed(source);
        }
        List<RuleCore> cores = new ArrayList<>(rewriters.size());
        for (String id : rewriters) {
            registration.rewriter(id).ifPresent(cores::add);
        }
        List<Edit> edits = new ArrayList<>();
        for (Node node : nodes) {
            collect(node, cores, edits);
        }
        if (joinBy != null) {
            List<String> fragments = new ArrayList<>(edits.size());
            edits.forEach(edit -> fragments.add(edit.insertedText()));
            return Optional.of(String.join(joinBy, fragments));
        }
        Node first = nodes.get(0);
        Node last = nodes.get(nodes.size() - 1);
        SourceText text = first.tree().source();
        StringBuilder out = new StringBuilder();
        int cursor = first.startByte();
        for (Edit edit : edits) {
            if (edit.position() < cursor) {
                continue;
            }
            out.append(text.slice(cursor, edit.position())).append(edit.insertedText());
            cursor = edit.endPosition();
        }
        out.append(text.slice(cursor, Math.max(cursor, last.endByte())));
        return Optional.of(SourceValue.deindent(out.toString(), first));
    }

    private static void collect(Node root, List<RuleCore> cores, List<Edit> edits) {
        Deque<Node> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            Node node = pending.pop();
            Optional<Edit> edit = rewrite(node, cores);
            if (edit.isPresent()) {
                edits.add(edit.get());
                continue;
            }
            List<Node> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
    }

    private static Optional<Edit> rewrite(Node node, List<RuleCore> cores) {
        for (RuleCore core : cores) {
            Optional<NodeMatch> match = core.match(node);
            if (match.isPresent()) {
                return Optional.of(core.fixers().get(0).edit(match.get()));
            }
        }
        return Optional.empty();
    }
}
