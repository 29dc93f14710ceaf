package io.treexform.core.transform;

import io.treexform.core.meta.MetaVarEnv;
import io.treexform.core.replace.Indentation;
import io.treexform.core.tree.Node;
import java.util.List;
import java.util.Optional;

/** Reads a transform's source variable, de-indented to column zero. */
final class SourceValue {

    private SourceValue() {}

    static Optional<String> of(MetaVarEnv env, String name) {
        Optional<Node> single = env.get(name);
        if (single.isPresent()) {
            return Optional.of(deindent(single.get().text(), single.get()));
        }
        if (env.hasMulti(name)) {
            List<Node> nodes = env.getMulti(name);
            String text = env.text(name).orElse("");
            return Optional.of(nodes.isEmpty() ? text : deindent(text, nodes.get(0)));
        }
        return env.getTransformed(name);
    }

    static String deindent(String text, Node first) {
        return Indentation.indentLines(text, Indentation.indentOf(first), 0);
    }
}
