package io.treexform.core.replace;

import io.treexform.core.error.FixerException;
import io.treexform.core.meta.MetaVarEnv;
import io.treexform.core.meta.MetaVariable;
import io.treexform.core.spi.Language;
import io.treexform.core.tree.Node;
import io.treexform.core.tree.SourceText;
import io.treexform.core.tree.SyntaxTree;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A fix template such as {@code console.warn($$$ARGS)}.
 *
 * <p>
 * The template is parsed once in the rule's language. Every named leaf whose text is a capturing
 * meta-variable becomes a slot; everything else is copied verbatim. Rendering fills each slot
 * with the text bound in the match environment and shifts multi-line captures from the
 * indentation they had in the source to the indentation of the slot.
 *
 * <p>
 * Immutable and thread-safe.
 */
public final class TemplateFix {

    private final String template;
    private final List<Slot> slots;

    /** A meta-variable occurrence in the template, in {@link String} indices. */
    record Slot(int start, int end, String variable, int indent) {}

    private TemplateFix(String template, List<Slot> slots) {
        this.template = template;
        this.slots = slots;
    }

    /**
     * Parses a template.
     *
     * @param language the rule's language
     * @param template template text
     * @return the parsed template
     * @throws FixerException if the template is not valid code in {@code language}
     */
    public static TemplateFix parse(Language language, String template) {
        Objects.requireNonNull(template, "template must not be null");
        SyntaxTree tree = SyntaxTree.parse(language, language.preProcessPattern(template));
        List<Slot> slots = new ArrayList<>();
        collectSlots(tree.root(), template, tree.source(), language.expandoChar(), slots);
        return new TemplateFix(template, Collections.unmodifiableList(slots));
    }

    private static void collectSlots(Node node, String template, SourceText source, char expando, List<Slot> slots) {
        if (node.isError()) {
            throw new FixerException("Fix template has a syntax error at byte " + node.startByte() + ": '" + template + "'");
        }
        if (node.isMissing()) {
            return;
        }
        if (node.isNamedLeaf()) {
            Optional<String> name = MetaVariable.parse(node.text(), expando).flatMap(MetaVariable::name);
            if (name.isPresent()) {
                int start = source.charIndex(node.startByte());
                int end = source.charIndex(node.endByte());
                slots.add(new Slot(start, end, name.get(), Indentation.indentAt(template, start)));
            }
            return;
        }
        for (Node child : node.children()) {
            collectSlots(child, template, source, expando, slots);
        }
    }

    public String template() {
        return template;
    }

    /** Names of the variables the template refers to. */
    public Set<String> usedVariables() {
        Set<String> names = new LinkedHashSet<>();
        slots.forEach(slot -> names.add(slot.variable()));
        return names;
    }

    /**
     * Fills the template. Unbound variables are replaced with the empty string.
     *
     * @param env bindings of the match being fixed
     * @return the filled template, indented relative to column zero
     */
    public String render(MetaVarEnv env) {
        StringBuilder out = new StringBuilder(template.length());
        int cursor = 0;
        for (Slot slot : slots) {
            if (slot.start() < cursor) {
                throw new IllegalStateException("Template slots out of order at " + slot.start());
            }
            out.append(template, cursor, slot.start());
            out.append(valueOf(slot, env));
            cursor = slot.end();
        }
        out.append(template, cursor, template.length());
        return out.toString();
    }

    private static String valueOf(Slot slot, MetaVarEnv env) {
        String name = slot.variable();
        Optional<Node> single = env.get(name);
        if (single.isPresent()) {
            Node node = single.get();
            return Indentation.indentLines(node.text(), Indentation.indentOf(node), slot.indent());
        }
        if (env.hasMulti(name)) {
            List<Node> nodes = env.getMulti(name);
            String text = env.text(name).orElse("");
            if (nodes.isEmpty()) {
                return text;
            }
            return Indentation.indentLines(text, Indentation.indentOf(nodes.get(0)), slot.indent());
        }
        return env.getTransformed(name)
                .map(value -> Indentation.indentLines(value, 0, slot.indent()))
                .orElse("");
    }

    @Override
    public String toString() {
        return "TemplateFix[" + template + "]";
    }
}
