package io.treexform.core.replace;

import io.treexform.core.match.NodeMatch;
import io.treexform.core.spi.Language;
import io.treexform.core.tree.Edit;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A rule's fix: a {@link TemplateFix}, the optional widening of the replaced range and an
 * optional title shown when a rule offers several fixes.
 */
public final class Fixer {

    private final TemplateFix template;
    private final Expansion expandStart;
    private final Expansion expandEnd;
    private final String title;

    public Fixer(TemplateFix template, Expansion expandStart, Expansion expandEnd, String title) {
        this.template = Objects.requireNonNull(template, "template must not be null");
        this.expandStart = expandStart;
        this.expandEnd = expandEnd;
        this.title = title;
    }

    /** A fix that replaces just the matched node. */
    public static Fixer of(Language language, String template) {
        return new Fixer(TemplateFix.parse(language, template), null, null, null);
    }

    public TemplateFix template() {
        return template;
    }

    public Optional<Expansion> expandStart() {
        return Optional.ofNullable(expandStart);
    }

    public Optional<Expansion> expandEnd() {
        return Optional.ofNullable(expandEnd);
    }

    public Optional<String> title() {
        return Optional.ofNullable(title);
    }

    public Set<String> usedVariables() {
        return template.usedVariables();
    }

    /** Ids of utility rules the expansion rules refer to. */
    public void collectReferents(Set<String> ids) {
        if (expandStart != null) {
            expandStart.rule().collectReferents(ids);
        }
        if (expandEnd != null) {
            expandEnd.rule().collectReferents(ids);
        }
    }

    /**
     * The replacement text for {@code match}, indented for the line the matched node starts on.
     */
    public String render(NodeMatch match) {
        String body = template.render(match.env());
        return Indentation.indentLines(body, 0, Indentation.indentOf(match.node()));
    }

    /** The edit that replaces {@code match}, widened by the expansions if any. */
    public Edit edit(NodeMatch match) {
        int start = expandStart == null ? match.node().startByte() : expandStart.expandStart(match);
        int end = expandEnd == null ? match.node().endByte() : expandEnd.expandEnd(match);
        return new Edit(start, end - start, render(match));
    }

    @Override
    public String toString() {
        return "Fixer[" + template.template() + (title == null ? "" : ", title=" + title) + "]";
    }
}
