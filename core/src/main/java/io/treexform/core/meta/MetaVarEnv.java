package io.treexform.core.meta;

import io.treexform.core.tree.Node;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The bindings collected while matching: single captures, ellipsis captures and transformed
 * strings.
 *
 * <p>
 * Matchers that explore alternatives work on a {@link #copy()} and {@link #absorb(MetaVarEnv)}
 * the copy back only when the alternative succeeds, so a failed branch never leaks bindings.
 * Not thread-safe; an environment belongs to one match attempt.
 */
public final class MetaVarEnv {

    private final Map<String, Node> singles;
    private final Map<String, List<Node>> multis;
    private final Map<String, String> transformed;

    public MetaVarEnv() {
        this(new LinkedHashMap<>(), new LinkedHashMap<>(), new LinkedHashMap<>());
    }

    private MetaVarEnv(Map<String, Node> singles, Map<String, List<Node>> multis, Map<String, String> transformed) {
        this.singles = singles;
        this.multis = multis;
        this.transformed = transformed;
    }

    /** An independent copy; changes to either environment do not affect the other. */
    public MetaVarEnv copy() {
        return new MetaVarEnv(
                new LinkedHashMap<>(singles), new LinkedHashMap<>(multis), new LinkedHashMap<>(transformed));
    }

    /** Replaces every binding of this environment with those of {@code other}. */
    public void absorb(MetaVarEnv other) {
        if (other == this) {
            return;
        }
        singles.clear();
        singles.putAll(other.singles);
        multis.clear();
        multis.putAll(other.multis);
        transformed.clear();
        transformed.putAll(other.transformed);
    }

    /**
     * Binds {@code name} to {@code node}. A name that is already bound accepts only a node with
     * identical text, and keeps its first binding.
     *
     * @return false if the name is bound to a node with different text
     */
    public boolean insert(String name, Node node) {
        Node existing = singles.get(name);
        if (existing != null) {
            return existing.text().equals(node.text());
        }
        singles.put(name, node);
        return true;
    }

    /**
     * Binds {@code name} to a run of nodes. A name that is already bound accepts only a run with
     * the same texts.
     *
     * @return false if the name is bound to a different run
     */
    public boolean insertMulti(String name, List<Node> nodes) {
        List<Node> existing = multis.get(name);
        if (existing != null) {
            return texts(existing).equals(texts(nodes));
        }
        multis.put(name, List.copyOf(nodes));
        return true;
    }

    public void insertTransformed(String name, String value) {
        transformed.put(name, value);
    }

    /**
     * Adds every binding of {@code other} to this environment.
     *
     * @return false if a single or multi binding conflicts; this environment may then be partly
     *         updated and should be discarded
     */
    public boolean merge(MetaVarEnv other) {
        for (Map.Entry<String, Node> entry : other.singles.entrySet()) {
            if (!insert(entry.getKey(), entry.getValue())) {
                return false;
            }
        }
        for (Map.Entry<String, List<Node>> entry : other.multis.entrySet()) {
            if (!insertMulti(entry.getKey(), entry.getValue())) {
                return false;
            }
        }
        transformed.putAll(other.transformed);
        return true;
    }

    public Optional<Node> get(String name) {
        return Optional.ofNullable(singles.get(name));
    }

    /** The run bound to {@code name}, or an empty list. */
    public List<Node> getMulti(String name) {
        List<Node> nodes = multis.get(name);
        return nodes == null ? List.of() : nodes;
    }

    public Optional<String> getTransformed(String name) {
        return Optional.ofNullable(transformed.get(name));
    }

    public boolean hasMulti(String name) {
        return multis.containsKey(name);
    }

    /** Single-capture bindings in insertion order. */
    public Map<String, Node> singles() {
        return Collections.unmodifiableMap(singles);
    }

    public Map<String, List<Node>> multis() {
        return Collections.unmodifiableMap(multis);
    }

    public Map<String, String> transformed() {
        return Collections.unmodifiableMap(transformed);
    }

    /**
     * The text a variable stands for: a single capture's text, an ellipsis capture's source span
     * from its first to its last node, or a transformed value.
     *
     * @return the text, or empty if {@code name} is unbound
     */
    public Optional<String> text(String name) {
        Node single = singles.get(name);
        if (single != null) {
            return Optional.of(single.text());
        }
        List<Node> run = multis.get(name);
        if (run != null) {
            if (run.isEmpty()) {
                return Optional.of("");
            }
            Node first = run.get(0);
            Node last = run.get(run.size() - 1);
            return Optional.of(first.tree().source().slice(first.startByte(), last.endByte()));
        }
        return Optional.ofNullable(transformed.get(name));
    }

    public boolean isEmpty() {
        return singles.isEmpty() && multis.isEmpty() && transformed.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MetaVarEnv other)) {
            return false;
        }
        return singles.equals(other.singles) && multis.equals(other.multis) && transformed.equals(other.transformed);
    }

    @Override
    public int hashCode() {
        return singles.hashCode() * 31 + multis.hashCode() * 17 + transformed.hashCode();
    }

    @Override
    public String toString() {
        return "MetaVarEnv{singles=" + singles.keySet() + ", multis=" + multis.keySet() + ", transformed="
                + transformed.keySet() + "}";
    }

    private static List<String> texts(List<Node> nodes) {
        List<String> texts = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            texts.add(node.text());
        }
        return texts;
    }
}
