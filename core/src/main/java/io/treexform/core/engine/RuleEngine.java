package io.treexform.core.engine;

import io.treexform.core.config.EngineConfig;
import io.treexform.core.error.RuleLoadException;
import io.treexform.core.lang.LanguageRegistry;
import io.treexform.core.match.NodeMatch;
import io.treexform.core.rule.RuleConfig;
import io.treexform.core.rule.RuleCore;
import io.treexform.core.spec.RuleConfigParser;
import io.treexform.core.spi.ScanListener;
import io.treexform.core.tree.Document;
import io.treexform.core.tree.Edit;
import io.treexform.core.tree.Node;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads rule documents and runs them against documents.
 *
 * <p>
 * The loaded rules live in an immutable {@link RuleSet} held by an {@link AtomicReference}.
 * {@link #loadRule(Path)} adds one rule to the current snapshot; {@link #reload(List, List)}
 * builds a complete new snapshot and swaps it in, so a failed reload leaves the previous rules
 * active.
 *
 * <p>
 * Thread-safe for loading and scanning. Documents themselves are not thread-safe, so a document
 * must not be scanned while it is being edited.
 */
public final class RuleEngine {

    private static final Logger LOG = LoggerFactory.getLogger(RuleEngine.class);

    private final RuleConfigParser parser;
    private final EngineConfig config;
    private final ScanListener listener;
    private final AtomicReference<RuleSet> ruleSetRef = new AtomicReference<>(RuleSet.empty());

    public RuleEngine(LanguageRegistry languages) {
        this(languages, EngineConfig.DEFAULT, null);
    }

    public RuleEngine(LanguageRegistry languages, EngineConfig config) {
        this(languages, config, null);
    }

    /**
     * @param languages resolves rule languages
     * @param config    matching and scanning settings
     * @param listener  optional observability hook, may be {@code null}
     */
    public RuleEngine(LanguageRegistry languages, EngineConfig config, ScanListener listener) {
        Objects.requireNonNull(languages, "languages must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.parser = new RuleConfigParser(languages, config);
        this.listener = listener;
    }

    // --- Loading ---

    /**
     * Loads a global utility document into the current snapshot. Rules loaded afterwards may
     * reference it with {@code matches}.
     *
     * @return the utility id
     */
    public String loadUtil(Path path) {
        try {
            String id = parser.parseUtil(path, ruleSetRef.get().globals());
            LOG.info("Utility loaded: id={}, source={}", id, path);
            return id;
        } catch (RuleLoadException e) {
            LOG.warn("Utility rejected: source={}, reason={}", path, e.getMessage());
            notifyRuleRejected(path, e);
            throw e;
        }
    }

    /**
     * Loads a rule document and adds it to the current snapshot, replacing a rule with the same id.
     *
     * @throws RuleLoadException if the document is invalid
     */
    public RuleConfig loadRule(Path path) {
        try {
            // built against the snapshot it is published into
            AtomicReference<RuleConfig> parsed = new AtomicReference<>();
            ruleSetRef.updateAndGet(current -> {
                RuleConfig candidate = parser.parse(path, current.globals());
                parsed.set(candidate);
                return current.withRule(candidate);
            });
            RuleConfig rule = parsed.get();
            LOG.info("Rule loaded: id={}, language={}, severity={}", rule.id(), rule.language().id(), rule.severity().id());
            notifyRuleLoaded(rule, path);
            return rule;
        } catch (RuleLoadException e) {
            LOG.warn("Rule rejected: source={}, reason={}", path, e.getMessage());
            notifyRuleRejected(path, e);
            throw e;
        }
    }

    /**
     * Builds a new snapshot from the given utility and rule files and swaps it in atomically.
     * Utilities are loaded first, in order, so that later utilities and all rules can reference
     * earlier ones.
     *
     * @throws RuleLoadException if any document is invalid; the current snapshot is kept
     */
    public void reload(List<Path> utilPaths, List<Path> rulePaths) {
        RuleSet.Builder builder = RuleSet.builder();
        for (Path utilPath : utilPaths) {
            parser.parseUtil(utilPath, builder.globals());
        }
        List<RuleConfig> loaded = new ArrayList<>(rulePaths.size());
        for (Path rulePath : rulePaths) {
            try {
                RuleConfig rule = parser.parse(rulePath, builder.globals());
                builder.addRule(rule);
                loaded.add(rule);
            } catch (RuleLoadException e) {
                notifyRuleRejected(rulePath, e);
                throw e;
            }
        }
        RuleSet ruleSet = builder.build();
        ruleSetRef.set(ruleSet);
        for (int i = 0; i < loaded.size(); i++) {
            notifyRuleLoaded(loaded.get(i), rulePaths.get(i));
        }
        LOG.info("Registry reloaded: rules={}, utils={}", ruleSet.ruleCount(), ruleSet.utilCount());
    }

    /** The current snapshot. */
    public RuleSet ruleSet() {
        return ruleSetRef.get();
    }

    public int ruleCount() {
        return ruleSetRef.get().ruleCount();
    }

    // --- Scanning ---

    /**
     * Runs every enabled rule of the document's language against {@code document}.
     *
     * @return findings grouped by rule in load order, each rule's matches in pre-order
     */
    public List<RuleMatch> scan(Document document) {
        Objects.requireNonNull(document, "document must not be null");
        long start = System.nanoTime();
        List<RuleConfig> rules = applicableRules(document);
        List<RuleMatch> findings = new ArrayList<>();
        for (RuleConfig rule : rules) {
            for (NodeMatch match : findAll(rule.core(), document.root())) {
                findings.add(new RuleMatch(rule.id(), rule.severity(), rule.message(match), match));
            }
        }
        long durationMs = (System.nanoTime() - start) / 1_000_000;
        LOG.debug(
                "Document scanned: language={}, rules={}, matches={}, durationMs={}",
                document.language().id(),
                rules.size(),
                findings.size(),
                durationMs);
        notifyDocumentScanned(document, rules.size(), findings.size(), durationMs);
        return findings;
    }

    /**
     * Edits produced by the first fix of every enabled rule. When fixes of different rules
     * overlap, the one starting first wins and ties go to the rule loaded first.
     *
     * @return non-overlapping edits ordered by position
     */
    public List<Edit> fixes(Document document) {
        Objects.requireNonNull(document, "document must not be null");
        List<Edit> candidates = new ArrayList<>();
        for (RuleConfig rule : applicableRules(document)) {
            candidates.addAll(rule.core().fixAll(document));
        }
        candidates.sort(Comparator.comparingInt(Edit::position));
        List<Edit> accepted = new ArrayList<>(candidates.size());
        int covered = -1;
        for (Edit edit : candidates) {
            if (edit.position() < covered) {
                LOG.debug("Overlapping fix skipped: position={}", edit.position());
                continue;
            }
            accepted.add(edit);
            covered = edit.endPosition();
        }
        return accepted;
    }

    /**
     * Applies {@link #fixes(Document)} to {@code document} as one change.
     *
     * @return the number of edits applied
     */
    public int applyFixes(Document document) {
        List<Edit> edits = fixes(document);
        document.applyEdits(edits);
        LOG.info("Fixes applied: edits={}, generation={}", edits.size(), document.generation());
        return edits.size();
    }

    private List<RuleConfig> applicableRules(Document document) {
        String languageId = document.language().id();
        List<RuleConfig> rules = new ArrayList<>();
        for (RuleConfig rule : ruleSetRef.get().rules()) {
            if (rule.isEnabled() && rule.language().id().equals(languageId)) {
                rules.add(rule);
            }
        }
        return rules;
    }

    private List<NodeMatch> findAll(RuleCore core, Node root) {
        if (config.pruning()) {
            return root.findAll(core);
        }
        List<NodeMatch> matches = new ArrayList<>();
        for (Node node : root.dfs()) {
            core.match(node).ifPresent(matches::add);
        }
        return matches;
    }

    // --- Listener notification ---

    private void notifyRuleLoaded(RuleConfig rule, Path path) {
        if (listener == null) {
            return;
        }
        try {
            listener.onRuleLoaded(new ScanListener.RuleLoadedEvent(rule.id(), rule.language().id(), String.valueOf(path)));
        } catch (Exception e) {
            LOG.warn("ScanListener.onRuleLoaded failed", e);
        }
    }

    private void notifyRuleRejected(Path path, Exception cause) {
        if (listener == null) {
            return;
        }
        try {
            listener.onRuleRejected(new ScanListener.RuleRejectedEvent(String.valueOf(path), cause.getMessage()));
        } catch (Exception e) {
            LOG.warn("ScanListener.onRuleRejected failed", e);
        }
    }

    private void notifyDocumentScanned(Document document, int rulesRun, int matches, long durationMs) {
        if (listener == null) {
            return;
        }
        try {
            listener.onDocumentScanned(
                    new ScanListener.DocumentScannedEvent(document.language().id(), rulesRun, matches, durationMs));
        } catch (Exception e) {
            LOG.warn("ScanListener.onDocumentScanned failed", e);
        }
    }
}
