package io.treexform.core.spi;

/**
 * SPI interface for observability hooks on {@code RuleEngine}.
 *
 * <p>
 * Integrations bridge these events to metrics or tracing systems. The core has no telemetry
 * dependencies; this is a pure Java interface.
 *
 * <p>
 * All methods receive immutable event objects. Implementations MUST be thread-safe and
 * non-blocking. Exceptions thrown by listeners are caught by the engine and logged; they do NOT
 * affect loading or scanning.
 */
public interface ScanListener {

    /**
     * Called when a rule is successfully loaded.
     *
     * @param event contains ruleId, language, sourcePath
     */
    void onRuleLoaded(RuleLoadedEvent event);

    /**
     * Called when a rule is rejected at load time.
     *
     * @param event contains sourcePath, errorDetail
     */
    void onRuleRejected(RuleRejectedEvent event);

    /**
     * Called after all rules have been run against one document.
     *
     * @param event contains language, rulesRun, matches, durationMs
     */
    void onDocumentScanned(DocumentScannedEvent event);

    // --- Event records ---

    /** Event emitted when a rule is loaded. */
    record RuleLoadedEvent(String ruleId, String language, String sourcePath) {}

    /** Event emitted when a rule is rejected. */
    record RuleRejectedEvent(String sourcePath, String errorDetail) {}

    /** Event emitted when a document scan completes. */
    record DocumentScannedEvent(String language, int rulesRun, int matches, long durationMs) {}
}
