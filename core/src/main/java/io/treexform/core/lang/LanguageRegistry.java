package io.treexform.core.lang;

import io.treexform.core.lang.treesitter.TreeSitterLanguage;
import io.treexform.core.spi.Language;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for grammar backends. Rule documents name their language by id; the registry resolves
 * that id to a {@link Language}. Thread-safe: registration and lookup can happen concurrently.
 */
public final class LanguageRegistry {

    private final Map<String, Language> languages = new ConcurrentHashMap<>();

    /**
     * Returns a registry pre-populated with the bundled tree-sitter languages.
     *
     * @return a new registry containing {@code javascript}
     */
    public static LanguageRegistry withBundledLanguages() {
        LanguageRegistry registry = new LanguageRegistry();
        registry.register(TreeSitterLanguage.javascript());
        return registry;
    }

    /**
     * Registers a language. If a language with the same id is already registered, it is replaced
     * (last-write-wins semantics).
     *
     * @param language the language to register
     * @throws NullPointerException     if language or language.id() is null
     * @throws IllegalArgumentException if language.id() is empty
     */
    public void register(Language language) {
        if (language == null) {
            throw new NullPointerException("language must not be null");
        }
        String id = language.id();
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("language id must not be null or empty");
        }
        languages.put(id, language);
    }

    /**
     * Looks up a language by id.
     *
     * @param languageId the language identifier (e.g. "javascript")
     * @return the language, or empty if not registered
     */
    public Optional<Language> getLanguage(String languageId) {
        return Optional.ofNullable(languages.get(languageId));
    }

    /** Returns the number of registered languages. */
    public int size() {
        return languages.size();
    }

    /** Returns {@code true} if a language with the given id is registered. */
    public boolean hasLanguage(String languageId) {
        return languages.containsKey(languageId);
    }
}
