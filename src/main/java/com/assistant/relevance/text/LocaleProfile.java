package com.assistant.relevance.text;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Locale-specific data tables consumed by the tokenizer and the adaptive alpha policy.
 *
 * @param stopwords             tokens dropped before indexing
 * @param suffixes              ordered stemming suffixes, first match wins
 * @param domainSignalKeywords  normalized words that mark operational (domain) requests
 */
public record LocaleProfile(
        Set<String> stopwords,
        List<String> suffixes,
        Set<String> domainSignalKeywords
) {
    public LocaleProfile {
        Objects.requireNonNull(stopwords, "stopwords is required");
        Objects.requireNonNull(suffixes, "suffixes is required");
        Objects.requireNonNull(domainSignalKeywords, "domainSignalKeywords is required");
        stopwords = Set.copyOf(stopwords);
        suffixes = List.copyOf(suffixes);
        domainSignalKeywords = Set.copyOf(domainSignalKeywords);
    }

    /**
     * Rioplatense Spanish profile used by the assistant.
     */
    public static LocaleProfile spanish() {
        return new LocaleProfile(SPANISH_STOPWORDS, SPANISH_SUFFIXES, SPANISH_DOMAIN_SIGNALS);
    }

    private static final Set<String> SPANISH_STOPWORDS = Set.of(
            "a", "al", "algo", "ante", "bajo", "con", "contra", "de", "del", "desde",
            "donde", "el", "ella", "ellas", "ellos", "en", "entre", "era", "eramos", "es",
            "esa", "ese", "eso", "esta", "estaba", "estamos", "estan", "estar", "este", "esto",
            "fue", "fueron", "ha", "hay", "la", "las", "le", "les", "lo", "los",
            "me", "mi", "mis", "mucho", "muy", "no", "nos", "o", "para", "pero",
            "por", "porque", "que", "se", "si", "sin", "sobre", "su", "sus", "te",
            "tu", "tus", "un", "una", "uno", "unos", "unas", "y", "ya"
    );

    private static final List<String> SPANISH_SUFFIXES = List.of(
            "mente", "aciones", "acion", "ciones", "cion",
            "amientos", "amiento", "imientos", "imiento",
            "idades", "idad", "adoras", "adores", "adora", "ador",
            "ismos", "ismo", "istas", "ista", "ancias", "ancia",
            "amente", "ando", "iendo",
            "ados", "adas", "idos", "idas", "ado", "ada", "ido", "ida",
            "es", "s"
    );

    private static final Set<String> SPANISH_DOMAIN_SIGNALS = Set.of(
            "gmail", "correo", "mail", "email", "inbox", "bandeja",
            "workspace", "archivo", "carpeta", "pdf", "documento",
            "web", "internet", "url", "link", "reddit", "noticias",
            "recorda", "acorda", "memoria", "memory",
            "recordatorio", "tarea", "agenda",
            "lim", "conector", "tunnel", "skill"
    );
}
