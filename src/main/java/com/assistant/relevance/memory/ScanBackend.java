package com.assistant.relevance.memory;

import com.assistant.relevance.text.Tokenizer;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Keyword-only backend: every line with a positive {@link LineScorer} score is a candidate.
 */
public class ScanBackend implements RecallBackend {

    private final LineScorer lineScorer;
    private final Tokenizer tokenizer;
    private final int snippetMaxChars;

    public ScanBackend(LineScorer lineScorer, Tokenizer tokenizer, int snippetMaxChars) {
        this.lineScorer = lineScorer;
        this.tokenizer = tokenizer;
        this.snippetMaxChars = snippetMaxChars;
    }

    @Override
    public MemoryBackend kind() {
        return MemoryBackend.SCAN;
    }

    @Override
    public List<MemoryCandidate> search(RecallQuery query, List<MemoryLine> corpus) {
        List<MemoryCandidate> candidates = new ArrayList<>();
        for (MemoryLine line : corpus) {
            double score = lineScorer.score(line, query);
            if (score <= 0.0) {
                continue;
            }
            candidates.add(toCandidate(line, score, tokenizer, snippetMaxChars));
        }
        return candidates;
    }

    static MemoryCandidate toCandidate(MemoryLine line, double score, Tokenizer tokenizer, int snippetMaxChars) {
        String snippet = Snippets.truncateWithMarker(line.content(), snippetMaxChars);
        return new MemoryCandidate(line.path(), line.lineNumber(), snippet, score,
                tokenizer.getNormalizer().normalize(snippet),
                new LinkedHashSet<>(tokenizer.surfaceTokens(snippet)));
    }
}
