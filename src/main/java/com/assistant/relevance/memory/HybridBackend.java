package com.assistant.relevance.memory;

import com.assistant.relevance.similarity.Bm25Scorer;
import com.assistant.relevance.similarity.SemanticOverlapScorer;
import com.assistant.relevance.text.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Keyword score plus weighted BM25 and lexical-overlap similarity.
 * Formula: hybrid = scan + 3*bm25 + (semantic >= floor ? 3.2*semantic : 0)
 */
public class HybridBackend implements RecallBackend {
    private static final Logger log = LoggerFactory.getLogger(HybridBackend.class);

    static final double BM25_WEIGHT = 3.0;
    static final double SEMANTIC_WEIGHT = 3.2;

    private final LineScorer lineScorer;
    private final Tokenizer tokenizer;
    private final Bm25Scorer bm25;
    private final SemanticOverlapScorer semantic;
    private final double semanticMinScore;
    private final int snippetMaxChars;

    public HybridBackend(LineScorer lineScorer, Tokenizer tokenizer, double semanticMinScore, int snippetMaxChars) {
        this(lineScorer, tokenizer, new Bm25Scorer(), new SemanticOverlapScorer(tokenizer),
                semanticMinScore, snippetMaxChars);
    }

    public HybridBackend(LineScorer lineScorer, Tokenizer tokenizer, Bm25Scorer bm25,
                         SemanticOverlapScorer semantic, double semanticMinScore, int snippetMaxChars) {
        this.lineScorer = lineScorer;
        this.tokenizer = tokenizer;
        this.bm25 = bm25;
        this.semantic = semantic;
        this.semanticMinScore = semanticMinScore;
        this.snippetMaxChars = snippetMaxChars;
    }

    @Override
    public MemoryBackend kind() {
        return MemoryBackend.HYBRID;
    }

    @Override
    public List<MemoryCandidate> search(RecallQuery query, List<MemoryLine> corpus) {
        if (corpus.isEmpty()) {
            return List.of();
        }
        List<String> terms = query.terms();
        Set<String> queryTokens = new LinkedHashSet<>(terms);
        Set<String> queryNgrams = semantic.ngrams(query.raw());

        List<Set<String>> termSets = new ArrayList<>(corpus.size());
        List<Integer> lengths = new ArrayList<>(corpus.size());
        for (MemoryLine line : corpus) {
            termSets.add(line.tokenSet());
            lengths.add(line.length());
        }
        Bm25Scorer.CorpusStats stats = Bm25Scorer.CorpusStats.of(termSets, lengths, terms);

        List<MemoryCandidate> candidates = new ArrayList<>();
        for (MemoryLine line : corpus) {
            double base = lineScorer.score(line, query);
            double bm25Score = bm25.score(terms, line.tokenFrequency(), line.length(), stats);
            double similarity = semantic.compute(queryTokens, queryNgrams,
                    line.tokenSet(), semantic.ngrams(line.normalized()));
            double semanticBoost = similarity >= semanticMinScore ? similarity * SEMANTIC_WEIGHT : 0.0;
            double hybrid = base + bm25Score * BM25_WEIGHT + semanticBoost;

            if (hybrid <= 0.0) {
                continue;
            }
            if (base <= 0.0 && bm25Score <= 0.0 && similarity < semanticMinScore) {
                continue;
            }
            log.trace("memory.hybrid path={} line={} scan={} bm25={} semantic={} hybrid={}",
                    line.path(), line.lineNumber(), base, bm25Score, similarity, hybrid);
            candidates.add(ScanBackend.toCandidate(line, hybrid, tokenizer, snippetMaxChars));
        }
        return candidates;
    }
}
