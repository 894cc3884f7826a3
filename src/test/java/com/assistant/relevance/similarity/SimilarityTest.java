package com.assistant.relevance.similarity;

import com.assistant.relevance.text.TextNormalizer;
import com.assistant.relevance.text.Tokenizer;
import com.assistant.relevance.vector.RouteCentroid;
import com.assistant.relevance.vector.SparseVector;
import com.assistant.relevance.vector.TermDocument;
import com.assistant.relevance.vector.VectorBuilder;
import com.assistant.relevance.vector.VectorSpace;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Similarity Tests")
class SimilarityTest {

    private final Tokenizer tokenizer = new Tokenizer();

    @Nested
    @DisplayName("JaccardSimilarity")
    class JaccardTests {

        @Test
        @DisplayName("Should treat two empty sets as identical")
        void testBothEmpty() {
            assertEquals(1.0, JaccardSimilarity.of(Set.of(), Set.of()));
        }

        @Test
        @DisplayName("Should return zero when only one set is empty")
        void testOneEmpty() {
            assertEquals(0.0, JaccardSimilarity.of(Set.of("a"), Set.of()));
        }

        @Test
        @DisplayName("Should compute intersection over union")
        void testOverlap() {
            assertEquals(1.0 / 3.0, JaccardSimilarity.of(Set.of("a", "b"), Set.of("b", "c")), 1e-9);
        }

        @Test
        @DisplayName("Should compare texts by their token sets")
        void testTexts() {
            assertEquals(1.0, JaccardSimilarity.of(tokenizer.tokenSet("Leer el inbox"), tokenizer.tokenSet("leer inbox")), 1e-9);
        }
    }

    @Nested
    @DisplayName("CosineSimilarity")
    class CosineTests {

        @Test
        @DisplayName("Should return 1 for parallel vectors")
        void testParallel() {
            SparseVector a = SparseVector.of(Map.of("x", 1.0, "y", 2.0));
            SparseVector b = SparseVector.of(Map.of("x", 2.0, "y", 4.0));
            assertEquals(1.0, CosineSimilarity.compute(a, b), 1e-9);
        }

        @Test
        @DisplayName("Should return 0 for empty or disjoint vectors")
        void testDisjoint() {
            SparseVector a = SparseVector.of(Map.of("x", 1.0));
            assertEquals(0.0, CosineSimilarity.compute(a, SparseVector.of(Map.of("y", 1.0))));
            assertEquals(0.0, CosineSimilarity.compute(a, SparseVector.empty()));
            assertEquals(0.0, CosineSimilarity.compute(null, a));
        }
    }

    @Nested
    @DisplayName("Bm25Scorer")
    class Bm25Tests {

        @Test
        @DisplayName("Should score documents containing rare query terms higher")
        void testRareTerm() {
            Bm25Scorer scorer = new Bm25Scorer();
            Bm25Scorer.CorpusStats corpus = Bm25Scorer.CorpusStats.of(
                    List.of(Set.of("boca", "partido"), Set.of("partido"), Set.of("partido", "lluvia")),
                    List.of(2, 1, 2), null);
            double withRare = scorer.score(List.of("boca"), Map.of("boca", 1, "partido", 1), 2, corpus);
            double withCommon = scorer.score(List.of("partido"), Map.of("boca", 1, "partido", 1), 2, corpus);
            assertTrue(withRare > withCommon);
            assertTrue(withCommon > 0.0);
        }

        @Test
        @DisplayName("Should only compute document frequency for the requested terms")
        void testOnlyTerms() {
            Bm25Scorer.CorpusStats corpus = Bm25Scorer.CorpusStats.of(
                    List.of(Set.of("a", "b"), Set.of("b")), List.of(2, 1), List.of("b", "z"));
            assertEquals(Map.of("b", 2, "z", 0), corpus.documentFrequency());
            assertEquals(1.5, corpus.avgDocLength(), 1e-9);
        }

        @Test
        @DisplayName("Should score zero for empty queries or corpora")
        void testEmpty() {
            Bm25Scorer scorer = new Bm25Scorer();
            Bm25Scorer.CorpusStats empty = Bm25Scorer.CorpusStats.of(List.of(), List.of(), null);
            assertEquals(0.0, scorer.score(List.of("a"), Map.of("a", 1), 1, empty));
            assertEquals(0.0, scorer.score(List.of(), Map.of("a", 1), 1, empty));
        }

        @ParameterizedTest
        @CsvSource({
                "0.0, 6.0, 0.0",
                "-1.0, 6.0, 0.0",
                "6.0, 6.0, 0.6321205588"
        })
        @DisplayName("Should saturate raw scores into [0, 1)")
        void testSaturate(double raw, double scale, double expected) {
            assertEquals(expected, Bm25Scorer.saturate(raw, scale), 1e-9);
        }

        @Test
        @DisplayName("Should reject invalid parameters")
        void testInvalidParameters() {
            assertThrows(IllegalArgumentException.class, () -> new Bm25Scorer(-1.0, 0.5));
            assertThrows(IllegalArgumentException.class, () -> new Bm25Scorer(1.2, 1.5));
        }
    }

    @Nested
    @DisplayName("SemanticOverlapScorer")
    class OverlapTests {

        private final SemanticOverlapScorer scorer = new SemanticOverlapScorer(tokenizer);

        private double score(String left, String right) {
            return scorer.compute(tokenizer.tokenSet(left), scorer.ngrams(left),
                    tokenizer.tokenSet(right), scorer.ngrams(right));
        }

        @Test
        @DisplayName("Should score identical texts as 1")
        void testIdentical() {
            assertEquals(1.0, score("mi equipo es boca", "mi equipo es boca"), 1e-9);
        }

        @Test
        @DisplayName("Should keep the score between 0 and 1")
        void testBounds() {
            double score = score("equipo de futbol", "receta de cocina");
            assertTrue(score >= 0.0 && score <= 1.0);
        }

        @Test
        @DisplayName("Should weigh token and n-gram overlap by the configured weights")
        void testWeights() {
            Set<String> tokens = Set.of("boca", "river");
            Set<String> ngrams = Set.of("boc", "oca");

            assertEquals(0.65 * 0.5 + 0.35 * 1.0, scorer.compute(tokens, ngrams, Set.of("boca"), ngrams), 1e-9);
            SemanticOverlapScorer tokensOnly = new SemanticOverlapScorer(tokenizer, new OverlapWeights(1.0, 0.0));
            assertEquals(0.5, tokensOnly.compute(tokens, ngrams, Set.of("boca"), Set.of()), 1e-9);
        }

        @Test
        @DisplayName("Should reject weights that do not sum to 1")
        void testInvalidWeights() {
            assertThrows(IllegalArgumentException.class, () -> new OverlapWeights(0.5, 0.6));
            assertThrows(IllegalArgumentException.class, () -> new OverlapWeights(-0.1, 1.1));
        }
    }

    @Nested
    @DisplayName("AdaptiveAlphaPolicy")
    class AlphaTests {

        private final AdaptiveAlphaPolicy policy = new AdaptiveAlphaPolicy(new TextNormalizer(),
                Set.of("gmail", "correo"));

        @Test
        @DisplayName("Should raise alpha for short queries with a domain keyword")
        void testShortDomainQuery() {
            assertEquals(0.72 + 0.08 + 0.03, policy.adapt(0.72, "revisar gmail", 2), 1e-9);
        }

        @Test
        @DisplayName("Should lower alpha for long noisy queries")
        void testLongNoisyQuery() {
            String noisy = "?? !! ## $$ %% && ** (( )) aa bb cc dd ee ff gg hh";
            assertEquals(0.72 - 0.05 - 0.06, policy.adapt(0.72, noisy, 16), 1e-9);
        }

        @Test
        @DisplayName("Should stay within the alpha bounds")
        void testClamp() {
            assertEquals(ScoringConfig.MAX_ALPHA, policy.adapt(0.95, "correo", 1), 1e-9);
            assertEquals(ScoringConfig.MIN_ALPHA, policy.adapt(0.0, "x", 20), 1e-9);
        }

        @Test
        @DisplayName("Should measure the share of non-alphanumeric characters")
        void testNoiseRatio() {
            assertEquals(0.5, policy.noiseRatio("ab!?"), 1e-9);
            assertEquals(0.0, policy.noiseRatio(""), 1e-9);
        }
    }

    @Nested
    @DisplayName("HybridRouteScorer")
    class HybridTests {

        private final VectorBuilder builder = new VectorBuilder(tokenizer);
        private final HybridRouteScorer scorer = new HybridRouteScorer(ScoringConfig.defaults());

        private HybridRouteScorer.ScoreBreakdown score(String query, List<String> positives,
                                                       List<String> negatives, double boost) {
            List<TermDocument> docs = positives.stream().map(builder::document).collect(Collectors.toList());
            List<TermDocument> negs = negatives.stream().map(builder::document).collect(Collectors.toList());
            VectorSpace space = VectorSpace.fit(docs);
            RouteCentroid centroid = space.centroid(docs, negs);
            Bm25Scorer.CorpusStats corpus = Bm25Scorer.CorpusStats.of(
                    docs.stream().map(d -> Set.copyOf(d.wordTerms())).collect(Collectors.toList()),
                    docs.stream().map(TermDocument::length).collect(Collectors.toList()), null);
            TermDocument q = builder.document(query);
            return scorer.score(q, space.wordVector(q), space.charVector(q), centroid, docs, corpus, 0.72, boost);
        }

        @Test
        @DisplayName("Should keep the hybrid score within [0, 1]")
        void testBounds() {
            HybridRouteScorer.ScoreBreakdown exact = score("enviar correo", List.of("enviar correo"), List.of(), 5.0);
            HybridRouteScorer.ScoreBreakdown none = score("zzz", List.of("enviar correo"), List.of(), -5.0);
            assertEquals(1.0, exact.hybrid(), 1e-9);
            assertEquals(0.0, none.hybrid(), 1e-9);
        }

        @Test
        @DisplayName("Should penalize queries resembling negative examples")
        void testNegativePenalty() {
            double plain = score("enviar archivo", List.of("enviar correo"), List.of(), 0.0).hybrid();
            double penalized = score("enviar archivo", List.of("enviar correo"), List.of("enviar archivo"), 0.0).hybrid();
            assertTrue(penalized < plain);
        }

        @Test
        @DisplayName("Should ignore non-finite boosts")
        void testNonFiniteBoost() {
            HybridRouteScorer.ScoreBreakdown breakdown = score("enviar correo", List.of("enviar correo"),
                    List.of(), Double.NaN);
            assertEquals(0.0, breakdown.boost());
        }

        @Test
        @DisplayName("Should clamp NaN to zero")
        void testClamp() {
            assertEquals(0.0, HybridRouteScorer.clamp01(Double.NaN));
            assertEquals(1.0, HybridRouteScorer.clamp01(3.0));
        }
    }
}
