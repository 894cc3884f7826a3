package com.assistant.relevance.vector;

import com.assistant.relevance.similarity.CosineSimilarity;
import com.assistant.relevance.text.Tokenizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Vector space Tests")
class VectorSpaceTest {

    private final VectorBuilder builder = new VectorBuilder(new Tokenizer());

    @Nested
    @DisplayName("VectorBuilder")
    class BuilderTests {

        @Test
        @DisplayName("Should emit tokens, stems and surface bigrams as word terms")
        void testWordTerms() {
            List<String> terms = builder.wordTerms("leer correos");
            assertEquals(List.of("leer", "correos", "correo", "leer_correos"), terms);
        }

        @Test
        @DisplayName("Should treat null text as an empty document")
        void testNullText() {
            TermDocument document = builder.document(null);
            assertTrue(document.isEmpty());
            assertEquals("", document.text());
        }

        @Test
        @DisplayName("Should count repeated word terms")
        void testWordFrequencies() {
            TermDocument document = builder.document("boca boca");
            assertEquals(2, document.wordFrequencies().get("boca"));
            assertEquals(3, document.length());
        }
    }

    @Nested
    @DisplayName("IdfTable")
    class IdfTests {

        @Test
        @DisplayName("Should give rarer terms a higher weight")
        void testRareTermsWeighMore() {
            IdfTable table = IdfTable.fit(List.of(List.of("a", "b"), List.of("a"), List.of("a", "c")));
            assertEquals(3, table.documentCount());
            assertEquals(3, table.documentFrequency("a"));
            assertTrue(table.idf("b") > table.idf("a"));
        }

        @Test
        @DisplayName("Should weigh unknown terms with idf 1")
        void testUnknownTerm() {
            IdfTable table = IdfTable.fit(List.of(List.of("a")));
            assertEquals(1.0, table.idf("zzz"), 1e-9);
        }

        @Test
        @DisplayName("Should produce an empty vector for no terms")
        void testEmptyWeigh() {
            IdfTable table = IdfTable.fit(List.of(List.of("a")));
            assertTrue(table.weigh(List.of()).isEmpty());
        }
    }

    @Nested
    @DisplayName("SparseVector")
    class SparseVectorTests {

        @Test
        @DisplayName("Should compute the L2 norm")
        void testNorm() {
            SparseVector vector = SparseVector.of(Map.of("x", 3.0, "y", 4.0));
            assertEquals(5.0, vector.norm(), 1e-9);
        }

        @Test
        @DisplayName("Should average vectors term by term")
        void testMean() {
            SparseVector mean = SparseVector.mean(List.of(
                    SparseVector.of(Map.of("x", 2.0)),
                    SparseVector.of(Map.of("x", 4.0, "y", 2.0))));
            assertEquals(3.0, mean.get("x"), 1e-9);
            assertEquals(1.0, mean.get("y"), 1e-9);
        }

        @Test
        @DisplayName("Should return the empty vector for no input")
        void testMeanOfNothing() {
            assertSame(SparseVector.empty(), SparseVector.mean(List.of()));
            assertSame(SparseVector.empty(), SparseVector.of(Map.of()));
        }
    }

    @Nested
    @DisplayName("VectorSpace")
    class SpaceTests {

        @Test
        @DisplayName("Should place a training utterance closest to its own route centroid")
        void testCentroidSimilarity() {
            List<TermDocument> mail = List.of(builder.document("enviar correo"), builder.document("leer inbox"));
            List<TermDocument> web = List.of(builder.document("buscar en internet"), builder.document("noticias de hoy"));
            VectorSpace space = VectorSpace.fit(List.of(mail.get(0), mail.get(1), web.get(0), web.get(1)));

            RouteCentroid mailCentroid = space.centroid(mail, List.of());
            RouteCentroid webCentroid = space.centroid(web, List.of());
            TermDocument query = builder.document("enviar un correo");

            double toMail = CosineSimilarity.compute(space.wordVector(query), mailCentroid.word());
            double toWeb = CosineSimilarity.compute(space.wordVector(query), webCentroid.word());
            assertTrue(toMail > toWeb);
            assertFalse(mailCentroid.hasNegatives());
        }

        @Test
        @DisplayName("Should keep negative centroids apart from positives")
        void testNegatives() {
            TermDocument positive = builder.document("enviar correo");
            TermDocument negative = builder.document("enviar archivo");
            VectorSpace space = VectorSpace.fit(List.of(positive));
            RouteCentroid centroid = space.centroid(List.of(positive), List.of(negative));
            assertTrue(centroid.hasNegatives());
            assertFalse(centroid.negativeWord().isEmpty());
        }
    }
}
