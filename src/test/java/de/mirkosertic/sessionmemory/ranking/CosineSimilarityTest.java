package de.mirkosertic.sessionmemory.ranking;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("CosineSimilarity")
class CosineSimilarityTest {

    @Test
    @DisplayName("A non-empty vector is fully similar to itself")
    void selfSimilarity() {
        final SparseVector vector = SparseVector.of(Map.of("auth", 1.9, "service", 1.5, "login", 0.7));

        assertThat(CosineSimilarity.between(vector, vector)).isCloseTo(1.0, within(1e-12));
    }

    @Test
    @DisplayName("Vectors without shared terms have similarity 0")
    void orthogonal() {
        final SparseVector a = SparseVector.of(Map.of("auth", 1.0));
        final SparseVector b = SparseVector.of(Map.of("css", 1.0));

        assertThat(CosineSimilarity.between(a, b)).isZero();
    }

    @Test
    @DisplayName("Empty vectors give exactly 0")
    void emptyVector() {
        final SparseVector other = SparseVector.of(Map.of("auth", 1.0));

        assertThat(CosineSimilarity.between(SparseVector.empty(), other)).isEqualTo(0.0);
        assertThat(CosineSimilarity.between(other, SparseVector.empty())).isEqualTo(0.0);
        assertThat(CosineSimilarity.between(SparseVector.empty(), SparseVector.empty())).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Ignores magnitude and stays within [0, 1]")
    void partialOverlap() {
        final SparseVector a = SparseVector.of(Map.of("auth", 1.0, "login", 1.0));
        final SparseVector b = SparseVector.of(Map.of("auth", 5.0));

        final double similarity = CosineSimilarity.between(a, b);

        assertThat(similarity).isCloseTo(1.0 / Math.sqrt(2.0), within(1e-12));
        assertThat(similarity).isBetween(0.0, 1.0);
        assertThat(CosineSimilarity.between(b, a)).isCloseTo(similarity, within(1e-15));
    }
}
