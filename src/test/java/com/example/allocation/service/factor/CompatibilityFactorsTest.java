package com.example.allocation.service.factor;

import com.example.allocation.exception.FactorException;
import com.example.allocation.model.FeatureVector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

class CompatibilityFactorsTest {

    private static FeatureVector skills(Double... components) {
        return new FeatureVector(1, List.of(components), 0.5, 0.5, List.of(), "pune", "maharashtra", List.of());
    }

    private static FeatureVector tags(Integer... indices) {
        return new FeatureVector(1, List.of(1.0), 0.5, 0.5, List.of(indices), "pune", "maharashtra", List.of());
    }

    private static FeatureVector place(String location, String region) {
        return new FeatureVector(1, List.of(1.0), 0.5, 0.5, List.of(), location, region, List.of());
    }

    private static FeatureVector standing(double experience, double rating) {
        return new FeatureVector(1, List.of(1.0), experience, rating, List.of(), "pune", "maharashtra", List.of());
    }

    @Nested
    @DisplayName("skill-similarity")
    class SkillSimilarity {

        private final SkillSimilarityFactor factor = new SkillSimilarityFactor();

        @Test
        @DisplayName("should map cosine similarity onto the unit range")
        void cosine() {
            assertThat(factor.subscore(skills(1.0, 0.0), skills(2.0, 0.0))).isCloseTo(1.0, offset(1e-12));
            assertThat(factor.subscore(skills(1.0, 0.0), skills(0.0, 3.0))).isCloseTo(0.5, offset(1e-12));
            assertThat(factor.subscore(skills(1.0, 0.0), skills(-1.0, 0.0))).isCloseTo(0.0, offset(1e-12));
        }

        @Test
        @DisplayName("should fail on a zero vector or mismatched lengths")
        void uncomputable() {
            assertThatThrownBy(() -> factor.subscore(skills(0.0, 0.0), skills(1.0, 0.0)))
                    .isInstanceOf(FactorException.class)
                    .hasMessageContaining("zero norm");
            assertThatThrownBy(() -> factor.subscore(skills(1.0), skills(1.0, 0.0)))
                    .isInstanceOf(FactorException.class);
        }
    }

    @Nested
    @DisplayName("preference-alignment")
    class PreferenceAlignment {

        private final PreferenceAlignmentFactor factor = new PreferenceAlignmentFactor();

        @Test
        @DisplayName("should score the share of the slot's tags the candidate prefers")
        void overlap() {
            assertThat(factor.subscore(tags(0, 3), tags(0, 1))).isEqualTo(0.5);
            assertThat(factor.subscore(tags(0, 1), tags(0, 1))).isEqualTo(1.0);
            assertThat(factor.subscore(tags(4), tags(0, 1))).isZero();
        }

        @Test
        @DisplayName("should stay neutral when either side has no known tags")
        void neutral() {
            assertThat(factor.subscore(tags(), tags(0))).isEqualTo(0.5);
            assertThat(factor.subscore(tags(0), tags(FeatureVector.UNKNOWN_TAG))).isEqualTo(0.5);
        }
    }

    @Nested
    @DisplayName("geography-fit")
    class GeographyFit {

        private final GeographyFitFactor factor = new GeographyFitFactor(0.5);

        @Test
        @DisplayName("should give full credit for the same location and partial credit for the same region")
        void credit() {
            assertThat(factor.subscore(place("pune", "maharashtra"), place("pune", "maharashtra"))).isEqualTo(1.0);
            assertThat(factor.subscore(place("pune", "maharashtra"), place("mumbai", "maharashtra"))).isEqualTo(0.5);
            assertThat(factor.subscore(place("pune", "maharashtra"), place("delhi", "delhi"))).isZero();
        }

        @Test
        @DisplayName("should fail when a side has neither location nor region")
        void unknownPlace() {
            FeatureVector nowhere = place(FeatureVector.UNKNOWN_PLACE, FeatureVector.UNKNOWN_PLACE);

            assertThatThrownBy(() -> factor.subscore(nowhere, place("pune", "maharashtra")))
                    .isInstanceOf(FactorException.class);
            assertThatThrownBy(() -> factor.subscore(place("pune", "maharashtra"), nowhere))
                    .hasMessageContaining("Slot");
        }

        @Test
        @DisplayName("should reject a partial credit outside the unit range")
        void partialCreditRange() {
            assertThatThrownBy(() -> new GeographyFitFactor(1.5)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("experience-fit and academic-standing")
    class Standing {

        @Test
        @DisplayName("should penalize only an experience shortfall")
        void experience() {
            ExperienceFitFactor factor = new ExperienceFitFactor();

            assertThat(factor.subscore(standing(0.8, 0.5), standing(0.6, 0.5))).isEqualTo(1.0);
            assertThat(factor.subscore(standing(0.2, 0.5), standing(0.5, 0.5))).isCloseTo(0.7, offset(1e-12));
        }

        @Test
        @DisplayName("should use the candidate rating as is")
        void academic() {
            assertThat(new AcademicStandingFactor().subscore(standing(0.5, 0.35), standing(0.5, 0.9))).isEqualTo(0.35);
        }
    }
}
