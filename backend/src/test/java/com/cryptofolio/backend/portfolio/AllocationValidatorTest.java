package com.cryptofolio.backend.portfolio;

import com.cryptofolio.backend.exception.DimensionMismatchException;
import com.cryptofolio.backend.exception.InvalidWeightsException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

class AllocationValidatorTest {

    private final AllocationValidator validator = new AllocationValidator();

    @Test
    void overAllocatedWeightsAreRejectedWithTheirSum() {
        assertThatThrownBy(() -> validator.validate(WeightVector.of(0.5, 0.6)))
                .isInstanceOfSatisfying(InvalidWeightsException.class, e -> {
                    assertThat(e.getActualSum()).isCloseTo(1.1, offset(1e-12));
                    assertThat(e.getWeights()).containsExactly(0.5, 0.6);
                    assertThat(e.getMessage()).contains("Current sum: 110.00%");
                });
    }

    @Test
    void sumWithinToleranceIsAccepted() {
        assertThatCode(() -> validator.validate(WeightVector.of(0.4, 0.3, 0.3))).doesNotThrowAnyException();
        assertThatCode(() -> validator.validate(WeightVector.of(0.49995, 0.5))).doesNotThrowAnyException();
        assertThat(validator.isValid(WeightVector.of(0.4998, 0.5))).isFalse();
    }

    @Test
    void eachWeightMustBeAFraction() {
        assertThat(validator.isValid(WeightVector.of(-0.1, 1.1))).isFalse();
        assertThat(validator.isValid(WeightVector.of(1.5, -0.5))).isFalse();
        assertThat(validator.isValid(WeightVector.of(Double.NaN, 1.0))).isFalse();
        assertThat(validator.isValid(WeightVector.of())).isFalse();
        assertThat(validator.isValid(null)).isFalse();
    }

    @Test
    void weightsAreCheckedBeforeDimension() {
        assertThatThrownBy(() -> validator.validate(WeightVector.of(0.5, 0.5), 3))
                .isInstanceOfSatisfying(DimensionMismatchException.class, e -> {
                    assertThat(e.getExpected()).isEqualTo(3);
                    assertThat(e.getActual()).isEqualTo(2);
                });
        assertThatThrownBy(() -> validator.validate(WeightVector.of(0.5, 0.6), 3))
                .isInstanceOf(InvalidWeightsException.class);
    }

    @Test
    void equalWeightsAreAlwaysValid() {
        WeightVector weights = AllocationValidator.equalWeights(3);

        assertThat(weights.asList()).containsExactly(1.0 / 3, 1.0 / 3, 1.0 / 3);
        assertThat(validator.isValid(weights)).isTrue();
        assertThatThrownBy(() -> AllocationValidator.equalWeights(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
