package com.typeguesser.decider;

import com.typeguesser.config.CultureConfig;
import com.typeguesser.config.ExplicitDatePolicy;
import com.typeguesser.config.GuessSettings;
import com.typeguesser.exception.TypeParseException;
import com.typeguesser.exception.UnsupportedTypeException;
import com.typeguesser.test.TestBase;
import com.typeguesser.test.TestCategories;
import com.typeguesser.types.CompatibilityGroup;
import com.typeguesser.types.DataSize;
import com.typeguesser.types.TypeTag;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.util.Locale;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("DecimalTypeDecider Tests")
public class DecimalTypeDeciderTest extends TestBase {

    private final DecimalTypeDecider decider = DecimalTypeDecider.get();
    private final GuessSettings settings = new GuessSettings();

    // ==================== Text Acceptance ====================

    @Nested
    @DisplayName("Text Acceptance")
    class TextAcceptance {

        @ParameterizedTest(name = "{0} -> ({1},{2})")
        @DisplayName("Digits before and after the separator are counted as written")
        @CsvSource({
            // candidate, integerDigits, fractionalDigits
            "1.5, 1, 1",
            "-12.340, 2, 3",
            "0.5, 0, 1",
            ".5, 0, 1",
            "5., 1, 0",
            "'1,234.5', 4, 1",
            "1E3, 4, 0",
            "1.5e-3, 0, 4",
            "12, 2, 0",
            "+100, 3, 0"
        })
        void testAccepts(String candidate, int integerDigits, int fractionalDigits) {
            assertThat(decider.sizeIfAcceptable(candidate, settings))
                .isEqualTo(DataSize.ofNumeric(integerDigits, fractionalDigits));
        }

        @ParameterizedTest
        @DisplayName("Malformed numbers and non-finite words are rejected")
        @ValueSource(strings = {"1.2.3", "abc", "NaN", "Infinity", "1e", "e5", "1,5", ".", "-", "1.5%", "(5)"})
        void testRejects(String candidate) {
            assertThat(decider.isAcceptable(candidate, settings)).isFalse();
        }

        @Test
        @DisplayName("Separators follow the culture")
        void testCultureSeparators() {
            GuessSettings german = new GuessSettings().withCultureConfig(CultureConfig.forLocale(Locale.GERMANY));

            assertThat(decider.sizeIfAcceptable("1,5", german)).isEqualTo(DataSize.ofNumeric(1, 1));
            assertThat(decider.sizeIfAcceptable("1.234,5", german)).isEqualTo(DataSize.ofNumeric(4, 1));
            assertThat(decider.isAcceptable("1.5", german)).isFalse();
        }

        @Test
        @DisplayName("Explicit dates are not decimals")
        void testExplicitDateRejected() {
            GuessSettings compact = new GuessSettings().withExplicitDatePolicy(ExplicitDatePolicy.compactIsoDates());

            assertThat(decider.isAcceptable("20010131", compact)).isFalse();
        }
    }

    // ==================== Parsing ====================

    @Nested
    @DisplayName("Parsing")
    class Parsing {

        @Test
        @DisplayName("Parse keeps the written scale")
        void testParse() {
            assertThat(decider.parse("1.50", settings)).isEqualTo(new BigDecimal("1.50"));
            assertThat(decider.parse("1,000", settings)).isEqualTo(new BigDecimal("1000"));
            assertThat(decider.parse("2E2", settings)).isEqualTo(new BigDecimal("200"));
        }

        @Test
        @DisplayName("Parse of a non-number fails")
        void testParseFailure() {
            assertThatThrownBy(() -> decider.parse("12:30", settings))
                .isInstanceOf(TypeParseException.class);
        }
    }

    // ==================== Hard-Typed Values ====================

    @Nested
    @DisplayName("Hard-Typed Values")
    class HardTyped {

        @Test
        @DisplayName("Decider identity and scalar types")
        void testIdentity() {
            assertThat(decider.typeTag()).isEqualTo(TypeTag.DECIMAL);
            assertThat(decider.compatibilityGroup()).isEqualTo(CompatibilityGroup.NUMERICAL);
            assertThat(decider.scalarTypes()).containsExactlyInAnyOrder(BigDecimal.class, Float.class, Double.class);
        }

        @Test
        @DisplayName("Scalar sizes follow the decimal rendering")
        void testSizeOfScalar() {
            assertThat(decider.sizeOfScalar(1.25d)).isEqualTo(new DataSize(1, 2, 4));
            assertThat(decider.sizeOfScalar(2.5f)).isEqualTo(new DataSize(1, 1, 3));
            assertThat(decider.sizeOfScalar(new BigDecimal("-0.05"))).isEqualTo(new DataSize(0, 2, 5));
            assertThat(decider.sizeOfScalar(1e20)).isEqualTo(new DataSize(21, 0, 21));
            assertThat(decider.sizeOfScalar(new BigDecimal("1E+3"))).isEqualTo(new DataSize(4, 0, 4));
        }

        @Test
        @DisplayName("Non-finite floating point values are unsupported")
        void testNonFinite() {
            assertThatThrownBy(() -> decider.sizeOfScalar(Double.NaN))
                .isInstanceOfSatisfying(UnsupportedTypeException.class,
                    e -> assertThat(e.getUnsupportedType()).isEqualTo(Double.class));
            assertThatThrownBy(() -> decider.sizeOfScalar(Float.POSITIVE_INFINITY))
                .isInstanceOf(UnsupportedTypeException.class);
        }

        @ParameterizedTest
        @DisplayName("Static measures of BigDecimal values")
        @CsvSource({
            // value, integerDigits, fractionalDigits, renderedLength
            "123.45, 3, 2, 6",
            "0.001, 0, 3, 5",
            "-7, 1, 0, 2",
            "0, 1, 0, 1",
            "1E+2, 3, 0, 3"
        })
        void testStaticMeasures(String value, int integerDigits, int fractionalDigits, int rendered) {
            BigDecimal decimal = new BigDecimal(value);

            assertThat(DecimalTypeDecider.integerDigits(decimal)).isEqualTo(integerDigits);
            assertThat(DecimalTypeDecider.fractionalDigits(decimal)).isEqualTo(fractionalDigits);
            assertThat(DecimalTypeDecider.renderedLength(decimal)).isEqualTo(rendered);
        }

        @Test
        @DisplayName("Rendered length of accreted digits includes the separator")
        void testRenderedLength() {
            assertThat(decider.renderedLength(3, 2, 0)).isEqualTo(6);
            assertThat(decider.renderedLength(0, 2, 0)).isEqualTo(4);
            assertThat(decider.renderedLength(3, 2, 10)).isEqualTo(10);
        }
    }
}
