package com.typeguesser.decider;

import com.typeguesser.config.GuessSettings;
import com.typeguesser.exception.InvalidDeciderConfigurationException;
import com.typeguesser.test.TestBase;
import com.typeguesser.test.TestCategories;
import com.typeguesser.types.TypeTag;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("DeciderRegistry Tests")
public class DeciderRegistryTest extends TestBase {

    private final DeciderRegistry registry = DeciderRegistry.defaultRegistry();

    // ==================== Default Registry ====================

    @Nested
    @DisplayName("Default Registry")
    class DefaultRegistry {

        @Test
        @DisplayName("Preference order is boolean, integer, decimal, datetime, duration, string")
        void testPreferenceOrder() {
            assertThat(registry.preferenceOrder())
                .extracting(TypeDecider::typeTag)
                .containsExactly(TypeTag.BOOLEAN, TypeTag.INTEGER, TypeTag.DECIMAL,
                    TypeTag.DATE_TIME, TypeTag.DURATION, TypeTag.STRING);
            assertThat(registry.size()).isEqualTo(6);
            assertThat(registry.stringDecider()).isSameAs(StringTypeDecider.get());
        }

        @Test
        @DisplayName("Preference order cannot be modified")
        void testImmutable() {
            assertThatThrownBy(() -> registry.preferenceOrder().add(StringTypeDecider.get()))
                .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        @DisplayName("Lookup by tag and index agree")
        void testLookups() {
            for (int i = 0; i < registry.size(); i++) {
                TypeDecider decider = registry.get(i);
                assertThat(registry.indexOf(decider)).isEqualTo(i);
                assertThat(registry.forTag(decider.typeTag())).isSameAs(decider);
                assertThat(registry.contains(decider.typeTag())).isTrue();
            }
        }

        @Test
        @DisplayName("Scalar types are non-empty and disjoint")
        void testScalarTypesDisjoint() {
            Set<Class<?>> seen = new HashSet<>();
            for (TypeDecider decider : registry.preferenceOrder()) {
                assertThat(decider.scalarTypes()).isNotEmpty();
                for (Class<?> type : decider.scalarTypes()) {
                    assertThat(seen.add(type)).as("%s registered twice", type).isTrue();
                }
            }
        }

        @Test
        @DisplayName("Scalars are looked up by class")
        void testForScalar() {
            assertThat(registry.forScalar(5)).isSameAs(IntegerTypeDecider.get());
            assertThat(registry.forScalar(BigDecimal.ONE)).isSameAs(DecimalTypeDecider.get());
            assertThat(registry.forScalar(LocalDate.EPOCH)).isSameAs(DateTimeTypeDecider.get());
            assertThat(registry.forScalar(Duration.ZERO)).isSameAs(DurationTypeDecider.get());
            assertThat(registry.forScalar(UUID.randomUUID())).isSameAs(StringTypeDecider.get());
            assertThat(registry.forScalar(new Object())).isNull();
            assertThat(registry.forScalar(null)).isNull();
        }

        @ParameterizedTest
        @DisplayName("Text is classified by the first accepting decider")
        @CsvSource({
            "true, BOOLEAN",
            "12, INTEGER",
            "1.5, DECIMAL",
            "2001-01-01, DATE_TIME",
            "10:30, DURATION",
            "abc, STRING",
            "1, INTEGER"
        })
        void testClassify(String candidate, TypeTag expected) {
            assertThat(registry.classify(candidate, new GuessSettings()).typeTag()).isEqualTo(expected);
        }
    }

    // ==================== Custom Registries ====================

    @Nested
    @DisplayName("Custom Registries")
    class CustomRegistries {

        @Test
        @DisplayName("A subset registry works without the missing types")
        void testSubset() {
            DeciderRegistry numbersOnly = new DeciderRegistry(
                List.of(IntegerTypeDecider.get(), DecimalTypeDecider.get(), StringTypeDecider.get()));

            assertThat(numbersOnly.contains(TypeTag.BOOLEAN)).isFalse();
            assertThat(numbersOnly.indexOf(BooleanTypeDecider.get())).isEqualTo(-1);
            assertThat(numbersOnly.classify("true", new GuessSettings()).typeTag()).isEqualTo(TypeTag.STRING);
            assertThatThrownBy(() -> numbersOnly.forTag(TypeTag.DURATION))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("duration");
        }

        @Test
        @DisplayName("An empty registry is rejected")
        void testEmpty() {
            assertThatThrownBy(() -> new DeciderRegistry(List.of()))
                .isInstanceOf(InvalidDeciderConfigurationException.class);
        }

        @Test
        @DisplayName("The string decider must come last")
        void testStringLast() {
            assertThatThrownBy(() -> new DeciderRegistry(List.of(StringTypeDecider.get(), IntegerTypeDecider.get())))
                .isInstanceOf(InvalidDeciderConfigurationException.class)
                .hasMessageContaining("last");
        }

        @Test
        @DisplayName("A type may be registered once")
        void testDuplicates() {
            List<TypeDecider> deciders = new ArrayList<>();
            deciders.add(IntegerTypeDecider.get());
            deciders.add(IntegerTypeDecider.get());
            deciders.add(StringTypeDecider.get());

            assertThatThrownBy(() -> new DeciderRegistry(deciders))
                .isInstanceOf(InvalidDeciderConfigurationException.class)
                .hasMessageContaining("more than once");
        }

        @Test
        @DisplayName("A decider must claim at least one scalar type")
        void testNoScalarTypes() {
            assertThatThrownBy(() -> DeciderSupport.scalarTypes(TypeTag.BOOLEAN))
                .isInstanceOf(InvalidDeciderConfigurationException.class)
                .hasMessageContaining("boolean");
        }
    }
}
