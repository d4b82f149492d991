package com.aegis.permissions.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Model invariants")
class ModelInvariantsTest {

    @Nested
    @DisplayName("PermissionsConfig")
    class PermissionsConfigTests {

        @Test
        @DisplayName("Should treat missing categories as empty and keep null entries")
        void missingCategories() {
            PermissionsConfig config = PermissionsConfig.of(Arrays.asList("secrets/*", null), null, null);

            assertThat(config.deny()).containsExactly("secrets/*", null);
            assertThat(config.allow()).isEmpty();
            assertThat(config.ask()).isEmpty();
            assertThat(config.metadata()).isEmpty();
            assertThat(config.totalRules()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should be isolated from later changes to the source lists")
        void copiesInput() {
            // given
            List<String> allow = new ArrayList<>(List.of("docs/*"));
            PermissionsConfig config = PermissionsConfig.of(List.of(), allow, List.of());

            // when
            allow.add("src/*");

            // then
            assertThat(config.allow()).containsExactly("docs/*");
            assertThatThrownBy(() -> config.allow().add("x")).isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        @DisplayName("withRules should replace only the requested category")
        void withRules() {
            PermissionsConfig config = PermissionsConfig.of(List.of("a"), List.of("b"), List.of("c"));

            PermissionsConfig updated = config.withRules(RuleCategory.ASK, List.of("d", "e"));

            assertThat(updated.rules(RuleCategory.DENY)).containsExactly("a");
            assertThat(updated.rules(RuleCategory.ALLOW)).containsExactly("b");
            assertThat(updated.rules(RuleCategory.ASK)).containsExactly("d", "e");
            assertThat(config.ask()).containsExactly("c");
        }
    }

    @Nested
    @DisplayName("ValidationOptions")
    class ValidationOptionsTests {

        @Test
        @DisplayName("Defaults should enable parallelism and nothing else")
        void defaults() {
            ValidationOptions options = ValidationOptions.defaults();

            assertThat(options.strictMode()).isFalse();
            assertThat(options.skipConflictDetection()).isFalse();
            assertThat(options.skipCache()).isFalse();
            assertThat(options.timeoutMs()).isZero();
            assertThat(options.parallel()).isTrue();
            assertThat(options.customPatterns()).isEmpty();
        }

        @Test
        @DisplayName("Should reject negative timeouts and worker counts")
        void rejectsNegatives() {
            assertThatThrownBy(() -> ValidationOptions.builder().timeoutMs(-1).build())
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("timeoutMs");
            assertThatThrownBy(() -> ValidationOptions.builder().workerCount(-2).build())
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("workerCount");
        }

        @Test
        @DisplayName("Should accumulate custom probe patterns")
        void customPatterns() {
            ValidationOptions options = ValidationOptions.builder()
                    .customPattern("probe-1")
                    .customPatterns(List.of("probe-2", "probe-3"))
                    .build();

            assertThat(options.customPatterns()).containsExactly("probe-1", "probe-2", "probe-3");
        }
    }

    @Nested
    @DisplayName("ValidationResult")
    class ValidationResultTests {

        @Test
        @DisplayName("Validity must agree with the error list")
        void validityMatchesErrors() {
            ValidationPerformance performance = new ValidationPerformance(1, 0, 100, true);

            assertThatThrownBy(() -> new ValidationResult(false, List.of(), List.of(), List.of(), List.of(),
                    performance, "hash", 100))
                    .isInstanceOf(IllegalArgumentException.class);

            ValidationResult result = ValidationResult.of(List.of(), List.of(), List.of(), List.of(),
                    performance, "hash", 100);
            assertThat(result.valid()).isTrue();
        }

        @Test
        @DisplayName("Failure should carry a single critical syntax error")
        void failure() {
            ValidationResult result = ValidationResult.failure("Validation failed: boom", 12, 100);

            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).singleElement().satisfies(error -> {
                assertThat(error.type()).isEqualTo(ValidationErrorType.INVALID_SYNTAX);
                assertThat(error.severity()).isEqualTo(Severity.CRITICAL);
                assertThat(error.message()).isEqualTo("Validation failed: boom");
            });
            assertThat(result.performance().achieved()).isFalse();
            assertThat(result.securityScore()).isZero();
        }
    }
}
