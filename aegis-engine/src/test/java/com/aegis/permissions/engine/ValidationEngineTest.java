package com.aegis.permissions.engine;

import com.aegis.permissions.api.OverlapDetector;
import com.aegis.permissions.api.ValidationListener;
import com.aegis.permissions.api.exception.CacheImportException;
import com.aegis.permissions.api.model.BatchValidationResult;
import com.aegis.permissions.api.model.Conflict;
import com.aegis.permissions.api.model.ConflictKind;
import com.aegis.permissions.api.model.Overlap;
import com.aegis.permissions.api.model.OverlapKind;
import com.aegis.permissions.api.model.PermissionsConfig;
import com.aegis.permissions.api.model.RuleCategory;
import com.aegis.permissions.api.model.RuleStatistics;
import com.aegis.permissions.api.model.Severity;
import com.aegis.permissions.api.model.SuggestionKind;
import com.aegis.permissions.api.model.ValidationError;
import com.aegis.permissions.api.model.ValidationErrorType;
import com.aegis.permissions.api.model.ValidationOptions;
import com.aegis.permissions.api.model.ValidationPhase;
import com.aegis.permissions.api.model.ValidationResult;
import com.aegis.permissions.api.model.ValidationWarning;
import com.aegis.permissions.api.model.ValidationWarningType;
import com.aegis.permissions.infra.metrics.inmemory.InMemoryMetricsRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.InOrder;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@DisplayName("ValidationEngine")
class ValidationEngineTest {

    private static final ValidationOptions NO_CACHE = ValidationOptions.builder().skipCache(true).build();

    private ValidationEngine engine;

    @BeforeEach
    void setUp() {
        engine = ValidationEngine.builder()
                .config(EngineConfig.builder().performanceTargetMs(5_000).build())
                .build();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private static PermissionsConfig config(List<String> deny, List<String> allow, List<String> ask) {
        return PermissionsConfig.of(deny, allow, ask);
    }

    @Nested
    @DisplayName("Scenarios")
    class Scenarios {

        @Test
        @DisplayName("A: identical deny and allow rule is a critical zero-bypass violation")
        void identicalDenyAndAllow() {
            // when
            ValidationResult result = engine.validate(config(List.of("exec"), List.of("exec"), List.of()));

            // then
            assertThat(result.valid()).isFalse();
            assertThat(result.conflicts()).hasSize(1);
            Conflict conflict = result.conflicts().get(0);
            assertThat(conflict.kind()).isEqualTo(ConflictKind.ALLOW_OVERRIDES_DENY);
            assertThat(conflict.securityImpact()).isEqualTo(Severity.CRITICAL);
            assertThat(result.errors())
                    .filteredOn(e -> e.type() == ValidationErrorType.SECURITY_VIOLATION)
                    .hasSize(1)
                    .first()
                    .satisfies(error -> {
                        assertThat(error.message()).startsWith(ValidationEngine.ZERO_BYPASS_PREFIX);
                        assertThat(error.location()).isEqualTo("permissions.allow[0]");
                        assertThat(error.context()).containsEntry("denyRule", "exec");
                    });
        }

        @Test
        @DisplayName("B: allow rule inside a deny glob is a critical subset violation")
        void allowInsideDenyGlob() {
            ValidationResult result = engine.validate(config(List.of("*.exe"), List.of("app.exe"), List.of()));

            assertThat(result.valid()).isFalse();
            assertThat(result.conflicts())
                    .filteredOn(c -> c.kind() == ConflictKind.ALLOW_OVERRIDES_DENY)
                    .singleElement()
                    .satisfies(c -> {
                        assertThat(c.securityImpact()).isEqualTo(Severity.CRITICAL);
                        assertThat(c.message()).contains("is a subset of");
                    });
        }

        @Test
        @DisplayName("C: disjoint namespaces are valid")
        void disjointNamespaces() {
            ValidationResult result = engine.validate(config(List.of("dangerous/*"), List.of("safe/*"), List.of()));

            assertThat(result.valid()).isTrue();
            assertThat(result.conflicts()).isEmpty();
            assertThat(result.errors()).isEmpty();
            assertThat(result.securityScore()).isEqualTo(100);
            assertThat(result.configurationHash()).hasSize(64);
        }

        @Test
        @DisplayName("D: a duplicated deny rule is one overlapping-patterns conflict")
        void duplicatedDenyRule() {
            ValidationResult result = engine.validate(config(List.of("test/*", "test/*"), List.of(), List.of()));

            assertThat(result.conflicts()).singleElement()
                    .satisfies(c -> assertThat(c.kind()).isEqualTo(ConflictKind.OVERLAPPING_PATTERNS));
            assertThat(result.valid()).isTrue();
        }

        @Test
        @DisplayName("E: a thousand rules in disjoint namespaces validate completely")
        void thousandRules() {
            // given
            List<String> deny = new ArrayList<>();
            List<String> allow = new ArrayList<>();
            List<String> ask = new ArrayList<>();
            for (int i = 0; i < 400; i++) {
                deny.add("secrets/d" + i + "/*");
                allow.add("workspace/a" + i + "/*");
            }
            for (int i = 0; i < 200; i++) {
                ask.add("network/q" + i + "/*");
            }

            // when
            long start = System.nanoTime();
            ValidationResult result = engine.validate(config(deny, allow, ask), NO_CACHE);
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;

            // then
            assertThat(result.performance().rulesProcessed()).isEqualTo(1000);
            assertThat(result.conflicts()).isEmpty();
            assertThat(result.valid()).isTrue();
            assertThat(elapsedMs).isLessThan(30_000);
        }
    }

    @Nested
    @DisplayName("Zero-bypass enforcement")
    class ZeroBypass {

        @ParameterizedTest(name = "deny {0} / {1} {2}")
        @CsvSource({
                "exec, allow, exec",
                "*.exe, allow, app.exe",
                "secrets/key, allow, secrets/*",
                "secrets/*, ask, secrets/token",
                "rm -rf *, ask, rm -rf /tmp"
        })
        @DisplayName("Any permissive rule overlapping a deny rule invalidates the configuration")
        void overlappingPermissiveRuleIsFatal(String deny, String category, String permissive) {
            // given
            RuleCategory permissiveCategory = RuleCategory.fromKey(category);
            PermissionsConfig configuration = PermissionsConfig.empty()
                    .withRules(RuleCategory.DENY, List.of(deny))
                    .withRules(permissiveCategory, List.of(permissive));

            // when
            ValidationResult result = engine.validate(configuration, NO_CACHE);

            // then
            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).extracting(ValidationError::type)
                    .contains(ValidationErrorType.SECURITY_VIOLATION);
            assertThat(result.conflicts()).extracting(Conflict::kind)
                    .contains(ConflictKind.ALLOW_OVERRIDES_DENY);
        }

        @Test
        @DisplayName("skipConflictDetection still enforces zero-bypass")
        void cannotBeSkipped() {
            ValidationOptions options = ValidationOptions.builder().skipConflictDetection(true).skipCache(true).build();

            ValidationResult result = engine.validate(config(List.of("exec"), List.of("exec"), List.of()), options);

            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).extracting(ValidationError::message)
                    .anyMatch(m -> m.startsWith(ValidationEngine.ZERO_BYPASS_PREFIX));
        }

        @Test
        @DisplayName("An injected overlap detector decides what overlaps")
        void injectedDetector() {
            // given
            OverlapDetector everythingPartial = (a, b, probes) ->
                    new Overlap(a, b, OverlapKind.PARTIAL, List.of("shared"), 40.0, 40.0);

            try (ValidationEngine custom = ValidationEngine.builder().overlapDetector(everythingPartial).build()) {
                // when
                ValidationResult result = custom.validate(config(List.of("alpha"), List.of("beta"), List.of()));

                // then
                assertThat(result.valid()).isFalse();
                assertThat(result.conflicts()).extracting(Conflict::kind)
                        .contains(ConflictKind.ALLOW_OVERRIDES_DENY);
            }
        }

        @Test
        @DisplayName("A custom pattern that both rules match makes a partial overlap fatal")
        void customPatternWitness() {
            // given
            PermissionsConfig configuration = config(List.of("logs/*.key"), List.of("logs/app-*"), List.of());
            ValidationOptions withCustom = ValidationOptions.builder()
                    .skipCache(true)
                    .customPattern("logs/app-secret.key")
                    .build();

            // when
            ValidationResult plain = engine.validate(configuration, NO_CACHE);
            ValidationResult widened = engine.validate(configuration, withCustom);

            // then
            assertThat(plain.valid()).isTrue();
            assertThat(widened.valid()).isFalse();
            assertThat(widened.errors()).filteredOn(e -> e.type() == ValidationErrorType.SECURITY_VIOLATION)
                    .singleElement()
                    .satisfies(e -> {
                        assertThat(e.message()).startsWith(ValidationEngine.ZERO_BYPASS_PREFIX)
                                .contains("partially overlaps with");
                        assertThat(e.location()).isEqualTo("permissions.allow[0]");
                    });
        }

        @Test
        @DisplayName("Strict mode turns contradictory rules into rule-conflict errors")
        void strictContradictions() {
            ValidationOptions strict = ValidationOptions.builder().strictMode(true).skipCache(true).build();

            ValidationResult result = engine.validate(
                    config(List.of(), List.of("deploy/*"), List.of("deploy/prod")), strict);

            assertThat(result.conflicts()).extracting(Conflict::kind).contains(ConflictKind.CONTRADICTORY_RULES);
            assertThat(result.errors()).extracting(ValidationError::type).contains(ValidationErrorType.RULE_CONFLICT);
        }
    }

    @Nested
    @DisplayName("Rule checks and security analysis")
    class RuleChecks {

        @Test
        @DisplayName("Empty pattern is an invalid-pattern warning, not an error")
        void emptyPattern() {
            ValidationResult result = engine.validate(config(List.of(), List.of(""), List.of()));

            assertThat(result.valid()).isTrue();
            assertThat(result.warnings())
                    .anySatisfy(w -> {
                        assertThat(w.type()).isEqualTo(ValidationWarningType.INVALID_PATTERN);
                        assertThat(w.message()).isEqualTo("Empty rule pattern in allow rules");
                    });
        }

        @Test
        @DisplayName("Match-everything deny rule is a critical too-broad issue")
        void matchEverythingDeny() {
            ValidationResult result = engine.validate(config(List.of("*"), List.of(), List.of()));

            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).extracting(ValidationError::context)
                    .anySatisfy(context -> assertThat(context).containsEntry("issue", "OVERLY_BROAD"));
            assertThat(result.securityScore()).isLessThanOrEqualTo(80);
        }

        @Test
        @DisplayName("Match-everything allow rule is too broad and overly permissive")
        void matchEverythingAllow() {
            ValidationResult result = engine.validate(config(List.of(), List.of("*"), List.of()));

            assertThat(result.valid()).isFalse();
            assertThat(result.warnings()).extracting(ValidationWarning::message)
                    .contains("Overly broad pattern \"*\" in allow rules", "Overly permissive allow rule: \"*\"");
        }

        @Test
        @DisplayName("Weak deny rules lower the score without invalidating")
        void weakDeny() {
            ValidationResult result = engine.validate(config(List.of("*.sh"), List.of("docs/readme"), List.of()));

            assertThat(result.valid()).isTrue();
            assertThat(result.securityScore()).isEqualTo(95);
            assertThat(result.warnings()).extracting(ValidationWarning::message)
                    .contains("Weak deny pattern detected: \"*.sh\"");
        }

        @Test
        @DisplayName("Dangerous tokens in allow rules are flagged")
        void dangerousAllow() {
            ValidationResult result = engine.validate(config(List.of("secrets/*"), List.of("npm run spawn-server"),
                    List.of()));

            assertThat(result.warnings()).extracting(ValidationWarning::message)
                    .contains("Potentially dangerous pattern in allow rules: npm run spawn-server");
        }

        @Test
        @DisplayName("Missing deny rules are reported only when required")
        void missingDeny() {
            try (ValidationEngine requiring = ValidationEngine.builder()
                    .config(EngineConfig.builder().requireDenyRules(true).build())
                    .build()) {
                ValidationResult required = requiring.validate(config(List.of(), List.of("docs/readme"), List.of()));
                ValidationResult optional = engine.validate(config(List.of(), List.of("docs/readme"), List.of()));

                assertThat(required.warnings()).extracting(ValidationWarning::message)
                        .contains("No deny rules defined - security policy is too permissive");
                assertThat(optional.warnings()).extracting(ValidationWarning::message)
                        .doesNotContain("No deny rules defined - security policy is too permissive");
            }
        }

        @Test
        @DisplayName("Suggestions include conflict fixes and best-practice advice")
        void suggestions() {
            ValidationResult result = engine.validate(config(List.of("secrets/*"), List.of("secrets/*"), List.of()));

            assertThat(result.suggestions()).isNotEmpty();
            assertThat(result.suggestions()).anySatisfy(s -> assertThat(s.kind()).isEqualTo(SuggestionKind.FIX));
            assertThat(result.suggestions()).anySatisfy(s ->
                    assertThat(s.message()).isEqualTo("Consider adding deny rules for shell execution commands"));
        }
    }

    @Nested
    @DisplayName("Failure handling")
    class FailureHandling {

        @Test
        @DisplayName("Null configuration becomes an invalid-syntax result")
        void nullConfiguration() {
            ValidationResult result = engine.validate((PermissionsConfig) null, ValidationOptions.defaults());

            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).singleElement()
                    .satisfies(e -> {
                        assertThat(e.type()).isEqualTo(ValidationErrorType.INVALID_SYNTAX);
                        assertThat(e.message()).startsWith("Validation failed: ");
                    });
            assertThat(engine.getState().phase()).isEqualTo(ValidationPhase.FAILED);
        }

        @Test
        @DisplayName("Circular raw input becomes an invalid-syntax result")
        void circularInput() {
            // given
            Map<String, Object> permissions = new LinkedHashMap<>();
            Map<String, Object> raw = new LinkedHashMap<>();
            raw.put("permissions", permissions);
            permissions.put("parent", raw);

            // when
            ValidationResult result = engine.validate(raw, ValidationOptions.defaults());

            // then
            assertThat(result.valid()).isFalse();
            assertThat(result.errors().get(0).message()).contains("Circular reference");
        }

        @Test
        @DisplayName("Wrongly shaped raw input becomes an invalid-syntax result")
        void wrongShape() {
            ValidationResult result = engine.validate(Map.of("permissions", "deny everything"),
                    ValidationOptions.defaults());

            assertThat(result.valid()).isFalse();
            assertThat(result.errors().get(0).type()).isEqualTo(ValidationErrorType.INVALID_SYNTAX);
            assertThat(result.errors().get(0).message()).contains("'permissions' must be an object");
        }

        @Test
        @DisplayName("Excessively nested raw input becomes an invalid-syntax result")
        void deeplyNestedInput() {
            // given
            Map<String, Object> metadata = new HashMap<>();
            Map<String, Object> current = metadata;
            for (int i = 0; i < 200_000; i++) {
                Map<String, Object> child = new HashMap<>();
                current.put("child", child);
                current = child;
            }
            Map<String, Object> raw = new HashMap<>();
            raw.put("permissions", Map.of("deny", List.of("secrets/*")));
            raw.put("metadata", metadata);

            // when
            ValidationResult result = engine.validate(raw, ValidationOptions.defaults());

            // then
            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).singleElement().satisfies(error -> {
                assertThat(error.type()).isEqualTo(ValidationErrorType.INVALID_SYNTAX);
                assertThat(error.message()).contains("maximum depth");
            });
        }

        @Test
        @DisplayName("Non-string entries are dropped with a warning and keep later indices")
        void nonStringEntries() {
            // given
            Map<String, Object> raw = Map.of("permissions", Map.of("allow", List.of("ls", 42, "pwd")));

            // when
            ValidationResult result = engine.validate(raw, ValidationOptions.defaults());

            // then
            assertThat(result.valid()).isTrue();
            assertThat(result.performance().rulesProcessed()).isEqualTo(2);
            assertThat(result.warnings()).first()
                    .satisfies(w -> {
                        assertThat(w.type()).isEqualTo(ValidationWarningType.INVALID_PATTERN);
                        assertThat(w.location()).isEqualTo("permissions.allow[1]");
                    });
        }

        @Test
        @DisplayName("JSON text is parsed and validated")
        void jsonText() {
            ValidationResult invalid = engine.validateJson(
                    "{\"permissions\":{\"deny\":[\"exec\"],\"allow\":[\"exec\"]},\"metadata\":{\"owner\":\"ops\"}}",
                    ValidationOptions.defaults());
            ValidationResult malformed = engine.validateJson("{\"permissions\":", ValidationOptions.defaults());

            assertThat(invalid.valid()).isFalse();
            assertThat(invalid.conflicts()).hasSize(1);
            assertThat(malformed.valid()).isFalse();
            assertThat(malformed.errors().get(0).message()).contains("Malformed configuration JSON");
        }

        @Test
        @DisplayName("Strict timeout stops validation with a timeout error")
        void strictTimeout() {
            try (ValidationEngine slow = ValidationEngine.builder().overlapDetector(slowDetector(60)).build()) {
                ValidationOptions options = ValidationOptions.builder()
                        .timeoutMs(10).strictMode(true).skipCache(true).build();

                ValidationResult result = slow.validate(config(List.of("a/x"), List.of("b/y"), List.of()), options);

                assertThat(result.valid()).isFalse();
                assertThat(result.errors()).singleElement()
                        .satisfies(e -> {
                            assertThat(e.type()).isEqualTo(ValidationErrorType.INVALID_SYNTAX);
                            assertThat(e.message()).contains("timed out");
                        });
                assertThat(result.performance().achieved()).isFalse();
            }
        }

        @Test
        @DisplayName("Lenient timeout completes but misses the target")
        void lenientTimeout() {
            try (ValidationEngine slow = ValidationEngine.builder().overlapDetector(slowDetector(60)).build()) {
                ValidationOptions options = ValidationOptions.builder().timeoutMs(10).skipCache(true).build();

                ValidationResult result = slow.validate(config(List.of("a/x"), List.of("b/y"), List.of()), options);

                assertThat(result.valid()).isTrue();
                assertThat(result.performance().achieved()).isFalse();
                assertThat(result.warnings()).extracting(ValidationWarning::type)
                        .contains(ValidationWarningType.PERFORMANCE_WARNING);
            }
        }

        private OverlapDetector slowDetector(long delayMs) {
            return (a, b, probes) -> {
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return Overlap.none(a, b);
            };
        }
    }

    @Nested
    @DisplayName("Caching")
    class Caching {

        @Test
        @DisplayName("Repeated validation is idempotent")
        void idempotent() {
            PermissionsConfig configuration = config(List.of("*.exe", "secrets/*"), List.of("app.exe"),
                    List.of("deploy/*"));

            ValidationResult first = engine.validate(configuration, NO_CACHE);
            ValidationResult second = engine.validate(configuration, NO_CACHE);

            assertThat(second.valid()).isEqualTo(first.valid());
            assertThat(second.conflicts()).isEqualTo(first.conflicts());
            assertThat(second.configurationHash()).isEqualTo(first.configurationHash());
        }

        @Test
        @DisplayName("Second validation of equivalent content is a cache hit")
        void cacheHit() {
            // given
            InMemoryMetricsRegistry metrics = new InMemoryMetricsRegistry();
            try (ValidationEngine cached = ValidationEngine.builder()
                    .config(EngineConfig.builder().performanceTargetMs(5_000).build())
                    .metrics(metrics)
                    .build()) {

                // when
                ValidationResult first = cached.validate(config(List.of("a/*", "b/*"), List.of("c/*"), List.of()));
                ValidationResult second = cached.validate(config(List.of("b/*", "a/*"), List.of("c/*"), List.of()));

                // then
                assertThat(second).isEqualTo(first);
                assertThat(cached.getCacheStats().hits()).isEqualTo(1);
                assertThat(metrics.counterSnapshot()).containsEntry("aegis.validations", 2L);
            }
        }

        @Test
        @DisplayName("Exported cache can be imported into another engine")
        void exportImport() {
            PermissionsConfig configuration = config(List.of("secrets/*"), List.of("docs/*"), List.of());
            engine.validate(configuration);
            String exported = engine.exportCache();

            try (ValidationEngine other = ValidationEngine.builder()
                    .config(EngineConfig.builder().performanceTargetMs(5_000).build())
                    .build()) {
                other.importCache(exported);
                ValidationResult result = other.validate(configuration);

                assertThat(other.getCacheStats().hits()).isEqualTo(1);
                assertThat(result.valid()).isTrue();
            }
        }

        @Test
        @DisplayName("Import of malformed data propagates")
        void malformedImport() {
            assertThatThrownBy(() -> engine.importCache("not json"))
                    .isInstanceOf(CacheImportException.class);
        }

        @Test
        @DisplayName("Disabled cache never stores results")
        void disabledCache() {
            try (ValidationEngine uncached = ValidationEngine.builder()
                    .config(EngineConfig.builder().cacheEnabled(false).build())
                    .build()) {
                uncached.validate(config(List.of("a/*"), List.of(), List.of()));
                uncached.validate(config(List.of("a/*"), List.of(), List.of()));

                assertThat(uncached.getCacheStats().entries()).isZero();
                assertThat(uncached.getCacheStats().hits()).isZero();
            }
        }
    }

    @Nested
    @DisplayName("Batch and statistics")
    class BatchAndStatistics {

        @Test
        @DisplayName("Batch validation keeps input order and counts outcomes")
        void batch() {
            List<PermissionsConfig> configs = List.of(
                    config(List.of("secrets/*"), List.of("docs/*"), List.of()),
                    config(List.of("exec"), List.of("exec"), List.of()),
                    config(List.of("tmp/*"), List.of(), List.of("deploy/*")));

            BatchValidationResult batch = engine.validateBatch("nightly", configs, NO_CACHE);

            assertThat(batch.id()).isEqualTo("nightly");
            assertThat(batch.results()).extracting(ValidationResult::valid).containsExactly(true, false, true);
            assertThat(batch.successCount()).isEqualTo(2);
            assertThat(batch.failureCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Batch validation rejects a missing list and fails null entries in place")
        void batchNulls() {
            assertThatThrownBy(() -> engine.validateBatch("empty", null, NO_CACHE))
                    .isInstanceOf(NullPointerException.class)
                    .hasMessage("configs must not be null");

            BatchValidationResult batch = engine.validateBatch("partial",
                    Arrays.asList(config(List.of("tmp/*"), List.of(), List.of()), null), NO_CACHE);

            assertThat(batch.results()).extracting(ValidationResult::valid).containsExactly(true, false);
            assertThat(batch.results().get(1).errors().get(0).type()).isEqualTo(ValidationErrorType.INVALID_SYNTAX);
        }

        @Test
        @DisplayName("Statistics describe counts, complexity and coverage")
        void statistics() {
            // given
            PermissionsConfig configuration = config(
                    List.of("secrets/*", "secrets/*"),
                    List.of("ls", "^git (status|log)$"),
                    List.of("workspace/*"));

            // when
            RuleStatistics stats = engine.getRuleStatistics(configuration);

            // then
            assertThat(stats.totalRules()).isEqualTo(5);
            assertThat(stats.byCategory())
                    .containsEntry(RuleCategory.DENY, 2)
                    .containsEntry(RuleCategory.ALLOW, 2)
                    .containsEntry(RuleCategory.ASK, 1);
            assertThat(stats.complexity().regexPatterns()).isEqualTo(1);
            assertThat(stats.complexity().globPatterns()).isEqualTo(3);
            assertThat(stats.complexity().literalPatterns()).isEqualTo(1);
            assertThat(stats.complexity().maxPatternLength()).isEqualTo(18);
            assertThat(stats.coverage().estimatedCoverage()).isEqualTo(30);
            assertThat(stats.coverage().uncoveredRules()).containsExactly("workspace/*", "ls", "^git (status|log)$");
            assertThat(stats.coverage().redundantRules()).containsExactly("secrets/*");
            assertThat(engine.getCacheStats().entries()).isZero();
        }
    }

    @Nested
    @DisplayName("Listener and state")
    class ListenerAndState {

        @Test
        @DisplayName("Listener receives phase callbacks in pipeline order")
        void phaseOrder() {
            ValidationListener listener = mock(ValidationListener.class);
            try (ValidationEngine observed = ValidationEngine.builder().listener(listener).build()) {
                observed.validate(config(List.of("secrets/*"), List.of("docs/*"), List.of()), NO_CACHE);

                InOrder order = inOrder(listener);
                order.verify(listener).onPhaseStart(ValidationPhase.NORMALIZING, 0);
                order.verify(listener).onPhaseComplete(eq(ValidationPhase.NORMALIZING), any());
                order.verify(listener).onPhaseStart(ValidationPhase.VALIDATING, 2);
                order.verify(listener).onPhaseStart(ValidationPhase.DETECTING_CONFLICTS, 2);
                order.verify(listener).onPhaseStart(ValidationPhase.ANALYZING_SECURITY, 2);
                order.verify(listener).onPhaseStart(ValidationPhase.GENERATING_SUGGESTIONS, 2);
                verify(listener, never()).onError(any(), any());
                assertThat(observed.getState().phase()).isEqualTo(ValidationPhase.COMPLETE);
                assertThat(observed.getState().progress()).isEqualTo(100);
            }
        }

        @Test
        @DisplayName("A failing listener does not affect the result")
        void failingListener() {
            ValidationListener listener = mock(ValidationListener.class);
            doThrow(new IllegalStateException("listener down")).when(listener).onPhaseStart(any(), anyInt());
            try (ValidationEngine observed = ValidationEngine.builder().listener(listener).build()) {
                ValidationResult result = observed.validate(config(List.of("secrets/*"), List.of(), List.of()));

                assertThat(result.valid()).isTrue();
            }
        }

        @Test
        @DisplayName("Listener is told about failures")
        void errorCallback() {
            ValidationListener listener = mock(ValidationListener.class);
            try (ValidationEngine observed = ValidationEngine.builder().listener(listener).build()) {
                observed.validate((PermissionsConfig) null, ValidationOptions.defaults());

                verify(listener).onError(eq(ValidationPhase.INITIALIZING), any(NullPointerException.class));
            }
        }
    }
}
