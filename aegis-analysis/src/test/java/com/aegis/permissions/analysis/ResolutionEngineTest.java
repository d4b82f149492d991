package com.aegis.permissions.analysis;

import com.aegis.permissions.api.model.AutoFix;
import com.aegis.permissions.api.model.Change;
import com.aegis.permissions.api.model.ChangeAction;
import com.aegis.permissions.api.model.Conflict;
import com.aegis.permissions.api.model.ConflictKind;
import com.aegis.permissions.api.model.ConflictingRule;
import com.aegis.permissions.api.model.NormalizedRule;
import com.aegis.permissions.api.model.PermissionsConfig;
import com.aegis.permissions.api.model.ResolutionStrategy;
import com.aegis.permissions.api.model.ResolutionSuggestion;
import com.aegis.permissions.api.model.RuleCategory;
import com.aegis.permissions.api.model.SecurityLevel;
import com.aegis.permissions.api.model.Severity;
import com.aegis.permissions.api.model.SuggestionKind;
import com.aegis.permissions.pattern.CorpusOverlapDetector;
import com.aegis.permissions.pattern.PatternAnalyzer;
import com.aegis.permissions.pattern.PatternEngine;
import com.aegis.permissions.pattern.RuleNormalizer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ResolutionEngine")
class ResolutionEngineTest {

    private RuleNormalizer normalizer;
    private ConflictDetectionEngine detection;
    private ResolutionEngine resolution;

    @BeforeEach
    void setUp() {
        PatternEngine patternEngine = new PatternEngine();
        PatternAnalyzer analyzer = new PatternAnalyzer();
        CorpusOverlapDetector detector = new CorpusOverlapDetector(analyzer);
        normalizer = new RuleNormalizer(patternEngine);
        detection = new ConflictDetectionEngine(detector, analyzer);
        resolution = new ResolutionEngine(detector, patternEngine, detection);
    }

    @AfterEach
    void tearDown() {
        detection.close();
    }

    private ResolutionContext context(PermissionsConfig config, SecurityLevel level) {
        List<NormalizedRule> rules = normalizer.normalize(config);
        return new ResolutionContext(rules, detection.detectConflicts(rules).conflicts(), level, true);
    }

    private static Conflict conflict(ConflictKind kind, Severity severity, ConflictingRule... rules) {
        return new Conflict(kind, "Test conflict.", List.of(rules), ResolutionStrategy.MANUAL_REVIEW_REQUIRED, severity);
    }

    private static ConflictingRule rule(RuleCategory category, String pattern) {
        return new ConflictingRule(category, pattern, "permissions." + category.key() + "[0]");
    }

    @Nested
    @DisplayName("Allow overrides deny")
    class AllowOverridesDeny {

        @Test
        @DisplayName("Strict mode removes the allow rule")
        void strictRemovesAllow() {
            // given
            ResolutionContext context = context(PermissionsConfig.of(List.of("exec"), List.of("exec"), null),
                    SecurityLevel.STRICT);

            // when
            List<ResolutionSuggestion> suggestions = resolution.generateResolutions(context);

            // then
            assertThat(suggestions).singleElement().satisfies(s -> {
                assertThat(s.kind()).isEqualTo(SuggestionKind.FIX);
                assertThat(s.autoFix().change()).isEqualTo(
                        new Change.Remove(RuleCategory.ALLOW, "exec", "Resolve ALLOW_OVERRIDES_DENY with deny rule \"exec\""));
            });
        }

        @Test
        @DisplayName("Moderate mode narrows the allow rule to a verified pattern")
        void moderateRestricts() {
            ResolutionContext context = context(PermissionsConfig.of(List.of("exec"), List.of("exec"), null),
                    SecurityLevel.MODERATE);

            List<ResolutionSuggestion> suggestions = resolution.generateResolutions(context);

            assertThat(suggestions).singleElement().satisfies(s -> {
                assertThat(s.kind()).isEqualTo(SuggestionKind.FIX);
                Change.Modify modify = (Change.Modify) s.autoFix().change();
                assertThat(modify.category()).isEqualTo(RuleCategory.ALLOW);
                assertThat(modify.originalPattern()).isEqualTo("exec");
                assertThat(modify.newPattern()).isEqualTo("safe/exec");
            });
        }

        @Test
        @DisplayName("A restriction that still overlaps a deny rule is never surfaced")
        void unverifiedRestrictionDropped() {
            ResolutionContext context = context(PermissionsConfig.of(List.of("*"), List.of("*"), null),
                    SecurityLevel.MODERATE);
            Conflict bypass = context.conflicts().stream()
                    .filter(c -> c.kind() == ConflictKind.ALLOW_OVERRIDES_DENY)
                    .findFirst().orElseThrow();

            Optional<ResolutionSuggestion> suggestion = resolution.resolveConflict(bypass, context);

            assertThat(suggestion).hasValueSatisfying(s -> {
                assertThat(s.autoFix()).isNull();
                assertThat(s.kind()).isEqualTo(SuggestionKind.WARNING);
                assertThat(s.message()).contains("dangerous.*").contains("never modified automatically");
            });
        }

        @Test
        @DisplayName("Disabling automatic fixes keeps the guidance only")
        void noAutomaticFixes() {
            List<NormalizedRule> rules = normalizer.normalize(PermissionsConfig.of(List.of("exec"), List.of("exec"), null));
            ResolutionContext context = new ResolutionContext(rules, detection.detectConflicts(rules).conflicts(),
                    SecurityLevel.STRICT, false);

            assertThat(resolution.generateResolutions(context)).singleElement()
                    .satisfies(s -> assertThat(s.fix()).isEmpty());
        }
    }

    @Nested
    @DisplayName("Other conflict kinds")
    class OtherKinds {

        @Test
        @DisplayName("Duplicate deny rules are never removed automatically")
        void duplicateDenyRules() {
            Conflict duplicate = conflict(ConflictKind.OVERLAPPING_PATTERNS, Severity.MEDIUM,
                    rule(RuleCategory.DENY, "test/*"), rule(RuleCategory.DENY, "test/*"));
            ResolutionContext strict = new ResolutionContext(List.of(), List.of(duplicate), SecurityLevel.STRICT, true);
            ResolutionContext moderate = new ResolutionContext(List.of(), List.of(duplicate), SecurityLevel.MODERATE, true);

            assertThat(resolution.resolveConflict(duplicate, strict)).isEmpty();
            assertThat(resolution.resolveConflict(duplicate, moderate)).hasValueSatisfying(s -> {
                assertThat(s.kind()).isEqualTo(SuggestionKind.WARNING);
                assertThat(s.autoFix()).isNull();
            });
        }

        @Test
        @DisplayName("Contradictory allow and ask rules need manual review")
        void contradictory() {
            Conflict contradictory = conflict(ConflictKind.CONTRADICTORY_RULES, Severity.HIGH,
                    rule(RuleCategory.ASK, "docs/*"), rule(RuleCategory.ALLOW, "docs/*"));
            ResolutionContext context = new ResolutionContext(List.of(), List.of(contradictory), SecurityLevel.MODERATE, true);

            assertThat(resolution.resolveConflict(contradictory, context)).hasValueSatisfying(s ->
                    assertThat(s.message()).isEqualTo("Manual review required for CONTRADICTORY_RULES: Test conflict. "
                            + "Review the business logic to determine the correct precedence."));
        }

        @Test
        @DisplayName("Critical weaknesses ask for immediate attention")
        void criticalWeakness() {
            Conflict weakness = conflict(ConflictKind.SECURITY_VIOLATION, Severity.CRITICAL,
                    rule(RuleCategory.ALLOW, "*"));
            ResolutionContext context = new ResolutionContext(List.of(), List.of(weakness), SecurityLevel.STRICT, true);

            assertThat(resolution.resolveConflict(weakness, context)).hasValueSatisfying(s ->
                    assertThat(s.message()).endsWith("requires immediate attention."));
        }

        @Test
        @DisplayName("Strategy order depends on the security level")
        void strategyOrder() {
            assertThat(ResolutionEngine.strategiesFor(ConflictKind.ALLOW_OVERRIDES_DENY, SecurityLevel.STRICT).get(0))
                    .isEqualTo(ResolutionStrategy.REMOVE_CONFLICTING_RULE);
            assertThat(ResolutionEngine.strategiesFor(ConflictKind.ALLOW_OVERRIDES_DENY, SecurityLevel.PERMISSIVE).get(0))
                    .isEqualTo(ResolutionStrategy.MAKE_ALLOW_MORE_RESTRICTIVE);
        }
    }

    @Nested
    @DisplayName("Pattern rewrites")
    class Rewrites {

        @Test
        @DisplayName("Restriction templates")
        void restrictionTemplates() {
            assertThat(ResolutionEngine.restrict(ConflictKind.ALLOW_OVERRIDES_DENY, "**")).isEqualTo("*.safe");
            assertThat(ResolutionEngine.restrict(ConflictKind.ALLOW_OVERRIDES_DENY, "rm")).isEqualTo("safe/rm");
            assertThat(ResolutionEngine.restrict(ConflictKind.OVERLAPPING_PATTERNS, "src/*")).isEqualTo("src/*.txt");
            assertThat(ResolutionEngine.restrict(ConflictKind.OVERLAPPING_PATTERNS, "**")).isEqualTo("safe/**");
            assertThat(ResolutionEngine.restrict(ConflictKind.OVERLAPPING_PATTERNS, "lib/a.js")).isEqualTo("lib/a.js.allowed");
        }

        @Test
        @DisplayName("Deny narrowing templates")
        void denyTemplates() {
            assertThat(ResolutionEngine.narrowDeny("*")).isEqualTo("dangerous.*");
            assertThat(ResolutionEngine.narrowDeny("**")).isEqualTo("**/dangerous/**");
            assertThat(ResolutionEngine.narrowDeny("exec")).isEqualTo("dangerous/exec");
            assertThat(ResolutionEngine.narrowDeny("bin/*")).isEqualTo("bin/dangerous");
            assertThat(ResolutionEngine.narrowDeny("bin/tool")).isEqualTo("bin/tool.dangerous");
            assertThat(ResolutionEngine.narrowDeny("bin/tool.sh")).isNull();
        }

        @Test
        @DisplayName("Wildcards lower specificity and security score")
        void scores() {
            assertThat(ResolutionEngine.specificity("src/main.js")).isGreaterThan(ResolutionEngine.specificity("*"));
            assertThat(ResolutionEngine.securityScore("secret/key")).isEqualTo(95);
            assertThat(ResolutionEngine.securityScore("*")).isEqualTo(41);
        }
    }

    @Nested
    @DisplayName("Optimization")
    class Optimization {

        private ResolutionSuggestion warning(String message) {
            return ResolutionSuggestion.guidance(SuggestionKind.WARNING, message);
        }

        @Test
        @DisplayName("Fixes come before warnings and optimizations; duplicates collapse")
        void orderAndDedup() {
            ResolutionSuggestion fix = new ResolutionSuggestion(SuggestionKind.FIX, "remove",
                    new AutoFix("remove", new Change.Remove(RuleCategory.ALLOW, "exec", "r")));
            ResolutionSuggestion sameTarget = new ResolutionSuggestion(SuggestionKind.FIX, "modify",
                    new AutoFix("modify", new Change.Modify(RuleCategory.ALLOW, "exec", "safe/exec", "r")));
            ResolutionSuggestion optimization = ResolutionSuggestion.guidance(SuggestionKind.OPTIMIZATION, "simplify");

            List<ResolutionSuggestion> optimized = resolution.optimizeResolutions(
                    List.of(optimization, warning("check"), fix, sameTarget), SecurityLevel.MODERATE);

            assertThat(optimized).extracting(ResolutionSuggestion::kind)
                    .containsExactly(SuggestionKind.FIX, SuggestionKind.WARNING, SuggestionKind.OPTIMIZATION);
            assertThat(optimized.get(0)).isSameAs(fix);
        }

        @Test
        @DisplayName("Permissive mode caps suggestions but keeps critical ones")
        void permissiveCap() {
            List<ResolutionSuggestion> suggestions = new ArrayList<>();
            for (int i = 0; i < 15; i++) {
                suggestions.add(warning("warning " + i));
            }
            suggestions.add(warning("CRITICAL issue"));
            suggestions.add(warning("zero-bypass issue"));

            List<ResolutionSuggestion> optimized = resolution.optimizeResolutions(suggestions, SecurityLevel.PERMISSIVE);

            assertThat(optimized).hasSize(10);
            assertThat(optimized).extracting(ResolutionSuggestion::message)
                    .contains("CRITICAL issue", "zero-bypass issue", "warning 0");
            assertThat(resolution.optimizeResolutions(suggestions, SecurityLevel.STRICT)).hasSize(17);
        }
    }

    @Nested
    @DisplayName("Applying resolutions")
    class Applying {

        @Test
        @DisplayName("Applied restrictions resolve the bypass")
        void applyRestriction() {
            // given
            PermissionsConfig config = PermissionsConfig.of(List.of("exec"), List.of("exec", "ls"), null);
            List<ResolutionSuggestion> suggestions = resolution.generateResolutions(context(config, SecurityLevel.MODERATE));

            // when
            ResolutionResult result = resolution.applyResolutions(config, suggestions);

            // then
            assertThat(result.success()).isTrue();
            assertThat(result.resolvedConfig().allow()).containsExactly("safe/exec", "ls");
            assertThat(result.resolvedConfig().deny()).containsExactly("exec");
            assertThat(result.changes()).singleElement().satisfies(change -> {
                assertThat(change.type()).isEqualTo(ChangeAction.MODIFY);
                assertThat(change.risk()).isEqualTo(ChangeRisk.MODERATE);
                assertThat(change.position()).isZero();
            });
            assertThat(result.remainingConflicts()).isEmpty();
        }

        @Test
        @DisplayName("Changes to deny rules are refused")
        void denyChangesRefused() {
            PermissionsConfig config = PermissionsConfig.of(List.of("exec"), List.of("exec"), null);
            ResolutionSuggestion removeDeny = new ResolutionSuggestion(SuggestionKind.FIX, "drop deny",
                    new AutoFix("Remove deny rule \"exec\"", new Change.Remove(RuleCategory.DENY, "exec", "r")));

            ResolutionResult result = resolution.applyResolutions(config, List.of(removeDeny));

            assertThat(result.success()).isFalse();
            assertThat(result.changes()).isEmpty();
            assertThat(result.resolvedConfig().deny()).containsExactly("exec");
            assertThat(result.messages()).anyMatch(m -> m.startsWith("Refused"));
            assertThat(result.remainingConflicts()).extracting(Conflict::kind)
                    .contains(ConflictKind.ALLOW_OVERRIDES_DENY);
        }

        @Test
        @DisplayName("Add and reorder changes")
        void addAndReorder() {
            PermissionsConfig config = PermissionsConfig.of(List.of(), List.of("a/*", "b/*"), null);
            List<ResolutionSuggestion> suggestions = List.of(
                    new ResolutionSuggestion(SuggestionKind.FIX, "add",
                            new AutoFix("add", new Change.Add(RuleCategory.ASK, "c/*", null, "r"))),
                    new ResolutionSuggestion(SuggestionKind.FIX, "reorder",
                            new AutoFix("reorder", new Change.Reorder(RuleCategory.ALLOW, "b/*", 0, "r"))));

            ResolutionResult result = resolution.applyResolutions(config, suggestions);

            assertThat(result.resolvedConfig().ask()).containsExactly("c/*");
            assertThat(result.resolvedConfig().allow()).containsExactly("b/*", "a/*");
            assertThat(result.changes()).extracting(ConfigurationChange::risk)
                    .containsExactly(ChangeRisk.SAFE, ChangeRisk.SAFE);
        }
    }
}
