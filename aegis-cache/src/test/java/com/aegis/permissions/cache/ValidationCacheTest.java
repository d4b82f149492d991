package com.aegis.permissions.cache;

import com.aegis.permissions.api.exception.CacheImportException;
import com.aegis.permissions.api.model.AutoFix;
import com.aegis.permissions.api.model.CacheStats;
import com.aegis.permissions.api.model.Change;
import com.aegis.permissions.api.model.Conflict;
import com.aegis.permissions.api.model.ConflictKind;
import com.aegis.permissions.api.model.ConflictingRule;
import com.aegis.permissions.api.model.PermissionsConfig;
import com.aegis.permissions.api.model.ResolutionStrategy;
import com.aegis.permissions.api.model.ResolutionSuggestion;
import com.aegis.permissions.api.model.RuleCategory;
import com.aegis.permissions.api.model.Severity;
import com.aegis.permissions.api.model.SuggestionKind;
import com.aegis.permissions.api.model.ValidationError;
import com.aegis.permissions.api.model.ValidationErrorType;
import com.aegis.permissions.api.model.ValidationPerformance;
import com.aegis.permissions.api.model.ValidationResult;
import com.aegis.permissions.infra.metrics.inmemory.InMemoryMetricsRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("ValidationCache")
class ValidationCacheTest {

    private MutableClock clock;
    private InMemoryMetricsRegistry metrics;
    private ValidationCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        metrics = new InMemoryMetricsRegistry();
        cache = newCache(CacheConfig.builder().maxEntries(10).ttl(Duration.ofMinutes(5)).build());
    }

    private ValidationCache newCache(CacheConfig config) {
        return new ValidationCache(config, metrics, clock);
    }

    private static ValidationResult validResult() {
        return ValidationResult.of(List.of(), List.of(), List.of(), List.of(),
                new ValidationPerformance(3, 2, 100, true), "hash", 100);
    }

    private static ValidationResult bypassResult() {
        Conflict conflict = new Conflict(ConflictKind.ALLOW_OVERRIDES_DENY, "bypass",
                List.of(new ConflictingRule(RuleCategory.DENY, "exec", "permissions.deny[0]"),
                        new ConflictingRule(RuleCategory.ALLOW, "exec", "permissions.allow[0]")),
                ResolutionStrategy.REMOVE_CONFLICTING_RULE, Severity.CRITICAL);
        ResolutionSuggestion fix = new ResolutionSuggestion(SuggestionKind.FIX, "Remove allow rule",
                new AutoFix("Remove allow rule \"exec\"", new Change.Remove(RuleCategory.ALLOW, "exec", "bypass")));
        return ValidationResult.of(
                List.of(ValidationError.of(ValidationErrorType.SECURITY_VIOLATION, "ZERO-BYPASS VIOLATION: bypass",
                        Severity.CRITICAL)),
                List.of(), List.of(conflict), List.of(fix),
                new ValidationPerformance(5, 2, 100, true), "other", 80);
    }

    @Nested
    @DisplayName("Lookup")
    class Lookup {

        @Test
        @DisplayName("Should return a stored result")
        void putAndGet() {
            cache.put("h1", validResult());

            assertThat(cache.get("h1")).contains(validResult());
            assertThat(metrics.counterSnapshot()).containsEntry("aegis.cache.hits", 1L);
        }

        @Test
        @DisplayName("Should miss for unknown hashes")
        void miss() {
            assertThat(cache.get("missing")).isEmpty();
            assertThat(cache.getStats().misses()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should expire entries after the TTL")
        void expiry() {
            cache.put("h1", validResult());

            clock.advance(Duration.ofMinutes(5).plusMillis(1));

            assertThat(cache.get("h1")).isEmpty();
            assertThat(cache.getStats().entries()).isZero();
            assertThat(cache.getStats().memoryUsedBytes()).isZero();
        }

        @Test
        @DisplayName("Hit rate counts hits over lookups")
        void hitRate() {
            cache.put("h1", validResult(), 12.0);
            cache.get("h1");
            cache.get("h1");
            cache.get("h2");

            CacheStats stats = cache.getStats();
            assertThat(stats.hits()).isEqualTo(2);
            assertThat(stats.misses()).isEqualTo(1);
            assertThat(stats.hitRate()).isCloseTo(2.0 / 3.0, within(1e-9));
            assertThat(stats.averageValidationTimeMs()).isEqualTo(12.0);
        }
    }

    @Nested
    @DisplayName("Eviction")
    class Eviction {

        @Test
        @DisplayName("Should evict the least recently used entry when full")
        void lru() {
            ValidationCache small = newCache(CacheConfig.builder().maxEntries(2).build());
            small.put("a", validResult());
            small.put("b", validResult());
            small.get("a");

            small.put("c", validResult());

            assertThat(small.contains("a")).isTrue();
            assertThat(small.contains("b")).isFalse();
            assertThat(small.contains("c")).isTrue();
            assertThat(small.getStats().evictions()).isEqualTo(1);
            assertThat(metrics.counterSnapshot()).containsEntry("aegis.cache.evictions", 1L);
        }

        @Test
        @DisplayName("Should evict to stay within the memory budget")
        void memory() {
            ValidationCache probe = newCache(CacheConfig.defaults());
            probe.put("x", validResult());
            long entrySize = probe.getStats().memoryUsedBytes();
            ValidationCache tight = newCache(CacheConfig.builder().maxMemoryBytes(entrySize * 2).build());

            tight.put("a", validResult());
            tight.put("b", validResult());
            tight.put("c", validResult());

            assertThat(tight.getStats().entries()).isEqualTo(2);
            assertThat(tight.getStats().memoryUsedBytes()).isLessThanOrEqualTo(entrySize * 2);
            assertThat(tight.contains("a")).isFalse();
        }

        @Test
        @DisplayName("Should invalidate by predicate")
        void invalidatePredicate() {
            cache.put("keep-1", validResult());
            cache.put("drop-1", validResult());
            cache.put("drop-2", validResult());

            assertThat(cache.invalidate(hash -> hash.startsWith("drop"))).isEqualTo(2);
            assertThat(cache.getStats().entries()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Persistence")
    class Persistence {

        @Test
        @DisplayName("Export and import restore live entries")
        void roundTrip() {
            cache.put("h1", bypassResult());
            cache.put("h2", validResult());
            String exported = cache.export();

            ValidationCache restored = newCache(CacheConfig.defaults());
            int imported = restored.importEntries(exported);

            assertThat(imported).isEqualTo(2);
            Optional<ValidationResult> result = restored.get("h1");
            assertThat(result).contains(bypassResult());
            assertThat(result.get().suggestions().get(0).autoFix().change()).isInstanceOf(Change.Remove.class);
        }

        @Test
        @DisplayName("Expired entries are not exported")
        void expiredSkipped() {
            cache.put("old", validResult());
            clock.advance(Duration.ofMinutes(4));
            cache.put("new", validResult());
            clock.advance(Duration.ofMinutes(2));

            ValidationCache restored = newCache(CacheConfig.defaults());

            assertThat(restored.importEntries(cache.export())).isEqualTo(1);
            assertThat(restored.contains("new")).isTrue();
        }

        @Test
        @DisplayName("Import rejects another format version")
        void versionMismatch() {
            String exported = cache.export().replace("\"1.0.0\"", "\"2.0.0\"");

            assertThatThrownBy(() -> cache.importEntries(exported))
                    .isInstanceOf(CacheImportException.class)
                    .hasMessageContaining("2.0.0");
        }

        @Test
        @DisplayName("Import rejects malformed data")
        void malformed() {
            assertThatThrownBy(() -> cache.importEntries("{not json"))
                    .isInstanceOf(CacheImportException.class);
        }
    }

    @Test
    @DisplayName("Warm-up validates only uncached configurations")
    void warmUp() {
        PermissionsConfig first = PermissionsConfig.of(List.of("exec"), List.of(), List.of());
        PermissionsConfig second = PermissionsConfig.of(List.of("rm"), List.of(), List.of());
        cache.put(cache.generateHash(first), validResult());
        AtomicInteger calls = new AtomicInteger();

        int warmed = cache.warmUp(List.of(first, second), config -> {
            calls.incrementAndGet();
            return validResult();
        });

        assertThat(warmed).isEqualTo(1);
        assertThat(calls).hasValue(1);
        assertThat(cache.contains(cache.generateHash(second))).isTrue();
    }

    @Test
    @DisplayName("Configuration bounds are validated")
    void configValidation() {
        assertThatThrownBy(() -> CacheConfig.builder().maxEntries(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CacheConfig.builder().ttl(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(CacheConfig.forProduction().getMaxEntries()).isGreaterThan(CacheConfig.forDevelopment().getMaxEntries());
    }

    private static final class MutableClock extends Clock {
        private long millis = 1_700_000_000_000L;

        void advance(Duration duration) {
            millis += duration.toMillis();
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis);
        }
    }
}
