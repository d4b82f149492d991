/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.engine;

import com.aegis.permissions.analysis.ConflictDetectionConfig;
import com.aegis.permissions.analysis.ConflictDetectionEngine;
import com.aegis.permissions.analysis.ConflictDetectionResult;
import com.aegis.permissions.analysis.DetectionOptions;
import com.aegis.permissions.analysis.ResolutionEngine;
import com.aegis.permissions.api.IValidationEngine;
import com.aegis.permissions.api.OverlapDetector;
import com.aegis.permissions.api.ValidationListener;
import com.aegis.permissions.api.exception.ConfigurationParseException;
import com.aegis.permissions.api.exception.ValidationTimeoutException;
import com.aegis.permissions.api.model.BatchValidationResult;
import com.aegis.permissions.api.model.CacheStats;
import com.aegis.permissions.api.model.Conflict;
import com.aegis.permissions.api.model.ConflictKind;
import com.aegis.permissions.api.model.ConflictingRule;
import com.aegis.permissions.api.model.NormalizedRule;
import com.aegis.permissions.api.model.OverlapKind;
import com.aegis.permissions.api.model.PatternKind;
import com.aegis.permissions.api.model.PermissionsConfig;
import com.aegis.permissions.api.model.ResolutionSuggestion;
import com.aegis.permissions.api.model.RuleCategory;
import com.aegis.permissions.api.model.RuleStatistics;
import com.aegis.permissions.api.model.SecurityAnalysis;
import com.aegis.permissions.api.model.SecurityIssue;
import com.aegis.permissions.api.model.SecurityIssueType;
import com.aegis.permissions.api.model.SecurityLevel;
import com.aegis.permissions.api.model.Severity;
import com.aegis.permissions.api.model.ValidationError;
import com.aegis.permissions.api.model.ValidationErrorType;
import com.aegis.permissions.api.model.ValidationOptions;
import com.aegis.permissions.api.model.ValidationPerformance;
import com.aegis.permissions.api.model.ValidationPhase;
import com.aegis.permissions.api.model.ValidationResult;
import com.aegis.permissions.api.model.ValidationState;
import com.aegis.permissions.api.model.ValidationWarning;
import com.aegis.permissions.api.model.ValidationWarningType;
import com.aegis.permissions.cache.ValidationCache;
import com.aegis.permissions.infra.metrics.Counter;
import com.aegis.permissions.infra.metrics.MetricsRegistry;
import com.aegis.permissions.infra.metrics.Timer;
import com.aegis.permissions.pattern.CorpusOverlapDetector;
import com.aegis.permissions.pattern.PatternAnalyzer;
import com.aegis.permissions.pattern.PatternEngine;
import com.aegis.permissions.pattern.RuleNormalizer;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Validates permission configurations: normalize, check individual rules, detect conflicts,
 * enforce zero-bypass, analyze security posture and generate suggestions.
 *
 * <p><b>Zero-bypass:</b> every {@link ConflictKind#ALLOW_OVERRIDES_DENY} conflict becomes a
 * {@link ValidationErrorType#SECURITY_VIOLATION} error. No option downgrades it.
 *
 * <p><b>Failure handling:</b> {@code validate} never throws. Parse failures, internal faults
 * and strict timeouts become a terminal result with one {@link ValidationErrorType#INVALID_SYNTAX} error.
 *
 * <p><b>Caching:</b> results are served from and stored in a {@link ValidationCache} keyed by the
 * canonical configuration hash. Only runs that finish within twice the performance target are stored.
 *
 * <p>Thread-safe. Owns worker pools, so instances must be closed.
 *
 * <pre>{@code
 * try (ValidationEngine engine = ValidationEngine.builder()
 *         .config(EngineConfig.forProduction())
 *         .tracer(openTelemetry.getTracer("aegis"))
 *         .build()) {
 *     ValidationResult result = engine.validate(config);
 * }
 * }</pre>
 */
public final class ValidationEngine implements IValidationEngine {

    private static final Logger logger = Logger.getLogger(ValidationEngine.class.getName());

    static final String ZERO_BYPASS_PREFIX = "ZERO-BYPASS VIOLATION: ";
    private static final String FAILURE_PREFIX = "Validation failed: ";

    private final EngineConfig config;
    private final Tracer tracer;
    private final RuleNormalizer normalizer;
    private final OverlapDetector overlapDetector;
    private final ConflictDetectionEngine detectionEngine;
    private final ConfigurationParser parser;
    private final RuleValidator ruleValidator;
    private final SecurityAnalyzer securityAnalyzer;
    private final SuggestionGenerator suggestionGenerator;
    private final ValidationCache cache;
    private final ValidationStateTracker stateTracker;
    private final ExecutorService batchWorkers;

    private final Counter validations;
    private final Counter failures;
    private final Timer duration;

    private ValidationEngine(Builder builder) {
        this.config = builder.config != null ? builder.config : EngineConfig.defaults();
        this.tracer = builder.tracer != null ? builder.tracer : OpenTelemetry.noop().getTracer("aegis-validator");
        MetricsRegistry metrics = builder.metrics != null ? builder.metrics : MetricsRegistry.noop();

        PatternEngine patternEngine = new PatternEngine();
        this.normalizer = new RuleNormalizer(patternEngine);
        PatternAnalyzer patternAnalyzer = new PatternAnalyzer();
        this.overlapDetector = builder.overlapDetector != null
                ? builder.overlapDetector
                : new CorpusOverlapDetector(patternAnalyzer);
        this.detectionEngine = new ConflictDetectionEngine(overlapDetector, patternAnalyzer,
                ConflictDetectionConfig.builder()
                        .workerCount(config.getMaxWorkers())
                        .parallelThreshold(config.getParallelThreshold())
                        .deepAnalysis(config.isDeepAnalysis())
                        .build());
        this.parser = new ConfigurationParser();
        this.ruleValidator = new RuleValidator(patternEngine);
        this.securityAnalyzer = new SecurityAnalyzer(config.isRequireDenyRules());
        this.suggestionGenerator = new SuggestionGenerator(
                new ResolutionEngine(overlapDetector, patternEngine, detectionEngine));
        this.cache = new ValidationCache(config.getCacheConfig(), metrics);
        this.stateTracker = new ValidationStateTracker(builder.listener);
        this.batchWorkers = Executors.newFixedThreadPool(
                config.getMaxWorkers(),
                new ThreadFactoryBuilder()
                        .setNameFormat("aegis-batch-worker-%d")
                        .setDaemon(true)
                        .build());

        this.validations = metrics.counter("aegis.validations");
        this.failures = metrics.counter("aegis.validation.failures");
        this.duration = metrics.timer("aegis.validation.duration");

        logger.info("Validation engine initialized: " + config);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public ValidationResult validate(PermissionsConfig configuration, ValidationOptions options) {
        long start = System.nanoTime();
        ValidationOptions opts = options != null ? options : ValidationOptions.defaults();
        validations.increment();

        Span span = tracer.spanBuilder("validation.validate").startSpan();
        try (Scope scope = span.makeCurrent()) {
            ValidationResult result = doValidate(configuration, opts, start, span);
            if (!result.valid()) {
                failures.increment();
            }
            span.setAttribute("validation.valid", result.valid());
            return result;
        } catch (Exception e) {
            span.recordException(e);
            return failure(e, start);
        } finally {
            duration.record(Duration.ofNanos(System.nanoTime() - start));
            span.end();
        }
    }

    @Override
    public ValidationResult validate(Map<String, ?> rawConfig, ValidationOptions options) {
        long start = System.nanoTime();
        ConfigurationParser.ParsedConfiguration parsed;
        Span span = tracer.spanBuilder("validation.parse").startSpan();
        try (Scope scope = span.makeCurrent()) {
            stateTracker.start(ValidationPhase.PARSING, 0);
            parsed = parser.parse(rawConfig);
            stateTracker.complete(ValidationPhase.PARSING, start,
                    Map.of("rules", parsed.config().totalRules(), "warnings", parsed.warnings().size()));
        } catch (Exception e) {
            span.recordException(e);
            validations.increment();
            return failure(e, start);
        } finally {
            span.end();
        }
        return withLeadingWarnings(validate(parsed.config(), options), parsed.warnings());
    }

    @Override
    public ValidationResult validateJson(String json, ValidationOptions options) {
        long start = System.nanoTime();
        ConfigurationParser.ParsedConfiguration parsed;
        try {
            stateTracker.start(ValidationPhase.PARSING, 0);
            parsed = parser.parseJson(json);
            stateTracker.complete(ValidationPhase.PARSING, start,
                    Map.of("rules", parsed.config().totalRules(), "warnings", parsed.warnings().size()));
        } catch (Exception e) {
            validations.increment();
            return failure(e, start);
        }
        return withLeadingWarnings(validate(parsed.config(), options), parsed.warnings());
    }

    private ValidationResult doValidate(PermissionsConfig configuration, ValidationOptions options,
                                        long start, Span span) {
        Objects.requireNonNull(configuration, "configuration must not be null");
        boolean strict = options.strictMode();
        long targetMs = config.getPerformanceTargetMs();
        Deadline deadline = Deadline.start(start, options.timeoutMs(), config.isStrictTimeout() || strict);

        stateTracker.start(ValidationPhase.INITIALIZING, configuration.totalRules());
        String hash = cache.generateHash(configuration);
        String cacheKey = cacheKey(hash, options);
        boolean useCache = config.isCacheEnabled() && !options.skipCache();
        if (useCache) {
            ValidationResult cached = cache.get(cacheKey).orElse(null);
            span.setAttribute("cache.hit", cached != null);
            if (cached != null) {
                if (logger.isLoggable(Level.FINE)) {
                    logger.fine("Validation cache hit for " + hash);
                }
                stateTracker.finish(ValidationPhase.COMPLETE);
                return cached;
            }
        }

        List<ValidationError> errors = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();

        List<NormalizedRule> rules = runPhase(ValidationPhase.NORMALIZING, "validation.normalize", 0, deadline,
                () -> normalizer.normalize(configuration),
                normalized -> Map.of("rules", normalized.size()));
        span.setAttribute("rules.count", rules.size());

        warnings.addAll(runPhase(ValidationPhase.VALIDATING, "validation.rules", rules.size(), deadline,
                () -> ruleValidator.validate(rules),
                found -> Map.of("warnings", found.size())));

        boolean deep = config.isDeepAnalysis() || strict;
        DetectionOptions detectionOptions = new DetectionOptions(
                options.skipCache(),
                options.skipConflictDetection(),
                deep,
                options.parallel(),
                options.workerCount(),
                options.customPatterns());
        ConflictDetectionResult detection = runPhase(ValidationPhase.DETECTING_CONFLICTS, "validation.conflicts",
                rules.size(), deadline,
                () -> detectionEngine.detectConflicts(rules, detectionOptions),
                found -> Map.of("conflicts", found.conflicts().size(), "pairs", found.pairsAnalyzed()));
        List<Conflict> conflicts = detection.conflicts();
        span.setAttribute("conflicts.count", conflicts.size());
        errors.addAll(enforceZeroBypass(conflicts));
        if (strict) {
            errors.addAll(contradictionErrors(conflicts));
        }

        SecurityAnalysis analysis = runPhase(ValidationPhase.ANALYZING_SECURITY, "validation.security",
                rules.size(), deadline,
                () -> securityAnalyzer.analyze(rules, conflicts),
                found -> Map.of("issues", found.issues().size(), "score", found.score()));
        applySecurityIssues(analysis, errors, warnings);

        SecurityLevel level = strict ? SecurityLevel.STRICT : config.getSecurityLevel();
        List<ResolutionSuggestion> suggestions = runPhase(ValidationPhase.GENERATING_SUGGESTIONS,
                "validation.suggestions", rules.size(), deadline,
                () -> suggestionGenerator.generate(rules, conflicts, analysis, level),
                found -> Map.of("suggestions", found.size()));
        deadline.check(ValidationPhase.COMPLETE);

        long elapsedMs = deadline.elapsedMs();
        boolean achieved = elapsedMs < targetMs && !deadline.expired();
        if (deadline.expired()) {
            warnings.add(ValidationWarning.of(ValidationWarningType.PERFORMANCE_WARNING,
                    String.format("Validation exceeded its %d ms timeout (%d ms)", options.timeoutMs(), elapsedMs),
                    null));
        }
        ValidationResult result = ValidationResult.of(errors, warnings, conflicts, suggestions,
                new ValidationPerformance(elapsedMs, rules.size(), targetMs, achieved),
                hash, analysis.score());

        if (useCache && elapsedMs < 2 * targetMs && !deadline.expired()) {
            cache.put(cacheKey, result, (double) elapsedMs);
        }
        stateTracker.finish(ValidationPhase.COMPLETE);
        logger.info(String.format("Validation complete: valid=%s, rules=%d, errors=%d, conflicts=%d, %d ms",
                result.valid(), rules.size(), errors.size(), conflicts.size(), elapsedMs));
        return result;
    }

    private <T> T runPhase(ValidationPhase phase, String spanName, int ruleCount, Deadline deadline,
                           Supplier<T> body, Function<T, Map<String, Object>> phaseMetrics) {
        deadline.check(phase);
        stateTracker.start(phase, ruleCount);
        long phaseStart = System.nanoTime();
        Span span = tracer.spanBuilder(spanName).startSpan();
        try (Scope scope = span.makeCurrent()) {
            T result = body.get();
            Map<String, Object> metrics = phaseMetrics.apply(result);
            metrics.forEach((name, value) -> {
                if (value instanceof Number) {
                    span.setAttribute(name, ((Number) value).longValue());
                }
            });
            stateTracker.complete(phase, phaseStart, metrics);
            return result;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private static List<ValidationError> enforceZeroBypass(List<Conflict> conflicts) {
        List<ValidationError> errors = new ArrayList<>();
        for (Conflict conflict : conflicts) {
            if (conflict.kind() != ConflictKind.ALLOW_OVERRIDES_DENY) {
                continue;
            }
            List<ConflictingRule> involved = conflict.conflictingRules();
            ConflictingRule deny = involved.get(0);
            ConflictingRule permissive = involved.get(involved.size() - 1);
            Map<String, String> context = new LinkedHashMap<>();
            context.put("denyRule", deny.pattern());
            context.put("conflictingRule", permissive.pattern());
            context.put("conflictingCategory", permissive.category().key());
            errors.add(new ValidationError(ValidationErrorType.SECURITY_VIOLATION,
                    ZERO_BYPASS_PREFIX + conflict.message(),
                    permissive.location(),
                    context,
                    Severity.CRITICAL));
        }
        return errors;
    }

    private static List<ValidationError> contradictionErrors(List<Conflict> conflicts) {
        List<ValidationError> errors = new ArrayList<>();
        for (Conflict conflict : conflicts) {
            if (conflict.kind() == ConflictKind.CONTRADICTORY_RULES) {
                errors.add(new ValidationError(ValidationErrorType.RULE_CONFLICT,
                        conflict.message(),
                        conflict.conflictingRules().get(0).location(),
                        Map.of("kind", conflict.kind().name()),
                        conflict.securityImpact()));
            }
        }
        return errors;
    }

    private static void applySecurityIssues(SecurityAnalysis analysis,
                                            List<ValidationError> errors,
                                            List<ValidationWarning> warnings) {
        for (SecurityIssue issue : analysis.issues()) {
            if (issue.type() == SecurityIssueType.ZERO_BYPASS_VIOLATION) {
                continue;
            }
            String location = issue.affectedRules().isEmpty() ? null : issue.affectedRules().get(0);
            Map<String, String> context = Map.of(
                    "issue", issue.type().name(),
                    "suggestedFix", SecurityAnalyzer.suggestedFix(issue.type()));
            if (issue.severity().isAtLeast(Severity.HIGH)) {
                errors.add(new ValidationError(ValidationErrorType.SECURITY_VIOLATION, issue.message(),
                        location, context, issue.severity()));
            } else {
                warnings.add(new ValidationWarning(ValidationWarningType.BEST_PRACTICE_VIOLATION, issue.message(),
                        location, context));
            }
        }
    }

    /**
     * Options that change the outcome get their own cache slot.
     */
    private static String cacheKey(String hash, ValidationOptions options) {
        StringBuilder key = new StringBuilder(hash);
        if (options.strictMode()) {
            key.append(":strict");
        }
        if (options.skipConflictDetection()) {
            key.append(":zero-bypass-only");
        }
        if (!options.customPatterns().isEmpty()) {
            key.append(":probes-").append(Integer.toHexString(options.customPatterns().hashCode()));
        }
        return key.toString();
    }

    private ValidationResult failure(Exception e, long start) {
        long elapsedMs = (System.nanoTime() - start) / 1_000_000L;
        ValidationPhase phase = stateTracker.current().phase();
        if (e instanceof ValidationTimeoutException || e instanceof ConfigurationParseException) {
            logger.warning(e.getMessage());
        } else {
            logger.log(Level.SEVERE, "Validation failed in phase " + phase, e);
        }
        stateTracker.fail(phase, e);
        failures.increment();
        String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return ValidationResult.failure(FAILURE_PREFIX + reason, elapsedMs,
                config.getPerformanceTargetMs());
    }

    private static ValidationResult withLeadingWarnings(ValidationResult result, List<ValidationWarning> leading) {
        if (leading.isEmpty()) {
            return result;
        }
        List<ValidationWarning> warnings = new ArrayList<>(leading);
        warnings.addAll(result.warnings());
        return new ValidationResult(result.valid(), result.errors(), warnings, result.conflicts(),
                result.suggestions(), result.performance(), result.configurationHash(), result.securityScore());
    }

    @Override
    public BatchValidationResult validateBatch(String id, List<PermissionsConfig> configs, ValidationOptions options) {
        Objects.requireNonNull(configs, "configs must not be null");
        long start = System.nanoTime();
        Span span = tracer.spanBuilder("validation.batch").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("batch.id", id);
            span.setAttribute("batch.size", configs.size());

            List<Future<ValidationResult>> futures = new ArrayList<>(configs.size());
            for (PermissionsConfig configuration : configs) {
                futures.add(batchWorkers.submit(Context.current().wrap(() -> validate(configuration, options))));
            }

            List<ValidationResult> results = new ArrayList<>(futures.size());
            for (Future<ValidationResult> future : futures) {
                results.add(await(future, start));
            }

            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            BatchValidationResult batch = BatchValidationResult.of(id, results, totalMs);
            logger.info(String.format("Batch %s validated: %d configs, %d valid, %d invalid, %d ms",
                    id, results.size(), batch.successCount(), batch.failureCount(), totalMs));
            return batch;
        } finally {
            span.end();
        }
    }

    private ValidationResult await(Future<ValidationResult> future, long start) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return failure(e, start);
        } catch (ExecutionException e) {
            Exception cause = e.getCause() instanceof Exception ? (Exception) e.getCause() : e;
            return failure(cause, start);
        }
    }

    @Override
    public RuleStatistics getRuleStatistics(PermissionsConfig configuration) {
        Objects.requireNonNull(configuration, "configuration");
        List<NormalizedRule> rules = normalizer.normalize(configuration);

        Map<RuleCategory, Integer> byCategory = new EnumMap<>(RuleCategory.class);
        for (RuleCategory category : RuleCategory.values()) {
            byCategory.put(category, 0);
        }
        Map<PatternKind, Integer> byKind = new EnumMap<>(PatternKind.class);
        long totalLength = 0;
        int maxLength = 0;
        for (NormalizedRule rule : rules) {
            byCategory.merge(rule.category(), 1, Integer::sum);
            byKind.merge(rule.kind(), 1, Integer::sum);
            totalLength += rule.original().length();
            maxLength = Math.max(maxLength, rule.original().length());
        }
        RuleStatistics.Complexity complexity = new RuleStatistics.Complexity(
                rules.isEmpty() ? 0.0 : (double) totalLength / rules.size(),
                maxLength,
                byKind.getOrDefault(PatternKind.REGEX, 0),
                byKind.getOrDefault(PatternKind.GLOB, 0),
                byKind.getOrDefault(PatternKind.LITERAL, 0));

        int estimated = Math.min(100,
                byCategory.get(RuleCategory.DENY) * 10 + byCategory.get(RuleCategory.ALLOW) * 5);
        RuleStatistics.Coverage coverage = new RuleStatistics.Coverage(
                estimated, uncoveredRules(rules), redundantRules(rules));

        return new RuleStatistics(rules.size(), byCategory, complexity, coverage);
    }

    private List<String> uncoveredRules(List<NormalizedRule> rules) {
        List<NormalizedRule> denies = new ArrayList<>();
        for (NormalizedRule rule : rules) {
            if (rule.category() == RuleCategory.DENY) {
                denies.add(rule);
            }
        }
        List<String> uncovered = new ArrayList<>();
        for (NormalizedRule rule : rules) {
            if (rule.category() == RuleCategory.DENY) {
                continue;
            }
            boolean related = false;
            for (NormalizedRule deny : denies) {
                if (overlapDetector.analyzeOverlap(rule, deny).kind() != OverlapKind.NONE) {
                    related = true;
                    break;
                }
            }
            if (!related) {
                uncovered.add(rule.original());
            }
        }
        return uncovered;
    }

    private static List<String> redundantRules(List<NormalizedRule> rules) {
        Map<String, Integer> occurrences = new HashMap<>();
        Set<String> redundant = new LinkedHashSet<>();
        for (NormalizedRule rule : rules) {
            if (occurrences.merge(rule.contentKey(), 1, Integer::sum) == 2) {
                redundant.add(rule.original());
            }
        }
        return new ArrayList<>(redundant);
    }

    @Override
    public String exportCache() {
        return cache.export();
    }

    @Override
    public void importCache(String serialized) {
        int imported = cache.importEntries(serialized);
        logger.info(String.format("Imported %d cache entries", imported));
    }

    @Override
    public CacheStats getCacheStats() {
        return cache.getStats();
    }

    /**
     * Drops every cached validation and conflict detection result.
     */
    public void clearCache() {
        cache.clear();
        detectionEngine.clearCache();
    }

    @Override
    public ValidationState getState() {
        return stateTracker.current();
    }

    public EngineConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        batchWorkers.shutdown();
        try {
            if (!batchWorkers.awaitTermination(5, TimeUnit.SECONDS)) {
                batchWorkers.shutdownNow();
            }
        } catch (InterruptedException e) {
            batchWorkers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        detectionEngine.close();
        logger.info("Validation engine shut down");
    }

    public static final class Builder {
        private EngineConfig config;
        private Tracer tracer;
        private MetricsRegistry metrics;
        private ValidationListener listener;
        private OverlapDetector overlapDetector;

        private Builder() {
        }

        public Builder config(EngineConfig config) {
            this.config = config;
            return this;
        }

        public Builder tracer(Tracer tracer) {
            this.tracer = tracer;
            return this;
        }

        public Builder metrics(MetricsRegistry metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder listener(ValidationListener listener) {
            this.listener = listener;
            return this;
        }

        /**
         * Replaces the corpus-based overlap heuristic.
         */
        public Builder overlapDetector(OverlapDetector overlapDetector) {
            this.overlapDetector = overlapDetector;
            return this;
        }

        public ValidationEngine build() {
            return new ValidationEngine(this);
        }
    }
}
