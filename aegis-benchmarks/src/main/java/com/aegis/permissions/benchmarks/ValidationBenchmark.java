/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.benchmarks;

import com.aegis.permissions.api.model.BatchValidationResult;
import com.aegis.permissions.api.model.PermissionsConfig;
import com.aegis.permissions.api.model.ValidationOptions;
import com.aegis.permissions.api.model.ValidationResult;
import com.aegis.permissions.engine.EngineConfig;
import com.aegis.permissions.engine.ValidationEngine;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.ChainedOptionsBuilder;
import org.openjdk.jmh.runner.options.OptionsBuilder;
import org.openjdk.jmh.runner.options.TimeValue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * End-to-end validation latency for progressively larger configurations.
 *
 * <p>HOT measures the cache-hit path after one priming call. COLD bypasses the cache so every
 * invocation runs the full pipeline: normalize, validate, detect conflicts, analyze, suggest.
 *
 * <p>Run with {@code -Dbench.quick=true} for a short smoke run.
 */
@BenchmarkMode({Mode.AverageTime, Mode.SampleTime})
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 5, time = 2)
@Measurement(iterations = 10, time = 3)
public class ValidationBenchmark {

    private static final boolean QUICK_MODE = Boolean.getBoolean("bench.quick");

    private static final int WARMUP_ITERATIONS = QUICK_MODE ? 2 : 5;
    private static final int MEASUREMENT_ITERATIONS = QUICK_MODE ? 3 : 10;
    private static final int MEASUREMENT_TIME = QUICK_MODE ? 1 : 3;

    @Param({"100", "500", "1000"})
    int ruleCount;

    @Param({"HOT", "COLD"})
    String cacheScenario;

    private ValidationEngine engine;
    private PermissionsConfig config;
    private ValidationOptions options;
    private List<PermissionsConfig> batch;

    @Setup(org.openjdk.jmh.annotations.Level.Trial)
    public void setupTrial() {
        Logger.getLogger("com.aegis.permissions").setLevel(Level.OFF);
        Logger.getLogger("io.opentelemetry").setLevel(Level.OFF);

        engine = ValidationEngine.builder()
                .config(EngineConfig.builder()
                        .performanceTargetMs(60_000)
                        .build())
                .build();
        config = generateConfig(ruleCount, "bench");
        options = "COLD".equals(cacheScenario)
                ? ValidationOptions.builder().skipCache(true).build()
                : ValidationOptions.defaults();

        batch = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            batch.add(generateConfig(Math.max(3, ruleCount / 10), "batch" + i));
        }
    }

    @Setup(org.openjdk.jmh.annotations.Level.Iteration)
    public void setupIteration() {
        if ("HOT".equals(cacheScenario)) {
            ValidationResult primed = engine.validate(config, options);
            if (!primed.valid()) {
                throw new IllegalStateException("Benchmark configuration is not valid: " + primed.errors());
            }
        } else {
            engine.clearCache();
        }
    }

    @TearDown(org.openjdk.jmh.annotations.Level.Trial)
    public void teardownTrial() {
        engine.close();
    }

    @Benchmark
    public ValidationResult validateSingle() {
        return engine.validate(config, options);
    }

    @Benchmark
    public BatchValidationResult validateBatch() {
        return engine.validateBatch("bench-batch", batch, options);
    }

    /**
     * Deny, allow and ask rules split evenly across disjoint namespaces, so the configuration is
     * valid and the conflict passes scan every pair without early exits.
     */
    static PermissionsConfig generateConfig(int ruleCount, String namespace) {
        int perCategory = Math.max(1, ruleCount / 3);
        List<String> deny = new ArrayList<>(perCategory);
        List<String> allow = new ArrayList<>(perCategory);
        List<String> ask = new ArrayList<>(perCategory);
        for (int i = 0; i < perCategory; i++) {
            deny.add(namespace + "/secrets/d" + i + "/*");
            allow.add(namespace + "/workspace/a" + i + "/*");
            ask.add(namespace + "/network/q" + i + "/*");
        }
        return PermissionsConfig.of(deny, allow, ask);
    }

    public static void main(String[] args) throws RunnerException {
        ChainedOptionsBuilder jmhBuilder = new OptionsBuilder()
                .include(ValidationBenchmark.class.getSimpleName())
                .warmupIterations(WARMUP_ITERATIONS)
                .measurementIterations(MEASUREMENT_ITERATIONS)
                .measurementTime(TimeValue.seconds(MEASUREMENT_TIME))
                .shouldFailOnError(true);
        if (QUICK_MODE) {
            jmhBuilder.param("ruleCount", "100").forks(1);
        }
        new Runner(jmhBuilder.build()).run();
    }
}
