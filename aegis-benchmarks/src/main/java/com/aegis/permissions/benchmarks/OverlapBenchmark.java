/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.benchmarks;

import com.aegis.permissions.api.model.NormalizedRule;
import com.aegis.permissions.api.model.Overlap;
import com.aegis.permissions.api.model.RuleCategory;
import com.aegis.permissions.pattern.CorpusOverlapDetector;
import com.aegis.permissions.pattern.PatternAnalyzer;
import com.aegis.permissions.pattern.PatternEngine;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pairwise overlap analysis cost. COLD rebuilds the detector every iteration so results are not
 * memoized; WARM reuses one detector whose pair cache has already seen every pair.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Fork(1)
@Warmup(iterations = 5, time = 1)
@Measurement(iterations = 10, time = 2)
public class OverlapBenchmark {

    private static final int PAIR_COUNT = 256;

    @Param({"WARM", "COLD"})
    String cacheScenario;

    private PatternEngine patternEngine;
    private CorpusOverlapDetector detector;
    private List<NormalizedRule[]> pairs;
    private final AtomicInteger cursor = new AtomicInteger();

    @Setup(Level.Trial)
    public void setupTrial() {
        patternEngine = new PatternEngine();
        pairs = new ArrayList<>(PAIR_COUNT);
        for (int i = 0; i < PAIR_COUNT; i++) {
            NormalizedRule deny = patternEngine.normalize(denyPattern(i), RuleCategory.DENY, i);
            NormalizedRule allow = patternEngine.normalize(allowPattern(i), RuleCategory.ALLOW, i);
            pairs.add(new NormalizedRule[]{allow, deny});
        }
    }

    @Setup(Level.Iteration)
    public void setupIteration() {
        cursor.set(0);
        detector = new CorpusOverlapDetector(new PatternAnalyzer());
        if ("WARM".equals(cacheScenario)) {
            for (NormalizedRule[] pair : pairs) {
                detector.analyzeOverlap(pair[0], pair[1], List.of());
            }
        }
    }

    @Benchmark
    public Overlap analyzeOverlap() {
        NormalizedRule[] pair = pairs.get(Math.floorMod(cursor.getAndIncrement(), PAIR_COUNT));
        if ("COLD".equals(cacheScenario)) {
            // fresh detector per call so the pair cache never hits
            return new CorpusOverlapDetector(new PatternAnalyzer()).analyzeOverlap(pair[0], pair[1], List.of());
        }
        return detector.analyzeOverlap(pair[0], pair[1], List.of());
    }

    // Mix of literal, glob and regex shapes; every fourth pair overlaps.
    static String denyPattern(int i) {
        switch (i % 4) {
            case 0:
                return "secrets/s" + i + "/*";
            case 1:
                return "rm -rf /tmp/" + i;
            case 2:
                return "^sudo (apt|yum) install pkg" + i + "$";
            default:
                return "shared/" + i + "/*.key";
        }
    }

    static String allowPattern(int i) {
        switch (i % 4) {
            case 0:
                return "workspace/w" + i + "/*";
            case 1:
                return "ls -la /tmp/" + i;
            case 2:
                return "^git (status|log) repo" + i + "$";
            default:
                return "shared/" + i + "/*";
        }
    }

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(OverlapBenchmark.class.getSimpleName())
                .forks(1)
                .build();
        new Runner(opt).run();
    }
}
