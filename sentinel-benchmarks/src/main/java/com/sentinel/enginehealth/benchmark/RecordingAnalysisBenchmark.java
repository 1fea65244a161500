package com.sentinel.enginehealth.benchmark;

import com.sentinel.enginehealth.api.model.AnalysisResult;
import com.sentinel.enginehealth.api.model.Condition;
import com.sentinel.enginehealth.api.model.LoadGate;
import com.sentinel.enginehealth.api.model.Profile;
import com.sentinel.enginehealth.api.model.Recording;
import com.sentinel.enginehealth.api.model.ResolvedProfile;
import com.sentinel.enginehealth.api.model.Rule;
import com.sentinel.enginehealth.api.model.Sample;
import com.sentinel.enginehealth.api.model.Severity;
import com.sentinel.enginehealth.api.model.ThresholdTree;
import com.sentinel.enginehealth.api.model.TipMapDeltaConfig;
import com.sentinel.enginehealth.compiler.ProfileResolver;
import com.sentinel.enginehealth.compiler.store.InMemoryProfileStore;
import com.sentinel.enginehealth.infra.cache.NoOpResolvedProfileCache;
import com.sentinel.enginehealth.infra.config.AnalysisSettings;
import com.sentinel.enginehealth.infra.metrics.internal.NoOpMetricsRegistry;
import com.sentinel.enginehealth.runtime.analysis.RecordingAnalyzer;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;
import org.openjdk.jmh.runner.options.TimeValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SplittableRandom;
import java.util.concurrent.TimeUnit;

/**
 * End-to-end analysis throughput: profile resolution once, then state classification,
 * masking, rule evaluation and statistics per recording.
 * <p>
 * USAGE:
 * <pre>
 * mvn clean package -pl sentinel-benchmarks -am -DskipTests
 * java -jar sentinel-benchmarks/target/sentinel-benchmarks.jar RecordingAnalysisBenchmark
 * </pre>
 * <p>
 * CONFIGURATION:
 * -Dbench.quick : shorter warmup and measurement
 */
@BenchmarkMode({Mode.Throughput, Mode.AverageTime})
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms2g", "-Xmx2g"})
@Warmup(iterations = 5, time = 2)
@Measurement(iterations = 10, time = 3)
public class RecordingAnalysisBenchmark {

    private static final boolean QUICK_MODE = Boolean.getBoolean("bench.quick");

    // 10 Hz logging, so 36_000 samples is one hour
    @Param({"6000", "36000"})
    private int sampleCount;

    @Param({"10", "100"})
    private int ruleCount;

    private RecordingAnalyzer analyzer;
    private ResolvedProfile profile;
    private Recording recording;

    @Setup(Level.Trial)
    public void setupTrial() {
        NoOpMetricsRegistry metrics = new NoOpMetricsRegistry();
        analyzer = new RecordingAnalyzer(AnalysisSettings.defaults(), metrics);

        Profile base = Profile.of("global-defaults", null,
                ThresholdTree.fromMap(Map.of("oilPressure", Map.of("warning", Map.of("min", 20)))),
                generateRules(ruleCount));
        Profile leaf = Profile.of("bench-engine", "global-defaults",
                ThresholdTree.fromMap(Map.of("oilPressure", Map.of("critical", Map.of("min", 10)))),
                List.of(Rule.builder("low-oil")
                        .name("Low Oil Pressure")
                        .severity(Severity.CRITICAL)
                        .condition("OILP_press", "<", 10)
                        .requireWhen(Condition.of("EngineStable", "==", 1))
                        .triggerPersistenceSec(2)
                        .clearPersistenceSec(1)
                        .build()));
        profile = new ProfileResolver(new NoOpResolvedProfileCache(), metrics, false)
                .resolve("bench-engine", InMemoryProfileStore.of(base, leaf));

        recording = generateRecording(sampleCount);
    }

    @Benchmark
    public void analyze(Blackhole bh) {
        AnalysisResult result = analyzer.analyze(recording, profile);
        bh.consume(result.alerts());
        bh.consume(result.healthScore());
    }

    private static List<Rule> generateRules(int count) {
        String[] channels = {"ECT", "IAT", "OILP_press", "Vbat", "MAP", "rpm"};
        List<Rule> rules = new ArrayList<>(count);
        for (int i = 0; i < count - 1; i++) {
            String channel = channels[i % channels.length];
            Rule.Builder builder = Rule.builder("rule-" + i)
                    .condition(channel, i % 2 == 0 ? ">" : "<", 50 + i)
                    .triggerPersistenceSec(i % 5)
                    .clearPersistenceSec(1)
                    .ignoreWhen(Condition.of("EngineCranking", "==", 1));
            if (i % 7 == 0) {
                builder.windowSec(30.0);
            }
            rules.add(builder.build());
        }
        rules.add(Rule.builder("tip-map")
                .tipMapDelta(new TipMapDeltaConfig(null, null, 30, 5, 90.0, 2, 3, 3,
                        new LoadGate(Condition.of("eng_load", ">", 20), 1.0)))
                .triggerPersistenceSec(2)
                .build());
        return rules;
    }

    /**
     * Repeating ten-minute duty cycles: crank, idle, load ramp, key off.
     */
    private static Recording generateRecording(int samples) {
        SplittableRandom random = new SplittableRandom(42);
        List<Sample> list = new ArrayList<>(samples);
        for (int i = 0; i < samples; i++) {
            double t = i * 0.1;
            double phase = t % 600;
            boolean keyOn = phase < 590;
            double rpm;
            if (!keyOn) {
                rpm = 0;
            } else if (phase < 2) {
                rpm = 250 + phase * 200;
            } else if (phase < 120) {
                rpm = 850 + random.nextDouble(-30, 30);
            } else {
                rpm = 1800 + 400 * Math.sin(phase / 30) + random.nextDouble(-50, 50);
            }
            double load = rpm > 1000 ? 40 + 30 * Math.sin(phase / 45) : 5;
            double map = 5 + load / 4;

            Map<String, Double> values = new LinkedHashMap<>();
            values.put("rpm", rpm);
            values.put("Vsw", keyOn ? 12.6 : 0.0);
            values.put("Vbat", 13.8 + random.nextDouble(-0.3, 0.3));
            values.put("ECT", Math.min(195, 60 + phase / 2));
            values.put("IAT", 85 + random.nextDouble(-2, 2));
            values.put("OILP_press", rpm > 500 ? 25 + rpm / 100 : 0);
            values.put("MAP", map);
            values.put("TIP", map + 2 + random.nextDouble(-0.5, 0.5));
            values.put("eng_load", load);
            values.put("fuel_ctl_mode", rpm > 1000 ? 2.0 : 1.0);
            list.add(Sample.of(t, values));
        }
        return Recording.of("bench-" + samples, list);
    }

    public static void main(String[] args) throws RunnerException {
        Options options = new OptionsBuilder()
                .include(RecordingAnalysisBenchmark.class.getSimpleName())
                .warmupIterations(QUICK_MODE ? 2 : 5)
                .warmupTime(TimeValue.seconds(QUICK_MODE ? 1 : 2))
                .measurementIterations(QUICK_MODE ? 3 : 10)
                .measurementTime(TimeValue.seconds(QUICK_MODE ? 1 : 3))
                .shouldFailOnError(true)
                .build();
        new Runner(options).run();
    }
}
