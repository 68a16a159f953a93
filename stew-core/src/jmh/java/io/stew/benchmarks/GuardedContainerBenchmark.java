package io.stew.benchmarks;

import io.stew.container.ElementTraits;
import io.stew.container.GuardedSequenceContainer;
import io.stew.container.View;
import io.stew.core.StewConfiguration;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Group;
import org.openjdk.jmh.annotations.GroupThreads;
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

import java.util.concurrent.TimeUnit;

@State(Scope.Benchmark)
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 2, time = 2, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 3, time = 5, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class GuardedContainerBenchmark {

    @Param({"1000", "100000"})
    public int initialElements;

    @Param({"PAGED", "ARRAY"})
    public StewConfiguration.StorageType storageType;

    private GuardedSequenceContainer<Integer> container;
    private int nextValue;
    private int oldestValue;

    @Setup(Level.Trial)
    public void setup() {
        var configuration = StewConfiguration.builder()
                .storageType(storageType)
                .pageSize(4096)
                .maxPages(1024)
                .build();
        container = new GuardedSequenceContainer<>(ElementTraits.nonNull(), configuration);
        for (int i = 0; i < initialElements; i++) {
            container.pushBack(i);
        }
        nextValue = initialElements;
        oldestValue = 0;
    }

    @Benchmark
    public void lockedIteration(Blackhole blackhole) {
        container.read(view -> {
            for (var value : view) {
                blackhole.consume(value);
            }
            return null;
        });
    }

    @Benchmark
    public void lockUnlockCycle(Blackhole blackhole) {
        container.lock();
        blackhole.consume(container.getLockedView());
        container.unlock();
    }

    // Group: 1 writer + 3 readers
    @Group("write1_read3")
    @GroupThreads(1)
    @Benchmark
    public void writer(Blackhole blackhole) {
        if (container.pushBack(nextValue)) {
            nextValue++;
        }
        if (container.remove(oldestValue)) {
            oldestValue++;
        }
        blackhole.consume(oldestValue);
    }

    @Group("write1_read3")
    @GroupThreads(3)
    @Benchmark
    public void reader(Blackhole blackhole) {
        blackhole.consume(container.read(View::size));
    }
}
