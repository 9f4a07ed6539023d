package eventmanager.benchmark;

import eventmanager.Event;
import eventmanager.EventTypeId;
import eventmanager.Handler;
import eventmanager.dispatch.EventDispatcher;
import org.openjdk.jmh.annotations.*;

import java.util.concurrent.TimeUnit;

/**
 * Measures push-then-drain throughput: pushEvent x batchSize -> processEvents -> handler callbacks.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar EventDispatchBenchmark}
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Thread)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class EventDispatchBenchmark {

  private static final EventTypeId BENCH_EVENT = EventTypeId.of("BenchEvent");

  @Param({"1", "8"})
  private int handlerCount;

  @Param({"100", "1000"})
  private int batchSize;

  @Param({"1", "16"})
  private int priorityLevels;

  private EventDispatcher dispatcher;
  private long sink;

  @Setup(Level.Trial)
  public void setup() {
    dispatcher = EventDispatcher.builder().build();
    for (int i = 0; i < handlerCount; i++) {
      dispatcher.addHandler(BENCH_EVENT, Handler.of(i, event -> sink += event.priorityLevel()));
    }
  }

  @TearDown(Level.Trial)
  public void tearDown() {
    dispatcher.close();
  }

  @Benchmark
  public long pushAndDrain() {
    for (int i = 0; i < batchSize; i++) {
      dispatcher.pushEvent(Event.of(BENCH_EVENT, i % priorityLevels));
    }
    return dispatcher.processEvents() + sink;
  }
}
