package eventmanager.benchmark;

import eventmanager.hash.Murmur3;
import org.openjdk.jmh.annotations.*;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * Measures Murmur3 event-type hashing for name lengths typical of event type names.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar EventTypeHashBenchmark}
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Thread)
@Warmup(iterations = 3, time = 2)
@Measurement(iterations = 5, time = 3)
@Fork(1)
public class EventTypeHashBenchmark {

  @Param({"12", "64", "1024"})
  private int nameLength;

  private String name;
  private byte[] bytes;

  @Setup(Level.Trial)
  public void setup() {
    name = "E".repeat(nameLength);
    bytes = name.getBytes(StandardCharsets.UTF_8);
  }

  @Benchmark
  public int hashString() {
    return Murmur3.hash32(name, 0);
  }

  @Benchmark
  public int hashBytes() {
    return Murmur3.hash32(bytes, 0);
  }
}
