package question.rotation.infrastructure.lock;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 락 계측
 *
 * <pre>
 * - lock.wait.time          : Timer (tag: implementation)
 * - lock.acquired           : Counter (tag: implementation)
 * - lock.acquisition.failure: Counter (tag: implementation)
 * - lock.released           : Counter (tag: implementation)
 * </pre>
 */
@Component
@RequiredArgsConstructor
public class LockMetrics {

  private final MeterRegistry registry;

  public void recordWaitTime(Duration waited, String implementation) {
    Timer.builder("lock.wait.time")
        .tag("implementation", implementation)
        .register(registry)
        .record(waited);
  }

  public void recordLockAcquired(String implementation) {
    registry.counter("lock.acquired", "implementation", implementation).increment();
  }

  public void recordFailure(String implementation) {
    registry.counter("lock.acquisition.failure", "implementation", implementation).increment();
  }

  public void recordLockReleased(String implementation) {
    registry.counter("lock.released", "implementation", implementation).increment();
  }
}
