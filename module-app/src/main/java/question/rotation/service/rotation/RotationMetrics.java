package question.rotation.service.rotation;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import question.rotation.core.domain.model.RotationOutcome;

/**
 * 로테이션 계측
 *
 * <pre>
 * - rotation.attempt           : Counter (tag: outcome = rotated | conflict | not_due | failed)
 * - rotation.cache.push.failure: Counter
 * </pre>
 */
@Component
@RequiredArgsConstructor
public class RotationMetrics {

  private final MeterRegistry registry;

  public void recordOutcome(RotationOutcome outcome) {
    registry
        .counter("rotation.attempt", "outcome", outcome.name().toLowerCase(Locale.ROOT))
        .increment();
  }

  public void recordFailure() {
    registry.counter("rotation.attempt", "outcome", "failed").increment();
  }

  public void recordCachePushFailure() {
    registry.counter("rotation.cache.push.failure").increment();
  }
}
