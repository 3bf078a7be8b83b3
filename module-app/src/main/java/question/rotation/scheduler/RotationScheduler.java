package question.rotation.scheduler;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.TriggerContext;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;
import question.rotation.config.RotationProperties;
import question.rotation.core.domain.model.Cycle;
import question.rotation.core.domain.model.RotationResult;
import question.rotation.core.port.out.AssignmentStore;
import question.rotation.infrastructure.executor.LogicExecutor;
import question.rotation.infrastructure.executor.TaskContext;
import question.rotation.infrastructure.lock.LockStrategy;
import question.rotation.service.rotation.RotationEngine;
import question.rotation.service.rotation.RotationMetrics;

/**
 * 로테이션 스케줄러
 *
 * <h3>다음 실행 시각 (동적 Trigger)</h3>
 *
 * <ul>
 *   <li>직전 시도가 실패했거나 락을 얻지 못했으면: now + retry-delay
 *   <li>활성 사이클이 없으면 (부트스트랩): 즉시
 *   <li>그 외: 활성 사이클 종료 시각 (이미 지났으면 즉시)
 * </ul>
 *
 * <p>다중 인스턴스 환경에서는 Redisson 락({@code rotation.scheduler.lock-key})을 기다리지 않고 시도합니다. 락을 놓친 인스턴스는 이번
 * 회차를 건너뜁니다. 동시에 진입하더라도 저장소의 조건부 커밋이 한 번만 성공시킵니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "rotation.scheduler.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class RotationScheduler implements SchedulingConfigurer {

  private final RotationEngine engine;
  private final AssignmentStore store;
  private final LockStrategy lockStrategy;
  private final LogicExecutor executor;
  private final RotationProperties properties;
  private final RotationMetrics metrics;
  private final Clock clock;

  private volatile boolean retryPending;

  @Override
  public void configureTasks(ScheduledTaskRegistrar registrar) {
    registrar.addTriggerTask(this::runOnce, this::nextExecution);
    log.info("[RotationScheduler] Registered, retryDelay={}", properties.scheduler().retryDelay());
  }

  /** 락 획득 후 한 번 로테이션을 시도합니다. */
  void runOnce() {
    String lockKey = properties.scheduler().lockKey();
    if (!lockStrategy.tryLockImmediately(lockKey)) {
      log.info("[RotationScheduler] Lock held by another instance, skip: key={}", lockKey);
      retryPending = true;
      return;
    }
    executor.executeWithFinally(
        () -> {
          attempt();
          return null;
        },
        () -> lockStrategy.unlock(lockKey),
        TaskContext.of("Scheduler", "Rotation.Run"));
  }

  private void attempt() {
    RotationResult result =
        executor.executeOrCatch(
            engine::rotate,
            e -> {
              metrics.recordFailure();
              log.error(
                  "[RotationScheduler] Rotation failed, retry in {}: {}",
                  properties.scheduler().retryDelay(),
                  e.getMessage(),
                  e);
              return null;
            },
            TaskContext.of("Scheduler", "Rotation.Rotate"));
    retryPending = result == null;
    if (result != null) {
      log.debug("[RotationScheduler] Attempt finished: outcome={}", result.outcome());
    }
  }

  Instant nextExecution(TriggerContext context) {
    Instant now = clock.instant();
    if (retryPending) {
      return now.plus(properties.scheduler().retryDelay());
    }
    Optional<Cycle> active =
        executor.executeOrDefault(
            store::findActiveCycle, null, TaskContext.of("Scheduler", "Rotation.NextRun"));
    if (active == null) {
      return now.plus(properties.scheduler().retryDelay());
    }
    return active.map(Cycle::endTime).filter(end -> end.isAfter(now)).orElse(now);
  }

  boolean isRetryPending() {
    return retryPending;
  }
}
