package question.rotation.infrastructure.lock;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.stereotype.Component;
import question.rotation.infrastructure.executor.LogicExecutor;

/**
 * Redis 분산 락 전략 (Redisson 기반)
 *
 * <p>leaseTime을 지정하지 않는 Watchdog 모드를 사용합니다. lockWatchdogTimeout(기본 30초)마다 자동 갱신되므로 로테이션이 길어져도 락이
 * 먼저 풀리지 않고, 프로세스가 죽으면 갱신이 멈춰 자동 해제됩니다.
 */
@Slf4j
@Component
public class RedisDistributedLockStrategy extends AbstractLockStrategy {

  private static final String IMPLEMENTATION = "redis";

  private final RedissonClient redissonClient;
  private final LockMetrics lockMetrics;

  public RedisDistributedLockStrategy(
      RedissonClient redissonClient, LogicExecutor executor, LockMetrics lockMetrics) {
    super(executor);
    this.redissonClient = redissonClient;
    this.lockMetrics = lockMetrics;
  }

  @Override
  protected boolean tryLock(String lockKey, long waitSeconds) throws Throwable {
    RLock lock = redissonClient.getLock(lockKey);
    long startNanos = System.nanoTime();

    boolean acquired = lock.tryLock(waitSeconds, TimeUnit.SECONDS);

    if (acquired) {
      lockMetrics.recordWaitTime(Duration.ofNanos(System.nanoTime() - startNanos), IMPLEMENTATION);
    }
    return acquired;
  }

  @Override
  protected void unlockInternal(String lockKey) {
    redissonClient.getLock(lockKey).unlock();
    lockMetrics.recordLockReleased(IMPLEMENTATION);
  }

  @Override
  protected boolean shouldUnlock(String lockKey) {
    return redissonClient.getLock(lockKey).isHeldByCurrentThread();
  }

  @Override
  protected void onLockAcquired(String lockKey) {
    lockMetrics.recordLockAcquired(IMPLEMENTATION);
    super.onLockAcquired(lockKey);
  }

  @Override
  protected void onLockFailed(String lockKey) {
    lockMetrics.recordFailure(IMPLEMENTATION);
    super.onLockFailed(lockKey);
  }
}
