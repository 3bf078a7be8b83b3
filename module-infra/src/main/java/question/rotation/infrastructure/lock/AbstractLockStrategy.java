package question.rotation.infrastructure.lock;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import question.rotation.infrastructure.executor.LogicExecutor;
import question.rotation.infrastructure.executor.TaskContext;

/**
 * 락 전략 추상 클래스 (Template Method)
 *
 * <ul>
 *   <li>{@link #tryLockImmediately}, {@link #unlock}: 획득/해제 뼈대 (장애는 실패로 취급)
 *   <li>{@link #tryLock}, {@link #unlockInternal}, {@link #shouldUnlock}: 구현체별 차이
 *   <li>{@link #onLockAcquired}, {@link #onLockFailed}, {@link #onLockReleased}: 선택적 Hook
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public abstract class AbstractLockStrategy implements LockStrategy {

  protected final LogicExecutor executor;

  @Override
  public boolean tryLockImmediately(String key) {
    String lockKey = buildLockKey(key);
    boolean acquired =
        executor.executeOrDefault(
            () -> tryLock(lockKey, 0), false, TaskContext.of("Lock", "tryImmediate", key));
    if (acquired) {
      onLockAcquired(lockKey);
    } else {
      onLockFailed(lockKey);
    }
    return acquired;
  }

  @Override
  public void unlock(String key) {
    String lockKey = buildLockKey(key);
    executor.executeOrDefault(
        () -> {
          if (shouldUnlock(lockKey)) {
            unlockInternal(lockKey);
            onLockReleased(lockKey);
          }
          return null;
        },
        null,
        TaskContext.of("Lock", "unlock", key));
  }

  // ===== 구현체가 반드시 구현 =====

  /**
   * @param waitSeconds 대기 시간 (초)
   * @return 락 획득 성공 여부
   */
  protected abstract boolean tryLock(String lockKey, long waitSeconds) throws Throwable;

  protected abstract void unlockInternal(String lockKey);

  /** 현재 스레드가 락을 소유하고 있는지 */
  protected abstract boolean shouldUnlock(String lockKey);

  // ===== Hook =====

  protected String buildLockKey(String key) {
    return "lock:" + key;
  }

  protected void onLockAcquired(String lockKey) {
    log.debug("[Lock] '{}' 획득 성공", lockKey);
  }

  protected void onLockFailed(String lockKey) {
    log.info("[Lock] '{}' 획득 실패", lockKey);
  }

  protected void onLockReleased(String lockKey) {
    log.debug("[Lock] '{}' 해제 완료", lockKey);
  }
}
