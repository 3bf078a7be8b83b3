package question.rotation.infrastructure.concurrency;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import question.rotation.infrastructure.util.ExceptionUtils;

/**
 * 프로세스 내 Single-flight 비동기 실행기
 *
 * <ul>
 *   <li>같은 키에 대한 동시 요청 N개 중 실제 계산은 1회만 수행 (Leader)
 *   <li>나머지 요청은 Leader의 결과를 공유 (Follower)
 *   <li>Follower마다 독립 Future + 타임아웃 (공유 promise 오염 방지)
 * </ul>
 *
 * <pre>{@code
 * SingleFlightExecutor<QuestionView> flights =
 *     new SingleFlightExecutor<>(Duration.ofSeconds(2), lookupExecutor);
 *
 * QuestionView view = flights.executeAsync("region:7", () -> loadFromStore(7L)).join();
 * }</pre>
 *
 * @param <T> 계산 결과 타입
 */
@Slf4j
public class SingleFlightExecutor<T> {

  private final Duration followerTimeout;
  private final Executor executor;

  private final ConcurrentHashMap<String, CompletableFuture<T>> inFlight =
      new ConcurrentHashMap<>();

  public SingleFlightExecutor(Duration followerTimeout, Executor executor) {
    this.followerTimeout = followerTimeout;
    this.executor = executor;
  }

  /**
   * @param key 계산 식별 키
   * @param task Leader가 실행할 동기 계산
   * @return 계산 결과 Future (예외는 CompletionException 없이 원인 그대로 완료됨)
   */
  public CompletableFuture<T> executeAsync(String key, Supplier<T> task) {
    CompletableFuture<T> promise = new CompletableFuture<>();
    CompletableFuture<T> existing = inFlight.putIfAbsent(key, promise);

    if (existing == null) {
      return executeAsLeader(key, promise, task);
    }
    return executeAsFollower(key, existing);
  }

  /** 현재 진행 중인 키 수 */
  public int inFlightCount() {
    return inFlight.size();
  }

  /**
   * Leader 실행
   *
   * <p>task가 동기 예외를 던지거나 executor가 거부해도 promise 완료와 inFlight 제거가 반드시 수행되어야 합니다.
   */
  private CompletableFuture<T> executeAsLeader(
      String key, CompletableFuture<T> promise, Supplier<T> task) {
    try {
      CompletableFuture.supplyAsync(task, executor)
          .whenComplete((result, error) -> completeLeader(key, promise, result, error));
    } catch (RejectedExecutionException e) {
      completeLeader(key, promise, null, e);
    }
    return promise;
  }

  private void completeLeader(String key, CompletableFuture<T> promise, T result, Throwable error) {
    inFlight.remove(key, promise);
    if (error != null) {
      Throwable cause = ExceptionUtils.unwrapAsyncException(error);
      log.debug("[SingleFlight] Leader failed: key={}, cause={}", key, cause.toString());
      promise.completeExceptionally(cause);
      return;
    }
    promise.complete(result);
  }

  private CompletableFuture<T> executeAsFollower(String key, CompletableFuture<T> leaderFuture) {
    CompletableFuture<T> isolated = new CompletableFuture<>();
    leaderFuture.whenComplete(
        (result, error) -> {
          if (error != null) {
            isolated.completeExceptionally(ExceptionUtils.unwrapAsyncException(error));
          } else {
            isolated.complete(result);
          }
        });
    log.debug("[SingleFlight] Follower joined: key={}", key);
    return isolated.orTimeout(followerTimeout.toMillis(), TimeUnit.MILLISECONDS);
  }
}
