package question.rotation.service.lookup;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import question.rotation.config.LookupProperties;
import question.rotation.core.domain.model.QuestionView;
import question.rotation.core.port.out.AssignmentStore;
import question.rotation.core.port.out.LookupCache;
import question.rotation.error.exception.NoActiveAssignmentException;
import question.rotation.error.exception.UnknownRegionException;
import question.rotation.infrastructure.concurrency.SingleFlightExecutor;
import question.rotation.infrastructure.executor.LogicExecutor;
import question.rotation.infrastructure.executor.TaskContext;
import question.rotation.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * 지역별 현재 질문 조회 (Cache-Aside)
 *
 * <h3>흐름</h3>
 *
 * <ol>
 *   <li>캐시 조회 ({@code lookup.cache-timeout} 상한, {@code lookupCache} 서킷 브레이커)
 *   <li>적중 → 그대로 반환 (저장소 접근 없음)
 *   <li>미스 → Single-flight로 지역당 1회만 저장소 조회 ({@code lookup.store-timeout} 상한)
 *   <li>조회 결과를 TTL = 사이클 종료 시각 - now 로 캐시에 기록
 * </ol>
 *
 * <h3>장애 처리</h3>
 *
 * <ul>
 *   <li>캐시 장애/타임아웃: 미스로 취급하고 저장소로 내려감
 *   <li>저장소 타임아웃/I-O 장애: {@code TransientStoreException} (503). "배정 없음"으로 바꾸지 않음
 *   <li>지역 없음: {@code UnknownRegionException} (404), 지역은 있는데 배정 없음: {@code NoActiveAssignmentException}
 * </ul>
 */
@Slf4j
@Service
public class CurrentQuestionService {

  static final String CIRCUIT_BREAKER_NAME = "lookupCache";
  private static final String FLIGHT_KEY_PREFIX = "region:";

  private final AssignmentStore store;
  private final LookupCache lookupCache;
  private final SingleFlightExecutor<QuestionView> singleFlight;
  private final Executor lookupExecutor;
  private final CircuitBreaker cacheBreaker;
  private final LogicExecutor executor;
  private final LookupProperties properties;
  private final Clock clock;

  private final Counter hitCounter;
  private final Counter missCounter;

  public CurrentQuestionService(
      AssignmentStore store,
      LookupCache lookupCache,
      SingleFlightExecutor<QuestionView> singleFlight,
      @Qualifier("lookupExecutor") Executor lookupExecutor,
      CircuitBreakerRegistry circuitBreakerRegistry,
      LogicExecutor executor,
      LookupProperties properties,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.store = store;
    this.lookupCache = lookupCache;
    this.singleFlight = singleFlight;
    this.lookupExecutor = lookupExecutor;
    this.cacheBreaker = circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER_NAME);
    this.executor = executor;
    this.properties = properties;
    this.clock = clock;
    this.hitCounter = Counter.builder("lookup.cache").tag("result", "hit").register(meterRegistry);
    this.missCounter =
        Counter.builder("lookup.cache").tag("result", "miss").register(meterRegistry);
  }

  public QuestionView getCurrentQuestion(long regionId) {
    Optional<QuestionView> cached = readCache(regionId);
    if (cached.isPresent()) {
      hitCounter.increment();
      return cached.get();
    }
    missCounter.increment();
    return loadThroughSingleFlight(regionId);
  }

  /** 캐시 장애는 미스와 같게 취급 */
  private Optional<QuestionView> readCache(long regionId) {
    return executor.executeOrDefault(
        () ->
            cacheBreaker.executeCheckedSupplier(
                () ->
                    CompletableFuture.supplyAsync(() -> lookupCache.get(regionId), lookupExecutor)
                        .get(properties.cacheTimeout().toMillis(), TimeUnit.MILLISECONDS)),
        Optional.empty(),
        TaskContext.of("Lookup", "readCache", regionId));
  }

  private QuestionView loadThroughSingleFlight(long regionId) {
    return executor.executeWithTranslation(
        () ->
            singleFlight
                .executeAsync(FLIGHT_KEY_PREFIX + regionId, () -> loadAndFill(regionId))
                .get(properties.storeTimeout().toMillis(), TimeUnit.MILLISECONDS),
        ExceptionTranslator.forStore(),
        TaskContext.of("Lookup", "loadFromStore", regionId));
  }

  /** Leader 스레드에서 실행: 저장소 조회 후 캐시 채움 */
  private QuestionView loadAndFill(long regionId) {
    QuestionView view =
        store
            .findCurrentAssignment(regionId)
            .orElseThrow(() -> missingAssignment(regionId));
    fillCache(view);
    return view;
  }

  private RuntimeException missingAssignment(long regionId) {
    if (!store.regionExists(regionId)) {
      return new UnknownRegionException(regionId);
    }
    return new NoActiveAssignmentException(regionId);
  }

  /** 사이클이 이미 끝났으면(로테이션 지연) 캐싱하지 않고 값만 반환 */
  private void fillCache(QuestionView view) {
    Duration ttl = Duration.between(clock.instant(), view.cycleEndsAt());
    if (ttl.isZero() || ttl.isNegative()) {
      log.warn(
          "[Lookup] Active cycle already ended, skip cache fill: regionId={}, cycleId={}",
          view.regionId(),
          view.cycleId());
      return;
    }
    executor.executeOrDefault(
        () -> {
          lookupCache.put(view, ttl);
          return null;
        },
        null,
        TaskContext.of("Lookup", "fillCache", view.regionId()));
  }
}
