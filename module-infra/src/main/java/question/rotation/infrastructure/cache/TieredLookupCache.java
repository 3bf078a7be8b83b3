package question.rotation.infrastructure.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.BatchOptions;
import org.redisson.api.RBatch;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import question.rotation.core.domain.model.QuestionView;
import question.rotation.core.port.out.LookupCache;
import question.rotation.infrastructure.executor.LogicExecutor;
import question.rotation.infrastructure.executor.TaskContext;

/**
 * 2층 구조 조회 캐시 (L1: Caffeine, L2: Redis)
 *
 * <ul>
 *   <li>조회: L1 → L2 순서, L2 적중 시 L1 Backfill
 *   <li>저장: L2 → L1 순서. L2 저장이 실패하면 L1은 건드리지 않음
 *   <li>모든 쓰기는 키 값을 통째로 교체 (read-modify-write 없음)
 *   <li>TTL이 0 이하이면 쓰지 않음 (이미 끝난 사이클 값은 캐싱하지 않음)
 * </ul>
 *
 * <p>L2 장애는 예외로 전파됩니다. 장애 시 저장소 조회로 내려가는 판단은 호출부(조회 서비스)의 몫입니다.
 */
@Slf4j
public class TieredLookupCache implements LookupCache {

  private final Cache<Long, TimedEntry> l1;
  private final RedissonClient redissonClient;
  private final ObjectMapper objectMapper;
  private final LogicExecutor executor;
  private final LookupCacheProperties properties;
  private final Clock clock;

  private final Counter l1HitCounter;
  private final Counter l2HitCounter;
  private final Counter missCounter;

  public TieredLookupCache(
      RedissonClient redissonClient,
      ObjectMapper objectMapper,
      LogicExecutor executor,
      LookupCacheProperties properties,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.l1 = newL1(properties);
    this.redissonClient = redissonClient;
    this.objectMapper = objectMapper;
    this.executor = executor;
    this.properties = properties;
    this.clock = clock;

    this.l1HitCounter =
        Counter.builder("lookup.cache.layer").tag("layer", "L1").register(meterRegistry);
    this.l2HitCounter =
        Counter.builder("lookup.cache.layer").tag("layer", "L2").register(meterRegistry);
    this.missCounter =
        Counter.builder("lookup.cache.layer").tag("layer", "none").register(meterRegistry);
  }

  @Override
  public Optional<QuestionView> get(long regionId) {
    TimedEntry local = l1.getIfPresent(regionId);
    if (local != null) {
      l1HitCounter.increment();
      return Optional.of(local.view());
    }

    Optional<QuestionView> remote =
        executor.execute(() -> readL2(regionId), TaskContext.of("LookupCache", "getL2", regionId));
    remote.ifPresentOrElse(this::backfillL1, missCounter::increment);
    return remote;
  }

  @Override
  public void put(QuestionView view, Duration ttl) {
    if (isNotPositive(ttl)) {
      log.debug("[LookupCache] Skip put, ttl={} regionId={}", ttl, view.regionId());
      return;
    }
    String json = serialize(view);
    executor.executeVoid(
        () -> writeOne(view.regionId(), json, ttl),
        TaskContext.of("LookupCache", "putL2", view.regionId()));
    putL1(view, ttl);
  }

  /** 로테이션 스냅샷 일괄 갱신: L2 단일 RBatch 후 L1 교체 */
  @Override
  public void putAll(Collection<QuestionView> views, Duration ttl) {
    if (views.isEmpty() || isNotPositive(ttl)) {
      log.debug("[LookupCache] Skip putAll, size={}, ttl={}", views.size(), ttl);
      return;
    }
    executor.executeVoid(
        () -> writeBatch(views, ttl), TaskContext.of("LookupCache", "putAllL2", views.size()));
    views.forEach(view -> putL1(view, ttl));
    log.info("[LookupCache] Snapshot pushed: size={}, ttl={}", views.size(), ttl);
  }

  private Optional<QuestionView> readL2(long regionId) {
    String json =
        redissonClient.<String>getBucket(properties.keyOf(regionId), StringCodec.INSTANCE).get();
    if (json == null) {
      return Optional.empty();
    }
    l2HitCounter.increment();
    return Optional.ofNullable(deserialize(regionId, json));
  }

  private void writeOne(long regionId, String json, Duration ttl) {
    redissonClient.<String>getBucket(properties.keyOf(regionId), StringCodec.INSTANCE).set(json, ttl);
  }

  private void writeBatch(Collection<QuestionView> views, Duration ttl) {
    RBatch batch = redissonClient.createBatch(BatchOptions.defaults());
    for (QuestionView view : views) {
      batch
          .<String>getBucket(properties.keyOf(view.regionId()), StringCodec.INSTANCE)
          .setAsync(serialize(view), ttl);
    }
    batch.execute();
  }

  /** L2에서 가져온 값은 사이클 잔여 시간 기준으로 L1에 채움 */
  private void backfillL1(QuestionView view) {
    putL1(view, Duration.between(clock.instant(), view.cycleEndsAt()));
  }

  private void putL1(QuestionView view, Duration ttl) {
    Duration capped = ttl.compareTo(properties.l1MaxTtl()) < 0 ? ttl : properties.l1MaxTtl();
    if (isNotPositive(capped)) {
      l1.invalidate(view.regionId());
      return;
    }
    l1.put(view.regionId(), new TimedEntry(view, capped.toNanos()));
  }

  private String serialize(QuestionView view) {
    return executor.execute(
        () -> objectMapper.writeValueAsString(view),
        TaskContext.of("LookupCache", "serialize", view.regionId()));
  }

  /** 역직렬화 실패는 캐시 미스로 취급 (저장소에서 다시 채워짐) */
  private QuestionView deserialize(long regionId, String json) {
    return executor.executeOrDefault(
        () -> objectMapper.readValue(json, QuestionView.class),
        null,
        TaskContext.of("LookupCache", "deserialize", regionId));
  }

  /** 엔트리마다 다른 만료 시간을 갖는 Caffeine 캐시 (최대 l1-max-ttl) */
  private static Cache<Long, TimedEntry> newL1(LookupCacheProperties properties) {
    return Caffeine.newBuilder()
        .maximumSize(properties.l1MaximumSize())
        .expireAfter(
            new Expiry<Long, TimedEntry>() {
              @Override
              public long expireAfterCreate(Long key, TimedEntry entry, long currentTime) {
                return entry.ttlNanos();
              }

              @Override
              public long expireAfterUpdate(
                  Long key, TimedEntry entry, long currentTime, long currentDuration) {
                return entry.ttlNanos();
              }

              @Override
              public long expireAfterRead(
                  Long key, TimedEntry entry, long currentTime, long currentDuration) {
                return currentDuration;
              }
            })
        .build();
  }

  private static boolean isNotPositive(Duration ttl) {
    return ttl == null || ttl.isZero() || ttl.isNegative();
  }
}
