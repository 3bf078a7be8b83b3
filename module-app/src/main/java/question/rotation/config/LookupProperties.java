package question.rotation.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * 조회 경로 설정
 *
 * <pre>{@code
 * lookup:
 *   cache-timeout: 200ms
 *   store-timeout: 2s
 *   executor:
 *     core-pool-size: 8
 *     max-pool-size: 16
 *     queue-capacity: 500
 * }</pre>
 *
 * @param cacheTimeout 캐시 읽기 상한. 넘기면 저장소 조회로 내려감
 * @param storeTimeout 캐시 미스 시 저장소 조회 상한. 넘기면 503
 */
@ConfigurationProperties(prefix = "lookup")
public record LookupProperties(
    @DefaultValue("200ms") Duration cacheTimeout,
    @DefaultValue("2s") Duration storeTimeout,
    @DefaultValue Pool executor) {

  public LookupProperties {
    requirePositive("lookup.cache-timeout", cacheTimeout);
    requirePositive("lookup.store-timeout", storeTimeout);
  }

  public record Pool(
      @DefaultValue("8") int corePoolSize,
      @DefaultValue("16") int maxPoolSize,
      @DefaultValue("500") int queueCapacity) {

    public Pool {
      if (corePoolSize <= 0 || maxPoolSize < corePoolSize) {
        throw new IllegalArgumentException(
            "lookup.executor pool sizes invalid: core=" + corePoolSize + ", max=" + maxPoolSize);
      }
      if (queueCapacity < 0) {
        throw new IllegalArgumentException("lookup.executor.queue-capacity must not be negative");
      }
    }
  }

  private static void requirePositive(String key, Duration value) {
    if (value == null || value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(key + " must be positive, got: " + value);
    }
  }
}
