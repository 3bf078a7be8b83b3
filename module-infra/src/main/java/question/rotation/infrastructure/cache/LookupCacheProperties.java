package question.rotation.infrastructure.cache;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * 조회 캐시 설정
 *
 * <pre>{@code
 * lookup:
 *   cache:
 *     key-prefix: "lookup:region:"
 *     l1-max-ttl: 5s
 *     l1-maximum-size: 10000
 * }</pre>
 *
 * <p>L1은 인스턴스 로컬이라 로테이션 직후 다른 인스턴스의 L1이 이전 값을 최대 {@code l1-max-ttl} 동안 보여줄 수 있습니다.
 */
@ConfigurationProperties(prefix = "lookup.cache")
public record LookupCacheProperties(
    @DefaultValue("lookup:region:") String keyPrefix,
    @DefaultValue("5s") Duration l1MaxTtl,
    @DefaultValue("10000") long l1MaximumSize) {

  public LookupCacheProperties {
    if (keyPrefix == null || keyPrefix.isBlank()) {
      throw new IllegalArgumentException("lookup.cache.key-prefix must not be blank");
    }
    if (l1MaxTtl == null || l1MaxTtl.isNegative()) {
      throw new IllegalArgumentException("lookup.cache.l1-max-ttl must not be negative");
    }
    if (l1MaximumSize <= 0) {
      throw new IllegalArgumentException(
          "lookup.cache.l1-maximum-size must be positive, got: " + l1MaximumSize);
    }
  }

  public String keyOf(long regionId) {
    return keyPrefix + regionId;
  }
}
