package question.rotation.infrastructure.config;

import java.util.Arrays;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.redisson.config.ReadMode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Redisson 클라이언트 설정
 *
 * <p>{@code spring.data.redis.sentinel.*}가 있으면 Sentinel 모드, 없으면 단일 서버 모드로 접속합니다. 조회 캐시 L2와 로테이션 분산
 * 락이 이 클라이언트를 공유합니다.
 */
@Configuration
public class RedissonConfig {

  private static final String REDISSON_HOST_PREFIX = "redis://";

  @Value("${spring.data.redis.sentinel.master:}")
  private String masterName;

  @Value("${spring.data.redis.sentinel.nodes:}")
  private String sentinelNodes;

  @Value("${spring.data.redis.host:localhost}")
  private String host;

  @Value("${spring.data.redis.port:6379}")
  private int port;

  /** 캐시 읽기 타임아웃보다 길어야 조회 서비스의 타임아웃이 먼저 동작합니다. */
  @Value("${spring.data.redis.timeout-millis:3000}")
  private int timeoutMillis;

  @Bean(destroyMethod = "shutdown")
  public RedissonClient redissonClient() {
    Config config = new Config();

    if (isSentinelMode()) {
      configureSentinel(config);
    } else {
      configureSingleServer(config);
    }
    return Redisson.create(config);
  }

  private boolean isSentinelMode() {
    return !masterName.isEmpty() && !sentinelNodes.isEmpty();
  }

  private void configureSentinel(Config config) {
    String[] addresses =
        Arrays.stream(sentinelNodes.split(","))
            .map(node -> REDISSON_HOST_PREFIX + node.trim())
            .toArray(String[]::new);

    config
        .useSentinelServers()
        .setMasterName(masterName)
        .addSentinelAddress(addresses)
        .setCheckSentinelsList(false)
        .setReadMode(ReadMode.MASTER)
        .setRetryAttempts(2)
        .setRetryInterval(500)
        .setTimeout(timeoutMillis)
        .setConnectTimeout(5000);
  }

  private void configureSingleServer(Config config) {
    config
        .useSingleServer()
        .setAddress(REDISSON_HOST_PREFIX + host + ":" + port)
        .setRetryAttempts(2)
        .setRetryInterval(500)
        .setTimeout(timeoutMillis)
        .setConnectTimeout(5000)
        .setConnectionPoolSize(32)
        .setConnectionMinimumIdleSize(8);
  }
}
