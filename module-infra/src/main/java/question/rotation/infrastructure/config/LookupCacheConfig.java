package question.rotation.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.redisson.api.RedissonClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import question.rotation.core.port.out.LookupCache;
import question.rotation.infrastructure.cache.LookupCacheProperties;
import question.rotation.infrastructure.cache.TieredLookupCache;
import question.rotation.infrastructure.executor.LogicExecutor;

@Configuration
@EnableConfigurationProperties(LookupCacheProperties.class)
public class LookupCacheConfig {

  @Bean
  public LookupCache lookupCache(
      RedissonClient redissonClient,
      ObjectMapper objectMapper,
      LogicExecutor logicExecutor,
      LookupCacheProperties properties,
      Clock clock,
      MeterRegistry meterRegistry) {
    return new TieredLookupCache(
        redissonClient, objectMapper, logicExecutor, properties, clock, meterRegistry);
  }
}
