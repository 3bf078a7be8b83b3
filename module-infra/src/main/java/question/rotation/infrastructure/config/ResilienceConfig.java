package question.rotation.infrastructure.config;

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Resilience4j CircuitBreaker 레지스트리
 *
 * <p>{@code lookupCache} 브레이커: 캐시(Redis) 장애가 이어지면 OPEN으로 전환하여 조회 경로가 캐시 타임아웃을 매번 기다리지 않고 곧바로
 * 저장소로 내려가게 합니다.
 */
@Configuration
public class ResilienceConfig {

  @Bean
  public CircuitBreakerRegistry circuitBreakerRegistry(
      @Value("${resilience.lookup-cache.failure-rate-threshold:50}") float failureRateThreshold,
      @Value("${resilience.lookup-cache.wait-duration-in-open-state:10s}")
          Duration waitDurationInOpenState) {
    CircuitBreakerConfig defaults =
        CircuitBreakerConfig.custom()
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(20)
            .minimumNumberOfCalls(10)
            .failureRateThreshold(failureRateThreshold)
            .waitDurationInOpenState(waitDurationInOpenState)
            .permittedNumberOfCallsInHalfOpenState(3)
            .build();
    return CircuitBreakerRegistry.of(defaults);
  }
}
