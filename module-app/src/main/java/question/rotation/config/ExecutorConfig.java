package question.rotation.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.ExecutorServiceMetrics;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import question.rotation.core.domain.model.QuestionView;
import question.rotation.infrastructure.concurrency.SingleFlightExecutor;

/**
 * 조회 경로 비동기 실행 설정
 *
 * <ul>
 *   <li>{@code lookupExecutor}: 캐시 읽기(타임아웃 적용)와 저장소 조회 Leader가 실행되는 전용 풀
 *   <li>{@code lookupSingleFlight}: 같은 지역에 대한 동시 캐시 미스를 한 번의 저장소 조회로 합침
 * </ul>
 */
@Slf4j
@Configuration
public class ExecutorConfig {

  /** 요청 스레드의 MDC(requestId)를 워커 스레드로 전파 */
  @Bean
  public TaskDecorator mdcPropagatingDecorator() {
    return runnable -> {
      Map<String, String> captured = MDC.getCopyOfContextMap();
      return () -> {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        if (captured == null) {
          MDC.clear();
        } else {
          MDC.setContextMap(captured);
        }
        try {
          runnable.run();
        } finally {
          if (previous == null) {
            MDC.clear();
          } else {
            MDC.setContextMap(previous);
          }
        }
      };
    };
  }

  /**
   * 조회 전용 Executor
   *
   * <p>큐가 가득 차면 AbortPolicy로 거부합니다. 거부는 저장소 일시 장애(503)로 응답됩니다.
   */
  @Bean(name = "lookupExecutor")
  public ThreadPoolTaskExecutor lookupExecutor(
      LookupProperties properties,
      TaskDecorator mdcPropagatingDecorator,
      MeterRegistry meterRegistry) {
    LookupProperties.Pool pool = properties.executor();

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(pool.corePoolSize());
    executor.setMaxPoolSize(pool.maxPoolSize());
    executor.setQueueCapacity(pool.queueCapacity());
    executor.setThreadNamePrefix("lookup-");
    executor.setAllowCoreThreadTimeOut(true);
    executor.setKeepAliveSeconds(30);
    executor.setTaskDecorator(mdcPropagatingDecorator);
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();

    new ExecutorServiceMetrics(
            executor.getThreadPoolExecutor(), "lookup", Collections.emptyList())
        .bindTo(meterRegistry);

    log.info(
        "[LookupExecutor] Initialized: core={}, max={}, queue={}",
        pool.corePoolSize(),
        pool.maxPoolSize(),
        pool.queueCapacity());
    return executor;
  }

  /** Follower 대기 상한은 저장소 조회 상한과 같습니다. */
  @Bean
  public SingleFlightExecutor<QuestionView> lookupSingleFlight(
      LookupProperties properties, @Qualifier("lookupExecutor") Executor lookupExecutor) {
    return new SingleFlightExecutor<>(properties.storeTimeout(), lookupExecutor);
  }
}
