package question.rotation.infrastructure.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.ExecutorServiceMetrics;
import java.util.Collections;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Spring TaskScheduler 설정
 *
 * <p>로테이션 트리거는 동적 Trigger로 등록되며 이 스케줄러에서 실행됩니다. 앱 종료 시 진행 중인 로테이션이 커밋까지 끝나도록
 * waitForTasksToCompleteOnShutdown을 켭니다.
 *
 * <h4>Micrometer 메트릭</h4>
 *
 * <ul>
 *   <li>{@code executor.*{name=task.scheduler}} - ExecutorServiceMetrics
 *   <li>{@code scheduler.rejected} - 거부된 작업 수
 * </ul>
 */
@Slf4j
@Configuration
@EnableScheduling
@EnableConfigurationProperties(SchedulerProperties.class)
public class SchedulerConfig {

  @Bean
  @ConditionalOnMissingBean(name = "taskScheduler")
  public ThreadPoolTaskScheduler taskScheduler(
      SchedulerProperties properties, MeterRegistry meterRegistry) {

    Counter rejectedCounter =
        Counter.builder("scheduler.rejected")
            .description("Number of scheduled tasks rejected")
            .register(meterRegistry);

    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(properties.poolSize());
    scheduler.setThreadNamePrefix("scheduler-");
    scheduler.setWaitForTasksToCompleteOnShutdown(true);
    scheduler.setAwaitTerminationSeconds(properties.awaitTerminationSeconds());
    scheduler.setRejectedExecutionHandler(
        (r, executor) -> {
          rejectedCounter.increment();
          log.warn(
              "[TaskScheduler] Task rejected. shutdown={}, poolSize={}, queueSize={}",
              executor.isShutdown(),
              executor.getPoolSize(),
              executor.getQueue().size());
          throw new RejectedExecutionException("TaskScheduler rejected task");
        });
    scheduler.initialize();

    new ExecutorServiceMetrics(
            scheduler.getScheduledExecutor(), "task.scheduler", Collections.emptyList())
        .bindTo(meterRegistry);

    log.info("[TaskScheduler] Initialized with poolSize={}", properties.poolSize());
    return scheduler;
  }
}
