package question.rotation.infrastructure.executor;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.Objects;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import question.rotation.common.function.ThrowingSupplier;
import question.rotation.error.exception.base.BaseException;
import question.rotation.infrastructure.executor.function.ThrowingRunnable;
import question.rotation.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * LogicExecutor 기본 구현체
 *
 * <ul>
 *   <li>Checked Exception → Runtime Exception 자동 변환
 *   <li>Micrometer {@code logic.executor} Timer 자동 기록 (component, operation, result 태그)
 *   <li><b>Error 격리</b>: Error(OOM 등)는 절대 캐치하지 않고 상위로 전파
 *   <li><b>카디널리티 통제</b>: dynamicValue는 로그에만 기록
 * </ul>
 */
@Slf4j
@Component
public class DefaultLogicExecutor implements LogicExecutor {

  private static final String METRIC_NAME = "logic.executor";

  private final MeterRegistry meterRegistry;
  private final ExceptionTranslator translator;

  @Autowired
  public DefaultLogicExecutor(MeterRegistry meterRegistry) {
    this(meterRegistry, ExceptionTranslator.defaultTranslator());
  }

  public DefaultLogicExecutor(MeterRegistry meterRegistry, ExceptionTranslator translator) {
    this.meterRegistry = meterRegistry;
    this.translator = translator;
  }

  @Override
  public <T> T execute(ThrowingSupplier<T> task, TaskContext context) {
    return executeWithTranslation(task, translator, context);
  }

  @Override
  public <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context) {
    return executeOrCatch(
        task,
        e -> {
          log.warn("[{}] 예외 발생, 기본값 반환: {}", context.toTaskName(), e.getMessage());
          return defaultValue;
        },
        context);
  }

  @Override
  public <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context) {
    Objects.requireNonNull(recovery, "recovery");
    try {
      return timed(task, context);
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      return recovery.apply(translator.translate(t, context));
    }
  }

  @Override
  public void executeVoid(ThrowingRunnable task, TaskContext context) {
    Objects.requireNonNull(task, "task");
    execute(
        () -> {
          task.run();
          return null;
        },
        context);
  }

  @Override
  public <T> T executeWithFinally(
      ThrowingSupplier<T> task, Runnable finallyBlock, TaskContext context) {
    Objects.requireNonNull(finallyBlock, "finallyBlock");
    try {
      return execute(task, context);
    } finally {
      finallyBlock.run();
    }
  }

  @Override
  public <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator customTranslator, TaskContext context) {
    Objects.requireNonNull(customTranslator, "customTranslator");
    try {
      return timed(task, context);
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      RuntimeException translated = customTranslator.translate(t, context);
      logFailure(context, translated);
      throw translated;
    }
  }

  /** 작업 실행 + Timer 기록. 예외는 변환 없이 그대로 던집니다. */
  private <T> T timed(ThrowingSupplier<T> task, TaskContext context) throws Throwable {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(context, "context");
    Timer.Sample sample = Timer.start(meterRegistry);
    String result = "failure";
    try {
      T value = task.get();
      result = "success";
      return value;
    } finally {
      sample.stop(
          Timer.builder(METRIC_NAME)
              .tag("component", context.component())
              .tag("operation", context.operation())
              .tag("result", result)
              .register(meterRegistry));
    }
  }

  /** 4xx 계열 도메인 예외는 WARN, 5xx 도메인 예외는 ERROR(메시지), 미분류 예외는 ERROR(스택) */
  private void logFailure(TaskContext context, RuntimeException e) {
    if (e instanceof BaseException be && be.getErrorCode().getStatus().is4xxClientError()) {
      log.warn("[{}] {}", context.toTaskName(), e.getMessage());
      return;
    }
    if (e instanceof BaseException) {
      log.error("[{}] {}", context.toTaskName(), e.getMessage());
      return;
    }
    log.error("[{}] 실행 중 예외 발생", context.toTaskName(), e);
  }
}
