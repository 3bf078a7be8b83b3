package question.rotation.infrastructure.executor;

import java.util.function.Function;
import question.rotation.common.function.ThrowingSupplier;
import question.rotation.infrastructure.executor.function.ThrowingRunnable;
import question.rotation.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * 예외 처리 패턴을 추상화한 실행기
 *
 * <p>코드 평탄화(Code Flattening)를 위해 비즈니스 로직은 별도 메서드로 분리하고 메서드 참조({@code this::method})로 전달합니다.
 *
 * <h3>지원 패턴</h3>
 *
 * <ol>
 *   <li><b>try-catch-throw</b> (예외 변환 후 재전파) - {@link #execute}
 *   <li><b>try-catch-return</b> (기본값 반환) - {@link #executeOrDefault}
 *   <li><b>try-catch-recover</b> (번역된 예외로 복구) - {@link #executeOrCatch}
 *   <li><b>try-finally</b> (리소스 정리) - {@link #executeWithFinally}
 *   <li><b>다중 catch</b> (ExceptionTranslator 사용) - {@link #executeWithTranslation}
 * </ol>
 *
 * <p>{@link Error}는 어떤 메서드에서도 잡지 않습니다.
 *
 * <pre>{@code
 * Cycle committed = executor.executeWithTranslation(
 *     () -> store.commitRotation(expectedId, cycle, assignments),
 *     ExceptionTranslator.forRotationCommit(expectedId),
 *     TaskContext.of("Rotation", "commit", String.valueOf(expectedId)));
 * }</pre>
 *
 * @see TaskContext
 * @see ExceptionTranslator
 */
public interface LogicExecutor {

  /**
   * 예외를 기본 변환기로 변환하여 전파
   *
   * <p>BaseException은 그대로, 그 외 예외는 InternalSystemException으로 감싸집니다.
   */
  <T> T execute(ThrowingSupplier<T> task, TaskContext context);

  /** 예외 발생 시 로그를 남기고 기본값 반환 */
  <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context);

  /**
   * 예외 발생 시 번역된 예외를 받아 복구값 생성
   *
   * @param recovery 기본 변환기를 거친 예외를 받는 복구 함수
   */
  <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context);

  void executeVoid(ThrowingRunnable task, TaskContext context);

  /** 작업 성공/실패와 관계없이 finallyBlock을 정확히 1회 실행 */
  <T> T executeWithFinally(ThrowingSupplier<T> task, Runnable finallyBlock, TaskContext context);

  /** 호출부가 지정한 변환기로 예외를 도메인 예외로 변환하여 전파 */
  <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context);
}
