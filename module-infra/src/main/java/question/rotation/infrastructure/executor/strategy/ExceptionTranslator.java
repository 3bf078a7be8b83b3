package question.rotation.infrastructure.executor.strategy;

import java.io.IOException;
import java.util.Locale;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.TransactionException;
import question.rotation.error.exception.InternalSystemException;
import question.rotation.error.exception.RotationConflictException;
import question.rotation.error.exception.TransientStoreException;
import question.rotation.error.exception.base.BaseException;
import question.rotation.infrastructure.executor.TaskContext;
import question.rotation.infrastructure.persistence.entity.RotationCycleJpaEntity;
import question.rotation.infrastructure.util.ExceptionUtils;

/** 특정 예외를 도메인 예외로 변환하는 전략 */
@FunctionalInterface
public interface ExceptionTranslator {

  /**
   * @param e 원본 예외
   * @param context 작업 컨텍스트
   * @return 변환된 RuntimeException
   */
  RuntimeException translate(Throwable e, TaskContext context);

  /**
   * Error guard + async unwrap을 선행 적용하는 Decorator
   *
   * <ol>
   *   <li>Error → 즉시 rethrow
   *   <li>CompletionException/ExecutionException → 원본으로 unwrap
   *   <li>InterruptedException → 현재 스레드의 인터럽트 플래그 복원 (변환 결과와 무관)
   *   <li>이미 BaseException이면 그대로 반환
   *   <li>나머지는 내부 translator에 위임
   * </ol>
   */
  static ExceptionTranslator withErrorGuardAndUnwrap(ExceptionTranslator inner) {
    return (e, context) -> {
      if (e instanceof Error err) {
        throw err;
      }
      Throwable unwrapped = ExceptionUtils.unwrapAsyncException(e);
      if (unwrapped instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      if (unwrapped instanceof BaseException be) {
        return be;
      }
      return inner.translate(unwrapped, context);
    };
  }

  /** 기본 변환기: 관리되지 않은 예외는 InternalSystemException으로 규격화 */
  static ExceptionTranslator defaultTranslator() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> new InternalSystemException(context.toTaskName(), unwrapped));
  }

  /**
   * 저장소 읽기 변환기
   *
   * <p>타임아웃, 커넥션/I-O 장애, 조회 풀 포화는 재시도 가능한 {@link TransientStoreException}이 됩니다. "배정 없음"으로
   * 바뀌지 않습니다.
   */
  static ExceptionTranslator forStore() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> {
          if (unwrapped instanceof InterruptedException) {
            return new TransientStoreException(context.toTaskName() + " interrupted", unwrapped);
          }
          if (unwrapped instanceof TimeoutException
              || unwrapped instanceof RejectedExecutionException
              || unwrapped instanceof DataAccessException
              || unwrapped instanceof TransactionException
              || unwrapped instanceof IOException) {
            return new TransientStoreException(context.toTaskName(), unwrapped);
          }
          return new InternalSystemException(context.toTaskName(), unwrapped);
        });
  }

  /**
   * 로테이션 커밋 변환기
   *
   * <p>활성 슬롯 유니크 인덱스({@code uk_rotation_cycle_active_slot}) 위반만 동시 부트스트랩이 먼저 커밋했다는 뜻이므로 {@link
   * RotationConflictException}으로 변환합니다. 외래 키나 배정 유니크 위반 같은 나머지 무결성 오류는 {@link #forStore()} 규칙을
   * 따릅니다.
   */
  static ExceptionTranslator forRotationCommit(Long expectedActiveCycleId) {
    ExceptionTranslator store = forStore();
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> {
          if (unwrapped instanceof DataIntegrityViolationException
              && violates(unwrapped, RotationCycleJpaEntity.ACTIVE_SLOT_CONSTRAINT)) {
            return new RotationConflictException(expectedActiveCycleId, unwrapped);
          }
          return store.translate(unwrapped, context);
        });
  }

  /** 원인 체인에서 제약 이름을 찾습니다. Hibernate가 제약 이름을 알려주지 않는 드라이버는 메시지로 판별합니다. */
  private static boolean violates(Throwable e, String constraintName) {
    for (Throwable cause = e; cause != null; cause = cause.getCause()) {
      if (cause instanceof ConstraintViolationException cve
          && cve.getConstraintName() != null
          && cve.getConstraintName().toLowerCase(Locale.ROOT).contains(constraintName)) {
        return true;
      }
      String message = cause.getMessage();
      if (message != null && message.toLowerCase(Locale.ROOT).contains(constraintName)) {
        return true;
      }
    }
    return false;
  }
}
