package question.rotation.infrastructure.util;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/** 비동기 래퍼 예외(CompletionException, ExecutionException)에서 원인 예외를 꺼내는 유틸리티 */
public final class ExceptionUtils {

  /**
   * @param throwable 래핑되었을 수 있는 예외
   * @return 가장 안쪽 원인 예외. 래퍼에 cause가 없으면 원본 그대로
   */
  public static Throwable unwrapAsyncException(Throwable throwable) {
    Throwable cause = throwable;
    while (cause instanceof CompletionException || cause instanceof ExecutionException) {
      cause = cause.getCause();
      if (cause == null) {
        return throwable;
      }
    }
    return cause;
  }

  private ExceptionUtils() {}
}
