package question.rotation.infrastructure.executor.function;

/** 체크 예외를 던질 수 있는 Runnable */
@FunctionalInterface
public interface ThrowingRunnable {
  void run() throws Throwable;
}
