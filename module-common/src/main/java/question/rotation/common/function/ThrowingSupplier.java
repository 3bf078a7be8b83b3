package question.rotation.common.function;

/**
 * Checked Exception을 던질 수 있는 Supplier
 *
 * @param <T> 결과 타입
 */
@FunctionalInterface
public interface ThrowingSupplier<T> {
  T get() throws Throwable;
}
