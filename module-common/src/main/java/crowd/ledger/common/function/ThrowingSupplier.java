package crowd.ledger.common.function;

/**
 * 예외를 던질 수 있는 값 공급 작업
 *
 * <p>표준 {@link java.util.function.Supplier}와 달리 Checked Exception을 던질 수 있습니다.
 *
 * @param <T> 결과 타입
 */
@FunctionalInterface
public interface ThrowingSupplier<T> {

  T get() throws Throwable;
}
