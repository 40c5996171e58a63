package crowd.ledger.infrastructure.executor;

import crowd.ledger.common.function.ThrowingRunnable;
import crowd.ledger.common.function.ThrowingSupplier;
import java.util.function.Function;

/**
 * 예외 처리 패턴을 추상화한 실행기
 *
 * <p>코드 평탄화를 우선합니다. 비즈니스 로직은 별도 메서드로 분리하고 메서드 참조({@code this::method})를 활용하세요.
 *
 * <h3>지원 패턴</h3>
 *
 * <ol>
 *   <li><b>try-catch-throw</b> (예외 변환 후 재전파) - {@link #execute}
 *   <li><b>try-catch-recover</b> (복구 로직 실행) - {@link #executeOrCatch}
 * </ol>
 *
 * <p>{@link crowd.ledger.error.exception.base.BaseException}은 변환 없이 그대로 전파됩니다.
 */
public interface LogicExecutor {

  /**
   * 작업을 실행하고, 비즈니스 예외가 아닌 예외는 InternalSystemException으로 변환하여 전파합니다.
   *
   * @param task 실행할 작업
   * @param context 작업 컨텍스트 (로깅/메트릭용)
   * @return 작업 결과
   */
  <T> T execute(ThrowingSupplier<T> task, TaskContext context);

  /**
   * 예외 발생 시 recovery로 복구합니다. recovery는 변환된 예외를 받습니다.
   *
   * @param recovery 복구 함수
   */
  <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context);

  /** 반환값 없는 {@link #execute} */
  void executeVoid(ThrowingRunnable task, TaskContext context);
}
