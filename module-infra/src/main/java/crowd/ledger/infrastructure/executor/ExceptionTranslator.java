package crowd.ledger.infrastructure.executor;

import crowd.ledger.error.exception.InternalSystemException;
import crowd.ledger.error.exception.base.BaseException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

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
   *   <li>BaseException → 그대로 반환
   *   <li>나머지 → 내부 translator에 위임
   * </ol>
   */
  static ExceptionTranslator withErrorGuardAndUnwrap(ExceptionTranslator inner) {
    return (e, context) -> {
      if (e instanceof Error err) {
        throw err;
      }
      Throwable unwrapped = unwrapAsync(e);
      if (unwrapped instanceof BaseException be) {
        return be;
      }
      return inner.translate(unwrapped, context);
    };
  }

  /** 기본 예외 변환기: 비즈니스 예외가 아니면 InternalSystemException */
  static ExceptionTranslator defaultTranslator() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> new InternalSystemException(context.toTaskName(), unwrapped));
  }

  private static Throwable unwrapAsync(Throwable e) {
    Throwable current = e;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
