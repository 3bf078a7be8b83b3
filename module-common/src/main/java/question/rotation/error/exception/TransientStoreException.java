package question.rotation.error.exception;

import question.rotation.error.CommonErrorCode;
import question.rotation.error.exception.base.ServerBaseException;

/**
 * 저장소 타임아웃 / I/O 장애 (503, 재시도 가능)
 *
 * <p>"질문 없음"으로 위장하지 않고 호출자에게 그대로 드러냅니다.
 */
public class TransientStoreException extends ServerBaseException {

  public TransientStoreException(String detail) {
    super(CommonErrorCode.TRANSIENT_STORE_FAILURE, detail);
  }

  public TransientStoreException(String detail, Throwable cause) {
    super(CommonErrorCode.TRANSIENT_STORE_FAILURE, cause, detail);
  }
}
