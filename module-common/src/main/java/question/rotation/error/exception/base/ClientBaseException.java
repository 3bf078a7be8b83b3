package question.rotation.error.exception.base;

import question.rotation.error.ErrorCode;

/**
 * ClientBaseException: 요청이 잘못되었을 때 발생하는 '비즈니스 예외' 4xx 계열의 에러를 처리하며, 호출자에게 구체적인 실패 원인을 전달하는 것이
 * 목적입니다. 재시도해도 결과가 바뀌지 않습니다.
 */
public abstract class ClientBaseException extends BaseException {

  public ClientBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  public ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }
}
