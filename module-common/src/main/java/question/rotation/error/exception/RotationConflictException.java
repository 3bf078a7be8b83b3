package question.rotation.error.exception;

import question.rotation.error.CommonErrorCode;
import question.rotation.error.exception.base.ServerBaseException;

/**
 * 조건부 커밋 실패: 기대한 활성 사이클이 이미 다른 로테이션에 의해 교체됨
 *
 * <p>중복 트리거에 대한 정상 시나리오이며 RotationEngine이 CONFLICT 결과로 해석합니다.
 */
public class RotationConflictException extends ServerBaseException {

  public RotationConflictException(Long expectedActiveCycleId) {
    super(CommonErrorCode.ROTATION_CONFLICT, String.valueOf(expectedActiveCycleId));
  }

  public RotationConflictException(Long expectedActiveCycleId, Throwable cause) {
    super(CommonErrorCode.ROTATION_CONFLICT, cause, String.valueOf(expectedActiveCycleId));
  }
}
