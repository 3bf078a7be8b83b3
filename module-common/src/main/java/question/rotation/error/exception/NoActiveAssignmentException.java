package question.rotation.error.exception;

import question.rotation.error.CommonErrorCode;
import question.rotation.error.exception.base.ServerBaseException;

/**
 * 지역은 존재하지만 활성 사이클에 배정 행이 없을 때 발생
 *
 * <p>로테이션 결함(부트스트랩 전 조회 포함)을 의미하는 서버 측 데이터 결함입니다. 재시도로 해결되지 않습니다.
 */
public class NoActiveAssignmentException extends ServerBaseException {
  public NoActiveAssignmentException(long regionId) {
    super(CommonErrorCode.NO_ACTIVE_ASSIGNMENT, regionId);
  }
}
