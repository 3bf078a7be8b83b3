package question.rotation.error.exception;

import lombok.Getter;
import question.rotation.error.CommonErrorCode;
import question.rotation.error.exception.base.ServerBaseException;

/**
 * 후보 질문이 0개인 지역을 선택하려 할 때 발생
 *
 * <p>로테이션 전체를 중단시킵니다. 일부 지역만 배정된 사이클은 커밋되지 않습니다.
 */
@Getter
public class NoEligibleQuestionException extends ServerBaseException {

  private final long regionId;

  public NoEligibleQuestionException(long regionId) {
    super(CommonErrorCode.NO_ELIGIBLE_QUESTION, regionId);
    this.regionId = regionId;
  }
}
