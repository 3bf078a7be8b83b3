package question.rotation.error.exception;

import question.rotation.error.CommonErrorCode;
import question.rotation.error.exception.base.ClientBaseException;

/** 등록되지 않은 지역 ID로 조회했을 때 발생 (404, 재시도 무의미) */
public class UnknownRegionException extends ClientBaseException {
  public UnknownRegionException(long regionId) {
    super(CommonErrorCode.UNKNOWN_REGION, regionId);
  }
}
