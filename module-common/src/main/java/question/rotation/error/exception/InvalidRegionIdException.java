package question.rotation.error.exception;

import question.rotation.error.CommonErrorCode;
import question.rotation.error.exception.base.ClientBaseException;

public class InvalidRegionIdException extends ClientBaseException {
  public InvalidRegionIdException(String rawRegionId) {
    super(CommonErrorCode.INVALID_INPUT_VALUE, "region=" + rawRegionId);
  }
}
