package question.rotation.error.exception;

import question.rotation.error.CommonErrorCode;
import question.rotation.error.exception.base.ServerBaseException;

public class InvalidConfigValueException extends ServerBaseException {

  public InvalidConfigValueException(String key, String value) {
    super(CommonErrorCode.CONFIG_INVALID, key, value);
  }

  public InvalidConfigValueException(String key, String value, Throwable cause) {
    super(CommonErrorCode.CONFIG_INVALID, cause, key, value);
  }
}
