package question.rotation.error.exception;

import question.rotation.error.CommonErrorCode;
import question.rotation.error.exception.base.ServerBaseException;

/** 필수 설정값이 없을 때 발생. 기본값으로 추측하지 않고 현재 로테이션 시도를 실패시킵니다. */
public class ConfigMissingException extends ServerBaseException {
  public ConfigMissingException(String key) {
    super(CommonErrorCode.CONFIG_MISSING, key);
  }
}
