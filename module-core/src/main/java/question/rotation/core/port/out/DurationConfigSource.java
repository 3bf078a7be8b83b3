package question.rotation.core.port.out;

import java.time.Duration;

/**
 * 런타임 파라미터 조회 Port
 *
 * <p>호출할 때마다 다시 읽으므로 값 변경이 다음 로테이션부터 반영됩니다.
 */
public interface DurationConfigSource {

  /**
   * @throws question.rotation.error.exception.ConfigMissingException 키가 없을 때
   * @throws question.rotation.error.exception.InvalidConfigValueException 형식 오류 또는 0 이하일 때
   */
  Duration getDuration(String key);
}
