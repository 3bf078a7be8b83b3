package question.rotation.infrastructure.parameter;

import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import question.rotation.core.port.out.DurationConfigSource;
import question.rotation.error.exception.ConfigMissingException;
import question.rotation.error.exception.InvalidConfigValueException;

/**
 * Spring {@link Environment} 기반 런타임 파라미터 조회
 *
 * <p>키 {@code cycle-duration}은 프로퍼티 {@code rotation.parameters.cycle-duration}으로 조회됩니다. 바인딩 시점에 고정하지
 * 않고 호출마다 다시 읽으므로 외부 PropertySource 갱신이 다음 로테이션부터 반영됩니다.
 *
 * <p>{@code PT24H}(ISO-8601)와 {@code 24h}(simple) 형식을 모두 받습니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EnvironmentDurationConfigSource implements DurationConfigSource {

  static final String PREFIX = "rotation.parameters.";

  private final Environment environment;

  @Override
  public Duration getDuration(String key) {
    String raw = environment.getProperty(PREFIX + key);
    if (raw == null || raw.isBlank()) {
      throw new ConfigMissingException(PREFIX + key);
    }

    Duration parsed = parse(key, raw.trim());
    if (parsed.isZero() || parsed.isNegative()) {
      throw new InvalidConfigValueException(PREFIX + key, raw);
    }
    log.debug("[ConfigSource] {}={}", key, parsed);
    return parsed;
  }

  private Duration parse(String key, String raw) {
    try {
      return DurationStyle.detectAndParse(raw);
    } catch (IllegalArgumentException e) {
      throw new InvalidConfigValueException(PREFIX + key, raw, e);
    }
  }
}
