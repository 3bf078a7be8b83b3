package question.rotation.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.BindException;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

@Tag("unit")
@DisplayName("RotationProperties 바인딩 테스트")
class RotationPropertiesTest {

  @Test
  @DisplayName("설정이 없으면 조기 트리거 허용 오차는 0, 재시도 간격은 1분")
  void defaults() {
    RotationProperties properties = bind(Map.of());

    assertThat(properties.earlyTriggerTolerance()).isZero();
    assertThat(properties.scheduler().enabled()).isTrue();
    assertThat(properties.scheduler().retryDelay()).isEqualTo(Duration.ofMinutes(1));
    assertThat(properties.scheduler().lockKey()).isEqualTo("rotation:lock");
  }

  @Test
  @DisplayName("허용 오차는 명시하면 그 값을 쓴다")
  void explicitTolerance() {
    assertThat(bind(Map.of("rotation.early-trigger-tolerance", "30s")).earlyTriggerTolerance())
        .isEqualTo(Duration.ofSeconds(30));
  }

  @Test
  @DisplayName("음수 허용 오차는 거부한다")
  void negativeToleranceRejected() {
    assertThatThrownBy(() -> bind(Map.of("rotation.early-trigger-tolerance", "-1s")))
        .isInstanceOf(BindException.class);
  }

  private static RotationProperties bind(Map<String, String> source) {
    return new Binder(new MapConfigurationPropertySource(source))
        .bindOrCreate("rotation", RotationProperties.class);
  }
}
