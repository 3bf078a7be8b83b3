package question.rotation.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * 로테이션 설정
 *
 * <pre>{@code
 * rotation:
 *   early-trigger-tolerance: 0s
 *   scheduler:
 *     enabled: true
 *     retry-delay: 1m
 *     lock-key: "rotation:lock"
 * }</pre>
 *
 * <p>{@code early-trigger-tolerance}가 양수이면 종료 시각보다 그만큼 일찍 들어온 트리거도 교체를 수행합니다. 새 사이클의 start_time은
 * 이전 종료 시각 그대로지만 커밋 즉시 활성화되므로, 조회는 최대 이 값만큼 다음 질문을 일찍 보게 됩니다. 기본값 0은 종료 시각 이전의 트리거를
 * 모두 {@code NOT_DUE}로 돌려보냅니다.
 *
 * <p>사이클 길이({@code rotation.parameters.cycle-duration})는 여기서 바인딩하지 않습니다. 로테이션마다 {@code
 * DurationConfigSource}에서 새로 읽습니다.
 */
@ConfigurationProperties(prefix = "rotation")
public record RotationProperties(
    @DefaultValue("0s") Duration earlyTriggerTolerance, @DefaultValue Scheduler scheduler) {

  public RotationProperties {
    if (earlyTriggerTolerance == null || earlyTriggerTolerance.isNegative()) {
      throw new IllegalArgumentException("rotation.early-trigger-tolerance must not be negative");
    }
  }

  /**
   * @param enabled false이면 스케줄러 트리거를 등록하지 않음
   * @param retryDelay 실패한 시도 이후 재시도까지 대기 시간
   * @param lockKey 인스턴스 간 로테이션 직렬화용 분산 락 키
   */
  public record Scheduler(
      @DefaultValue("true") boolean enabled,
      @DefaultValue("1m") Duration retryDelay,
      @DefaultValue("rotation:lock") String lockKey) {

    public Scheduler {
      if (retryDelay == null || retryDelay.isZero() || retryDelay.isNegative()) {
        throw new IllegalArgumentException("rotation.scheduler.retry-delay must be positive");
      }
      if (lockKey == null || lockKey.isBlank()) {
        throw new IllegalArgumentException("rotation.scheduler.lock-key must not be blank");
      }
    }
  }
}
