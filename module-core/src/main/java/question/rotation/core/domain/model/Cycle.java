package question.rotation.core.domain.model;

import java.time.Duration;
import java.time.Instant;

/**
 * 로테이션 사이클
 *
 * <p>시스템 전체에서 동시에 활성 상태인 사이클은 최대 1개입니다. 비활성화만 될 뿐 삭제되지 않습니다.
 *
 * @param id 사이클 ID (신규 생성 전에는 null)
 * @param startTime 시작 시각 (포함)
 * @param endTime 종료 시각 (배타)
 * @param active 활성 여부
 */
public record Cycle(Long id, Instant startTime, Instant endTime, boolean active) {

  public Cycle {
    if (startTime == null || endTime == null) {
      throw new IllegalArgumentException("Cycle bounds cannot be null");
    }
    if (!endTime.isAfter(startTime)) {
      throw new IllegalArgumentException(
          "Cycle endTime must be after startTime: " + startTime + " ~ " + endTime);
    }
  }

  /** 아직 저장되지 않은 신규 활성 사이클 */
  public static Cycle open(Instant startTime, Duration duration) {
    return new Cycle(null, startTime, startTime.plus(duration), true);
  }

  /** 사이클 종료까지 남은 시간 (이미 지났으면 0 이하) */
  public Duration remaining(Instant now) {
    return Duration.between(now, endTime);
  }

  /**
   * 로테이션 대상 여부
   *
   * <p>tolerance가 양수이면 다음 사이클이 자신의 시작 시각보다 최대 tolerance만큼 먼저 활성화될 수 있습니다.
   *
   * @param tolerance 종료 전 허용 오차. 남은 시간이 이 값 이하이면 교체 대상
   */
  public boolean isDue(Instant now, Duration tolerance) {
    return remaining(now).compareTo(tolerance) <= 0;
  }

  public Cycle withId(long newId) {
    return new Cycle(newId, startTime, endTime, active);
  }
}
