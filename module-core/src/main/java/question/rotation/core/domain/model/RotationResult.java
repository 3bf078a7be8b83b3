package question.rotation.core.domain.model;

import java.time.Instant;

/**
 * 로테이션 실행 결과
 *
 * @param outcome 결과 유형
 * @param cycleId 새 사이클 ID (ROTATED 외에는 null)
 * @param startTime 새 사이클 시작 시각 (ROTATED 외에는 null)
 * @param endTime 새 사이클 종료 시각 (NOT_DUE이면 현재 활성 사이클의 종료 시각, CONFLICT이면 null)
 * @param previousCycleId 교체 대상이었던 활성 사이클 ID (부트스트랩이면 null)
 * @param assignmentCount 배정된 지역 수
 * @param cachePushed 커밋 후 캐시 일괄 갱신 성공 여부
 */
public record RotationResult(
    RotationOutcome outcome,
    Long cycleId,
    Instant startTime,
    Instant endTime,
    Long previousCycleId,
    int assignmentCount,
    boolean cachePushed) {

  public static RotationResult rotated(
      Cycle committed, Long previousCycleId, int assignmentCount, boolean cachePushed) {
    return new RotationResult(
        RotationOutcome.ROTATED,
        committed.id(),
        committed.startTime(),
        committed.endTime(),
        previousCycleId,
        assignmentCount,
        cachePushed);
  }

  public static RotationResult conflict(Long previousCycleId) {
    return new RotationResult(
        RotationOutcome.CONFLICT, null, null, null, previousCycleId, 0, false);
  }

  public static RotationResult notDue(Cycle active) {
    return new RotationResult(
        RotationOutcome.NOT_DUE, null, null, active.endTime(), active.id(), 0, false);
  }

  public boolean isRotated() {
    return outcome == RotationOutcome.ROTATED;
  }
}
