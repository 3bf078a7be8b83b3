package question.rotation.core.domain.model;

import java.time.Instant;

/**
 * 조회 응답/캐시 값으로 쓰이는 현재 질문 스냅샷
 *
 * @param regionId 지역 ID
 * @param questionId 질문 ID
 * @param content 질문 본문
 * @param cycleId 배정이 속한 사이클 ID
 * @param cycleEndsAt 사이클 종료 시각 (캐시 TTL 산정 기준)
 */
public record QuestionView(
    long regionId, long questionId, String content, long cycleId, Instant cycleEndsAt) {

  public static QuestionView of(Assignment assignment, Cycle cycle) {
    return new QuestionView(
        assignment.regionId(),
        assignment.question().id(),
        assignment.question().content(),
        cycle.id(),
        cycle.endTime());
  }
}
