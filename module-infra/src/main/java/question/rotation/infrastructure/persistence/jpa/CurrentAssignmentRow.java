package question.rotation.infrastructure.persistence.jpa;

import java.time.Instant;
import question.rotation.core.domain.model.QuestionView;

/** 활성 사이클 배정 조인 결과 (JPQL constructor expression) */
public record CurrentAssignmentRow(
    Long regionId, Long questionId, String content, Long cycleId, Instant cycleEndsAt) {

  public QuestionView toView() {
    return new QuestionView(regionId, questionId, content, cycleId, cycleEndsAt);
  }
}
