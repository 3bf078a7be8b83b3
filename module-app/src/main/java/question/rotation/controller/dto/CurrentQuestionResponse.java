package question.rotation.controller.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import question.rotation.core.domain.model.QuestionView;

/** 현재 질문 응답 (snake_case) */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CurrentQuestionResponse(
    long regionId, long questionId, String content, long cycleId) {

  public static CurrentQuestionResponse from(QuestionView view) {
    return new CurrentQuestionResponse(
        view.regionId(), view.questionId(), view.content(), view.cycleId());
  }
}
