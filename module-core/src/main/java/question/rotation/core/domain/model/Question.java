package question.rotation.core.domain.model;

/**
 * 질문 도메인 모델
 *
 * <p>배정에 한 번이라도 참조된 질문은 변경되지 않습니다.
 *
 * @param id 질문 ID (라운드 로빈 정렬 기준)
 * @param content 질문 본문
 */
public record Question(long id, String content) {

  public Question {
    if (content == null) {
      throw new IllegalArgumentException("Question content cannot be null");
    }
  }
}
