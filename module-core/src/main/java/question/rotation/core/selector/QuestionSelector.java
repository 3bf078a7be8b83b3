package question.rotation.core.selector;

import java.util.List;
import question.rotation.core.domain.model.Question;

/**
 * 지역별 다음 질문 선택 전략
 *
 * <p>구현체는 영속된 이력만으로 결과가 결정되는 순수 함수여야 합니다. 프로세스 재시작, 인스턴스 교체와 무관하게 같은 입력이면 같은 질문을 선택합니다.
 */
public interface QuestionSelector {

  /**
   * @param regionId 대상 지역 ID (오류 메시지용)
   * @param eligible 지역의 후보 질문 풀
   * @param history 지역에 과거 배정된 질문 (오래된 것 → 최신)
   * @return 다음 사이클에 배정할 질문
   * @throws question.rotation.error.exception.NoEligibleQuestionException 후보가 0개일 때
   */
  Question selectNext(long regionId, List<Question> eligible, List<Question> history);
}
