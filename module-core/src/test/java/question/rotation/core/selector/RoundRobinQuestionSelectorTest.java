package question.rotation.core.selector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import question.rotation.core.domain.model.Question;
import question.rotation.error.exception.NoEligibleQuestionException;

@Tag("unit")
@DisplayName("RoundRobinQuestionSelector 단위 테스트")
class RoundRobinQuestionSelectorTest {

  private static final long REGION = 1L;

  private static final Question Q1 = new Question(1L, "q1");
  private static final Question Q2 = new Question(2L, "q2");
  private static final Question Q3 = new Question(3L, "q3");
  private static final Question Q4 = new Question(4L, "q4");

  private final RoundRobinQuestionSelector selector = new RoundRobinQuestionSelector();

  @Nested
  @DisplayName("기본 순환")
  class BasicRotation {

    @Test
    @DisplayName("후보 {Q1,Q2,Q3}로 네 번 연속 로테이션하면 Q1, Q2, Q3, Q1 순서로 배정된다")
    void fourCycles() {
      List<Question> pool = List.of(Q3, Q1, Q2);

      List<Question> assigned = simulate(pool, 5);

      assertThat(assigned).containsExactly(Q1, Q2, Q3, Q1, Q2);
    }

    @Test
    @DisplayName("이력이 없으면 가장 작은 ID의 질문을 고른다")
    void firstSelection() {
      assertThat(selector.selectNext(REGION, List.of(Q2, Q3), List.of())).isEqualTo(Q2);
    }

    @Test
    @DisplayName("직전 질문보다 큰 ID의 미사용 질문이 없으면 가장 작은 미사용 질문으로 감긴다")
    void wrapsWithinRound() {
      // Q3만 단독으로 배정된 상태에서 Q1이 새로 후보로 추가됨
      List<Question> history = List.of(Q3);

      assertThat(selector.selectNext(REGION, List.of(Q1, Q2, Q3), history)).isEqualTo(Q1);
    }
  }

  @Nested
  @DisplayName("경계 조건")
  class EdgeCases {

    @Test
    @DisplayName("후보가 없으면 NoEligibleQuestionException")
    void emptyPool() {
      assertThatThrownBy(() -> selector.selectNext(REGION, List.of(), List.of(Q1)))
          .isInstanceOf(NoEligibleQuestionException.class)
          .hasMessageContaining(String.valueOf(REGION));
    }

    @Test
    @DisplayName("후보가 1개면 직전과 같아도 항상 그 질문")
    void singletonPool() {
      assertThat(selector.selectNext(REGION, List.of(Q1), List.of(Q1, Q1))).isEqualTo(Q1);
    }

    @Test
    @DisplayName("더 이상 후보가 아닌 과거 질문은 라운드 복원에서 무시된다")
    void ignoresRetiredQuestions() {
      List<Question> history = List.of(Q1, Q4, Q2);

      assertThat(selector.selectNext(REGION, List.of(Q1, Q2, Q3), history)).isEqualTo(Q3);
    }

    @Test
    @DisplayName("라운드 소진 후에는 직전 질문만 건너뛰고 처음부터 다시 시작한다")
    void exhaustedSkipsOnlyPrevious() {
      // 라운드 {Q2, Q3, Q1} 소진, 직전 = Q1 → Q1을 건너뛰고 Q2
      List<Question> history = List.of(Q2, Q3, Q1);

      assertThat(selector.selectNext(REGION, List.of(Q1, Q2, Q3), history)).isEqualTo(Q2);
    }

    @Test
    @DisplayName("같은 입력이면 항상 같은 결과 (영속 이력의 순수 함수)")
    void deterministic() {
      List<Question> pool = List.of(Q1, Q2, Q3, Q4);
      List<Question> history = List.of(Q1, Q3);

      Question first = selector.selectNext(REGION, pool, history);
      Question second = selector.selectNext(REGION, List.of(Q4, Q3, Q2, Q1), history);

      assertThat(first).isEqualTo(second).isEqualTo(Q4);
    }
  }

  private List<Question> simulate(List<Question> pool, int cycles) {
    List<Question> history = new ArrayList<>();
    for (int i = 0; i < cycles; i++) {
      history.add(selector.selectNext(REGION, pool, history));
    }
    return history;
  }
}
