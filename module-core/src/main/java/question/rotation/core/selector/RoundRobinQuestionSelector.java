package question.rotation.core.selector;

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import question.rotation.core.domain.model.Question;
import question.rotation.error.exception.NoEligibleQuestionException;

/**
 * 질문 ID 오름차순 라운드 로빈 선택기
 *
 * <h3>선택 규칙</h3>
 *
 * <ol>
 *   <li>후보 0개: {@link NoEligibleQuestionException}
 *   <li>후보 1개: 항상 그 질문
 *   <li>현재 라운드에서 아직 쓰지 않은 후보 중 직전 배정 ID보다 큰 첫 번째 질문 (없으면 가장 작은 미사용 질문)
 *   <li>라운드 소진 시: 처음부터 다시 시작하되 직전 질문만 건너뜀
 * </ol>
 *
 * <h3>라운드 복원</h3>
 *
 * <p>별도 커서를 저장하지 않고 이력을 앞에서부터 재생하여 현재 라운드를 복원합니다. 재생 중인 질문이 이미 라운드에 있거나 라운드가 풀 전체를
 * 포함하면 새 라운드가 시작됩니다. 더 이상 후보가 아닌 과거 질문은 무시합니다.
 */
public class RoundRobinQuestionSelector implements QuestionSelector {

  private static final Comparator<Question> BY_ID = Comparator.comparingLong(Question::id);

  @Override
  public Question selectNext(long regionId, List<Question> eligible, List<Question> history) {
    if (eligible == null || eligible.isEmpty()) {
      throw new NoEligibleQuestionException(regionId);
    }

    List<Question> pool = eligible.stream().distinct().sorted(BY_ID).toList();
    if (pool.size() == 1) {
      return pool.get(0);
    }

    Long lastId = history.isEmpty() ? null : history.get(history.size() - 1).id();
    Set<Long> usedInRound = replayCurrentRound(pool, history);

    if (usedInRound.size() >= pool.size()) {
      return firstDifferentFrom(pool, lastId);
    }

    List<Question> candidates =
        pool.stream().filter(q -> !usedInRound.contains(q.id())).toList();

    return candidates.stream()
        .filter(q -> lastId == null || q.id() > lastId)
        .findFirst()
        .orElse(candidates.get(0));
  }

  private Set<Long> replayCurrentRound(List<Question> pool, List<Question> history) {
    Set<Long> poolIds = pool.stream().map(Question::id).collect(Collectors.toSet());
    Set<Long> usedInRound = new LinkedHashSet<>();

    for (Question assigned : history) {
      if (!poolIds.contains(assigned.id())) {
        continue;
      }
      if (usedInRound.size() >= pool.size() || usedInRound.contains(assigned.id())) {
        usedInRound.clear();
      }
      usedInRound.add(assigned.id());
    }
    return usedInRound;
  }

  private Question firstDifferentFrom(List<Question> pool, Long lastId) {
    return pool.stream()
        .filter(q -> lastId == null || q.id() != lastId)
        .findFirst()
        .orElse(pool.get(0));
  }
}
