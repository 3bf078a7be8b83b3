package question.rotation.core.port.out;

import java.time.Duration;
import java.util.Collection;
import java.util.Optional;
import question.rotation.core.domain.model.QuestionView;

/**
 * 지역 → 현재 질문 조회 캐시 Port
 *
 * <p>파생 데이터이며 언제든 버려질 수 있습니다. 모든 쓰기는 키 값을 통째로 교체합니다 (last-write-wins).
 */
public interface LookupCache {

  Optional<QuestionView> get(long regionId);

  /** TTL이 0 이하이면 쓰지 않습니다. */
  void put(QuestionView view, Duration ttl);

  /** 로테이션 직후 전체 스냅샷 일괄 갱신 */
  void putAll(Collection<QuestionView> views, Duration ttl);
}
