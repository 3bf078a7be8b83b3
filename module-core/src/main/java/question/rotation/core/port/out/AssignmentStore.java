package question.rotation.core.port.out;

import java.util.List;
import java.util.Optional;
import question.rotation.core.domain.model.Assignment;
import question.rotation.core.domain.model.Cycle;
import question.rotation.core.domain.model.Question;
import question.rotation.core.domain.model.QuestionView;
import question.rotation.core.domain.model.Region;

/**
 * 배정 저장소 Port
 *
 * <p>지역, 질문, 후보 관계, 사이클, 배정의 권위 있는 저장소입니다. module-infra의 JPA 어댑터가 구현합니다.
 *
 * <p>저장소 I/O 장애는 {@code TransientStoreException}으로 표면화되어야 하며 "데이터 없음"으로 위장해서는 안 됩니다.
 */
public interface AssignmentStore {

  /** 현재 활성 사이클 (부트스트랩 전에는 empty) */
  Optional<Cycle> findActiveCycle();

  /** 모든 지역 (ID 오름차순) */
  List<Region> findAllRegions();

  boolean regionExists(long regionId);

  /** 지역의 후보 질문 풀 (질문 ID 오름차순) */
  List<Question> findEligibleQuestions(long regionId);

  /**
   * 지역에 과거 배정된 질문 이력
   *
   * @return 오래된 것 → 최신 순서 (사이클 ID 오름차순)
   */
  List<Question> findAssignmentHistory(long regionId);

  /** 활성 사이클에 조인된 지역의 현재 배정 */
  Optional<QuestionView> findCurrentAssignment(long regionId);

  /**
   * 사이클 교체를 원자적으로 커밋합니다.
   *
   * <p>기존 활성 사이클 비활성화, 신규 사이클 삽입, 모든 배정 삽입이 하나의 트랜잭션에서 수행됩니다 (all or nothing).
   *
   * @param expectedActiveCycleId 커밋 시점에 활성이어야 하는 사이클 ID (부트스트랩이면 null)
   * @param newCycle 저장할 신규 사이클 (id 미할당)
   * @param assignments 신규 사이클의 배정 (cycleId 미할당)
   * @return ID가 할당된 신규 사이클
   * @throws question.rotation.error.exception.RotationConflictException 기대한 활성 사이클이 이미 교체된 경우
   */
  Cycle commitRotation(Long expectedActiveCycleId, Cycle newCycle, List<Assignment> assignments);
}
