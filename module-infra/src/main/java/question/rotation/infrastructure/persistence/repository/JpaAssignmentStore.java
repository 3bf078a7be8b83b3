package question.rotation.infrastructure.persistence.repository;

import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import question.rotation.core.domain.model.Assignment;
import question.rotation.core.domain.model.Cycle;
import question.rotation.core.domain.model.Question;
import question.rotation.core.domain.model.QuestionView;
import question.rotation.core.domain.model.Region;
import question.rotation.core.port.out.AssignmentStore;
import question.rotation.error.exception.RotationConflictException;
import question.rotation.infrastructure.persistence.entity.QuestionAssignmentJpaEntity;
import question.rotation.infrastructure.persistence.entity.QuestionJpaEntity;
import question.rotation.infrastructure.persistence.entity.RegionJpaEntity;
import question.rotation.infrastructure.persistence.entity.RotationCycleJpaEntity;
import question.rotation.infrastructure.persistence.jpa.CurrentAssignmentRow;
import question.rotation.infrastructure.persistence.jpa.QuestionAssignmentJpaRepository;
import question.rotation.infrastructure.persistence.jpa.QuestionJpaRepository;
import question.rotation.infrastructure.persistence.jpa.RegionJpaRepository;
import question.rotation.infrastructure.persistence.jpa.RotationCycleJpaRepository;

/**
 * {@link AssignmentStore} JPA 구현체
 *
 * <p>JPA 엔티티와 도메인 모델 사이의 매핑을 담당합니다. 읽기는 readOnly 트랜잭션, {@link #commitRotation}만 쓰기 트랜잭션입니다.
 *
 * <h3>조건부 커밋</h3>
 *
 * <ul>
 *   <li>교체: {@code UPDATE ... WHERE id = :expected AND active = true}가 정확히 1행이어야 함
 *   <li>부트스트랩: 활성 사이클이 없어야 하며, 동시 부트스트랩은 {@code active_slot} 유니크 인덱스 위반으로 실패
 * </ul>
 *
 * <p>유니크 인덱스 위반({@code DataIntegrityViolationException})은 호출부가 {@code
 * ExceptionTranslator.forRotationCommit}으로 RotationConflictException으로 변환합니다.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaAssignmentStore implements AssignmentStore {

  private final RegionJpaRepository regionRepository;
  private final QuestionJpaRepository questionRepository;
  private final RotationCycleJpaRepository cycleRepository;
  private final QuestionAssignmentJpaRepository assignmentRepository;

  @Override
  public Optional<Cycle> findActiveCycle() {
    return cycleRepository.findByActiveTrue().map(RotationCycleJpaEntity::toDomain);
  }

  @Override
  public List<Region> findAllRegions() {
    return regionRepository.findAllByOrderByIdAsc().stream()
        .map(RegionJpaEntity::toDomain)
        .toList();
  }

  @Override
  public boolean regionExists(long regionId) {
    return regionRepository.existsById(regionId);
  }

  @Override
  public List<Question> findEligibleQuestions(long regionId) {
    return questionRepository.findEligibleByRegionId(regionId).stream()
        .map(QuestionJpaEntity::toDomain)
        .toList();
  }

  @Override
  public List<Question> findAssignmentHistory(long regionId) {
    return questionRepository.findAssignmentHistoryByRegionId(regionId).stream()
        .map(QuestionJpaEntity::toDomain)
        .toList();
  }

  @Override
  public Optional<QuestionView> findCurrentAssignment(long regionId) {
    return assignmentRepository.findCurrentByRegionId(regionId).map(CurrentAssignmentRow::toView);
  }

  @Override
  @Transactional
  public Cycle commitRotation(
      Long expectedActiveCycleId, Cycle newCycle, List<Assignment> assignments) {
    deactivateExpected(expectedActiveCycleId);

    RotationCycleJpaEntity saved =
        cycleRepository.saveAndFlush(RotationCycleJpaEntity.openFrom(newCycle));

    List<QuestionAssignmentJpaEntity> rows =
        assignments.stream()
            .map(
                a ->
                    new QuestionAssignmentJpaEntity(
                        saved.getId(), a.regionId(), a.question().id()))
            .toList();
    assignmentRepository.saveAllAndFlush(rows);

    log.info(
        "[AssignmentStore] Rotation committed: previous={}, new={}, assignments={}",
        expectedActiveCycleId,
        saved.getId(),
        rows.size());
    return saved.toDomain();
  }

  private void deactivateExpected(Long expectedActiveCycleId) {
    if (expectedActiveCycleId == null) {
      if (cycleRepository.existsByActiveTrue()) {
        throw new RotationConflictException(null);
      }
      return;
    }
    int updated = cycleRepository.deactivateIfActive(expectedActiveCycleId);
    if (updated != 1) {
      throw new RotationConflictException(expectedActiveCycleId);
    }
  }
}
