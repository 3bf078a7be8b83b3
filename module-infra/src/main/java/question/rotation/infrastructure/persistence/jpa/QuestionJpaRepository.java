package question.rotation.infrastructure.persistence.jpa;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import question.rotation.infrastructure.persistence.entity.QuestionJpaEntity;

/**
 * 질문 조회용 내부 Repository
 *
 * @see question.rotation.infrastructure.persistence.repository.JpaAssignmentStore
 */
public interface QuestionJpaRepository extends JpaRepository<QuestionJpaEntity, Long> {

  /** 지역 후보 풀 (질문 ID 오름차순) */
  @Query(
      """
      select q from QuestionJpaEntity q
      where q.id in (
        select e.questionId from RegionQuestionEligibilityJpaEntity e where e.regionId = :regionId)
      order by q.id asc
      """)
  List<QuestionJpaEntity> findEligibleByRegionId(@Param("regionId") Long regionId);

  /** 지역 배정 이력 (사이클 ID 오름차순 = 오래된 것 → 최신) */
  @Query(
      """
      select q from QuestionAssignmentJpaEntity a
      join QuestionJpaEntity q on q.id = a.questionId
      where a.regionId = :regionId
      order by a.cycleId asc
      """)
  List<QuestionJpaEntity> findAssignmentHistoryByRegionId(@Param("regionId") Long regionId);
}
