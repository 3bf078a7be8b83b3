package question.rotation.infrastructure.persistence.jpa;

import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import question.rotation.infrastructure.persistence.entity.QuestionAssignmentJpaEntity;

public interface QuestionAssignmentJpaRepository
    extends JpaRepository<QuestionAssignmentJpaEntity, Long> {

  /** 활성 사이클에 조인된 지역의 현재 배정 */
  @Query(
      """
      select new question.rotation.infrastructure.persistence.jpa.CurrentAssignmentRow(
        a.regionId, q.id, q.content, c.id, c.endTime)
      from QuestionAssignmentJpaEntity a
      join RotationCycleJpaEntity c on c.id = a.cycleId
      join QuestionJpaEntity q on q.id = a.questionId
      where a.regionId = :regionId and c.active = true
      """)
  Optional<CurrentAssignmentRow> findCurrentByRegionId(@Param("regionId") Long regionId);

  long countByCycleId(Long cycleId);
}
