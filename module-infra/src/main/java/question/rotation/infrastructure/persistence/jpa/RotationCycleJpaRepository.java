package question.rotation.infrastructure.persistence.jpa;

import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import question.rotation.infrastructure.persistence.entity.RotationCycleJpaEntity;

public interface RotationCycleJpaRepository extends JpaRepository<RotationCycleJpaEntity, Long> {

  Optional<RotationCycleJpaEntity> findByActiveTrue();

  boolean existsByActiveTrue();

  /**
   * 조건부 비활성화 (CAS)
   *
   * @return 영향받은 행 수. 1이 아니면 다른 로테이션이 이미 교체한 것
   */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      """
      update RotationCycleJpaEntity c
      set c.active = false, c.activeSlot = null
      where c.id = :id and c.active = true
      """)
  int deactivateIfActive(@Param("id") Long id);
}
