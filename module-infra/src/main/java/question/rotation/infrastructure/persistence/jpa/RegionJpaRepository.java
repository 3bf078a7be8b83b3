package question.rotation.infrastructure.persistence.jpa;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import question.rotation.infrastructure.persistence.entity.RegionJpaEntity;

public interface RegionJpaRepository extends JpaRepository<RegionJpaEntity, Long> {

  List<RegionJpaEntity> findAllByOrderByIdAsc();
}
