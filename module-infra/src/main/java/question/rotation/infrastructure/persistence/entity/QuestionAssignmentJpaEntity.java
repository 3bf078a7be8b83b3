package question.rotation.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/** (사이클, 지역) → 질문 배정. 생성 후 변경되지 않으며 이력 조회를 위해 보존됩니다. */
@Entity
@Table(
    name = "question_assignment",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uk_assignment_cycle_region",
            columnNames = {"cycle_id", "region_id"}),
    indexes = @Index(name = "idx_assignment_region_cycle", columnList = "region_id, cycle_id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class QuestionAssignmentJpaEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "cycle_id", nullable = false, updatable = false)
  private Long cycleId;

  @Column(name = "region_id", nullable = false, updatable = false)
  private Long regionId;

  @Column(name = "question_id", nullable = false, updatable = false)
  private Long questionId;

  public QuestionAssignmentJpaEntity(Long cycleId, Long regionId, Long questionId) {
    this.cycleId = cycleId;
    this.regionId = regionId;
    this.questionId = questionId;
  }
}
