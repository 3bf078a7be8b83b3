package question.rotation.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/** 지역별 후보 질문 풀 (지역, 질문) 쌍 */
@Entity
@Table(
    name = "region_question_eligibility",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uk_region_question",
            columnNames = {"region_id", "question_id"}))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class RegionQuestionEligibilityJpaEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "region_id", nullable = false)
  private Long regionId;

  @Column(name = "question_id", nullable = false)
  private Long questionId;

  public RegionQuestionEligibilityJpaEntity(Long regionId, Long questionId) {
    this.regionId = regionId;
    this.questionId = questionId;
  }
}
