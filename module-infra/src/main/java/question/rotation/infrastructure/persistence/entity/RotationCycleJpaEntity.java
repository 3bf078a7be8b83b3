package question.rotation.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import question.rotation.core.domain.model.Cycle;

/**
 * 로테이션 사이클
 *
 * <p>{@code active_slot}은 활성 사이클이면 1, 아니면 NULL입니다. 유니크 인덱스가 NULL 중복은 허용하므로 DB 차원에서 활성 사이클이 2개가
 * 되는 것을 막습니다 (부트스트랩 동시 커밋 방지).
 */
@Entity
@Table(
    name = "rotation_cycle",
    uniqueConstraints =
        @UniqueConstraint(
            name = RotationCycleJpaEntity.ACTIVE_SLOT_CONSTRAINT,
            columnNames = {"active_slot"}))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class RotationCycleJpaEntity {

  public static final int ACTIVE_SLOT = 1;

  /** 마이그레이션(V1)의 인덱스 이름과 같아야 합니다. */
  public static final String ACTIVE_SLOT_CONSTRAINT = "uk_rotation_cycle_active_slot";

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "start_time", nullable = false, columnDefinition = "DATETIME(6)")
  private Instant startTime;

  @Column(name = "end_time", nullable = false, columnDefinition = "DATETIME(6)")
  private Instant endTime;

  @Column(nullable = false)
  private boolean active;

  @Column(name = "active_slot")
  private Integer activeSlot;

  public Cycle toDomain() {
    return new Cycle(id, startTime, endTime, active);
  }

  /** 신규 사이클은 항상 활성 상태로 생성됩니다. */
  public static RotationCycleJpaEntity openFrom(Cycle domain) {
    if (domain == null) {
      throw new IllegalArgumentException("Cycle cannot be null");
    }
    RotationCycleJpaEntity entity = new RotationCycleJpaEntity();
    entity.startTime = domain.startTime();
    entity.endTime = domain.endTime();
    entity.active = true;
    entity.activeSlot = ACTIVE_SLOT;
    return entity;
  }
}
