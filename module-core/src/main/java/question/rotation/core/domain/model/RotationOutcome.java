package question.rotation.core.domain.model;

/** 로테이션 시도 결과 유형 */
public enum RotationOutcome {
  /** 새 사이클 커밋 완료 */
  ROTATED,
  /** 다른 시도가 먼저 커밋함 (조건부 커밋 실패) */
  CONFLICT,
  /** 활성 사이클이 아직 충분히 남아 있어 아무것도 하지 않음 */
  NOT_DUE
}
