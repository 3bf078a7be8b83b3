package question.rotation.core.domain.model;

/**
 * (사이클, 지역) → 질문 배정
 *
 * <p>로테이션 중에만 생성되며 이후 변경되지 않습니다. 이력 조회를 위해 영구 보존됩니다.
 */
public record Assignment(Long cycleId, long regionId, Question question) {

  public Assignment {
    if (question == null) {
      throw new IllegalArgumentException("Assignment question cannot be null");
    }
  }
}
