package question.rotation.infrastructure.executor;

import java.util.Objects;

/**
 * 메트릭 카디널리티 통제를 위한 작업 컨텍스트
 *
 * <p>TaskName을 구조화하여 동적 값과 고정 Taxonomy를 분리합니다.
 *
 * <h3>형식</h3>
 *
 * <pre>
 * "component:operation:dynamicValue"
 *
 * 예시:
 * - TaskContext.of("Rotation", "commit", "cycle=42")
 *   → "Rotation:commit:cycle=42"
 * - TaskContext.of("LookupCache", "putAll")
 *   → "LookupCache:putAll"
 * </pre>
 *
 * <h3>메트릭 카디널리티 통제</h3>
 *
 * <ul>
 *   <li>component, operation: 메트릭 태그로 사용 (고정 값)
 *   <li>dynamicValue: 로그에만 기록 (메트릭에서 제외)
 * </ul>
 *
 * @param component 컴포넌트 이름 (예: "Rotation", "Lookup", "Lock")
 * @param operation 작업 유형 (예: "commit", "storeRead", "acquire")
 * @param dynamicValue 동적 값 (예: regionId, cycleId)
 */
public record TaskContext(String component, String operation, String dynamicValue) {
  /** null 파라미터 검증 */
  public TaskContext {
    Objects.requireNonNull(component, "component");
    Objects.requireNonNull(operation, "operation");
    if (dynamicValue == null) {
      dynamicValue = "";
    }
  }

  /**
   * TaskContext 생성 (동적 값 포함)
   *
   * @param component 컴포넌트 이름
   * @param operation 작업 유형
   * @param dynamicValue 동적 값
   * @return TaskContext 인스턴스
   */
  public static TaskContext of(String component, String operation, String dynamicValue) {
    return new TaskContext(component, operation, dynamicValue);
  }

  /** 지역 ID, 사이클 ID처럼 숫자 식별자를 동적 값으로 쓰는 경우 */
  public static TaskContext of(String component, String operation, long id) {
    return new TaskContext(component, operation, String.valueOf(id));
  }

  /**
   * TaskContext 생성 (동적 값 없음)
   *
   * @param component 컴포넌트 이름
   * @param operation 작업 유형
   * @return TaskContext 인스턴스
   */
  public static TaskContext of(String component, String operation) {
    return new TaskContext(component, operation, "");
  }

  /**
   * TaskName 문자열로 변환
   *
   * <p>로그와 InternalSystemException 메시지에 사용됩니다.
   *
   * @return "component:operation:dynamicValue" 형식의 문자열
   */
  public String toTaskName() {
    if (dynamicValue.isEmpty()) {
      return component + ":" + operation;
    }
    return component + ":" + operation + ":" + dynamicValue;
  }
}
