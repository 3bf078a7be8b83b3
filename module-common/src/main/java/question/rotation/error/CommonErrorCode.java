package question.rotation.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 공통 에러 코드
 *
 * <ul>
 *   <li>C0xx: 클라이언트 오류 (재시도 무의미)
 *   <li>S0xx: 서버 오류 (S005만 재시도 가능)
 *   <li>R0xx: 로테이션 오류 (다음 tick에서 재시도)
 * </ul>
 */
@Getter
@AllArgsConstructor
public enum CommonErrorCode implements ErrorCode {
  // === Client Errors (4xx) ===
  INVALID_INPUT_VALUE("C001", "잘못된 입력값입니다: %s", HttpStatus.BAD_REQUEST),
  UNKNOWN_REGION("C002", "존재하지 않는 지역입니다 (regionId: %s)", HttpStatus.NOT_FOUND),

  // === Server Errors (5xx) ===
  INTERNAL_SERVER_ERROR("S001", "서버 내부 오류가 발생했습니다.", HttpStatus.INTERNAL_SERVER_ERROR),
  NO_ACTIVE_ASSIGNMENT(
      "S002", "활성 사이클에 지역 배정이 없습니다 (regionId: %s)", HttpStatus.INTERNAL_SERVER_ERROR),
  CONFIG_MISSING("S003", "필수 설정값이 없습니다 (key: %s)", HttpStatus.INTERNAL_SERVER_ERROR),
  CONFIG_INVALID("S004", "설정값 형식이 올바르지 않습니다 (key: %s, value: %s)", HttpStatus.INTERNAL_SERVER_ERROR),
  TRANSIENT_STORE_FAILURE(
      "S005", "저장소 일시 장애입니다. 잠시 후 다시 시도해주세요 (%s)", HttpStatus.SERVICE_UNAVAILABLE),

  // === Rotation Errors ===
  NO_ELIGIBLE_QUESTION(
      "R001", "지역에 배정 가능한 질문이 없습니다 (regionId: %s)", HttpStatus.INTERNAL_SERVER_ERROR),
  ROTATION_CONFLICT("R002", "다른 로테이션이 이미 커밋되었습니다 (expectedCycleId: %s)", HttpStatus.CONFLICT);

  private final String code;
  private final String message;
  private final HttpStatus status;
}
