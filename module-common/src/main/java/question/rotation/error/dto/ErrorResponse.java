package question.rotation.error.dto;

import java.time.LocalDateTime;
import question.rotation.error.ErrorCode;
import question.rotation.error.exception.base.BaseException;

public record ErrorResponse(int status, String code, String message, LocalDateTime timestamp) {

  /**
   * BaseException에서 생성 (동적 메시지 포함)
   *
   * <p>e.getMessage()를 통해 가공된 메시지(예: 어떤 지역이 없는지)를 전달합니다.
   */
  public static ErrorResponse from(BaseException e) {
    return new ErrorResponse(
        e.getErrorCode().getStatusCode(),
        e.getErrorCode().getCode(),
        e.getMessage(),
        LocalDateTime.now());
  }

  /**
   * ErrorCode에서 생성 (정적 메시지)
   *
   * <p>ErrorCode Enum에 정의된 기본 메시지를 사용하며, 상세한 에러 내용은 보안을 위해 숨깁니다.
   */
  public static ErrorResponse from(ErrorCode errorCode) {
    return new ErrorResponse(
        errorCode.getStatusCode(), errorCode.getCode(), errorCode.getMessage(), LocalDateTime.now());
  }
}
