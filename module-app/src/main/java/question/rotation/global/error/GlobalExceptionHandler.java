package question.rotation.global.error;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import question.rotation.error.CommonErrorCode;
import question.rotation.error.ErrorCode;
import question.rotation.error.dto.ErrorResponse;
import question.rotation.error.exception.base.BaseException;
import question.rotation.error.exception.base.ClientBaseException;
import question.rotation.global.response.ApiResponse;

/**
 * 예외 → {@link ApiResponse} 에러 응답 변환
 *
 * <ul>
 *   <li>4xx (ClientBaseException): WARN, 동적 메시지 그대로 노출
 *   <li>5xx (ServerBaseException): ERROR, 동적 메시지 노출 (지역 ID 등 내부 정보 없음)
 *   <li>예측하지 못한 예외: ERROR + 스택 트레이스, 공통 메시지만 노출
 * </ul>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  @ExceptionHandler(BaseException.class)
  protected ResponseEntity<ApiResponse<Void>> handleBaseException(BaseException e) {
    if (e instanceof ClientBaseException) {
      log.warn("[Api] Client error: {} | {}", e.getErrorCode().getCode(), e.getMessage());
    } else {
      log.error("[Api] Server error: {} | {}", e.getErrorCode().getCode(), e.getMessage());
    }
    return toResponse(e.getErrorCode(), ErrorResponse.from(e));
  }

  @ExceptionHandler(Exception.class)
  protected ResponseEntity<ApiResponse<Void>> handleException(Exception e) {
    log.error("[Api] Unexpected failure", e);
    ErrorCode code = CommonErrorCode.INTERNAL_SERVER_ERROR;
    return toResponse(code, ErrorResponse.from(code));
  }

  private static ResponseEntity<ApiResponse<Void>> toResponse(
      ErrorCode code, ErrorResponse body) {
    return ResponseEntity.status(code.getStatus()).body(ApiResponse.error(body));
  }
}
