package question.rotation.global.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import question.rotation.error.dto.ErrorResponse;

/**
 * API 공통 응답 포맷
 *
 * @param success 성공 여부
 * @param data 응답 데이터 (성공 시)
 * @param error 에러 정보 (실패 시)
 * @param <T> 응답 데이터 타입
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(boolean success, T data, ErrorResponse error) {

  public static <T> ApiResponse<T> success(T data) {
    return new ApiResponse<>(true, data, null);
  }

  public static <T> ApiResponse<T> error(ErrorResponse error) {
    return new ApiResponse<>(false, null, error);
  }
}
