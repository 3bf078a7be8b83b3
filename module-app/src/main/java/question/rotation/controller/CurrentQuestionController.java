package question.rotation.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import question.rotation.controller.dto.CurrentQuestionResponse;
import question.rotation.error.exception.InvalidRegionIdException;
import question.rotation.global.response.ApiResponse;
import question.rotation.service.lookup.CurrentQuestionService;

/**
 * 현재 질문 조회 API
 *
 * <p>GET /api/v1/current-question?region={regionId}
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class CurrentQuestionController {

  private final CurrentQuestionService currentQuestionService;

  @GetMapping("/current-question")
  public ResponseEntity<ApiResponse<CurrentQuestionResponse>> getCurrentQuestion(
      @RequestParam(name = "region", required = false) String region) {
    long regionId = parseRegionId(region);
    return ResponseEntity.ok(
        ApiResponse.success(
            CurrentQuestionResponse.from(currentQuestionService.getCurrentQuestion(regionId))));
  }

  /** 양의 정수만 허용 */
  private static long parseRegionId(String raw) {
    if (raw == null || raw.isBlank() || !raw.chars().allMatch(Character::isDigit)) {
      throw new InvalidRegionIdException(raw);
    }
    long regionId;
    try {
      regionId = Long.parseLong(raw);
    } catch (NumberFormatException e) {
      throw new InvalidRegionIdException(raw);
    }
    if (regionId <= 0) {
      throw new InvalidRegionIdException(raw);
    }
    return regionId;
  }
}
