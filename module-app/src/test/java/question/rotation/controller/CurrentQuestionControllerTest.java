package question.rotation.controller;

import static org.hamcrest.Matchers.startsWith;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;
import question.rotation.core.domain.model.QuestionView;
import question.rotation.error.exception.NoActiveAssignmentException;
import question.rotation.error.exception.TransientStoreException;
import question.rotation.error.exception.UnknownRegionException;
import question.rotation.global.filter.MDCFilter;
import question.rotation.service.lookup.CurrentQuestionService;

@Tag("unit")
@WebMvcTest(CurrentQuestionController.class)
@DisplayName("GET /api/v1/current-question")
class CurrentQuestionControllerTest {

  private static final String PATH = "/api/v1/current-question";

  @Autowired private MockMvc mockMvc;

  @MockBean private CurrentQuestionService currentQuestionService;

  @Test
  @DisplayName("현재 질문을 snake_case 필드로 ApiResponse에 담아 반환한다")
  void returnsCurrentQuestion() throws Exception {
    given(currentQuestionService.getCurrentQuestion(7L))
        .willReturn(
            new QuestionView(7L, 42L, "좋아하는 계절은?", 3L, Instant.parse("2026-03-02T00:00:00Z")));

    mockMvc
        .perform(get(PATH).param("region", "7"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.data.region_id").value(7))
        .andExpect(jsonPath("$.data.question_id").value(42))
        .andExpect(jsonPath("$.data.content").value("좋아하는 계절은?"))
        .andExpect(jsonPath("$.data.cycle_id").value(3))
        .andExpect(jsonPath("$.error").doesNotExist());
  }

  @Test
  @DisplayName("X-Correlation-ID 헤더를 응답에 그대로 돌려준다")
  void echoesCorrelationId() throws Exception {
    given(currentQuestionService.getCurrentQuestion(1L))
        .willReturn(new QuestionView(1L, 1L, "q", 1L, Instant.parse("2026-03-02T00:00:00Z")));

    mockMvc
        .perform(get(PATH).param("region", "1").header(MDCFilter.CORRELATION_ID_HEADER, "req-1"))
        .andExpect(status().isOk())
        .andExpect(header().string(MDCFilter.CORRELATION_ID_HEADER, "req-1"));
  }

  @Nested
  @DisplayName("클라이언트 오류")
  class ClientErrors {

    @ParameterizedTest
    @ValueSource(strings = {"abc", "0", "-1", "1.5", "99999999999999999999"})
    @DisplayName("형식이 잘못된 지역 ID는 400 C001, 서비스는 호출하지 않는다")
    void malformedRegion(String region) throws Exception {
      mockMvc
          .perform(get(PATH).param("region", region))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.success").value(false))
          .andExpect(jsonPath("$.error.code").value("C001"));
      verifyNoInteractions(currentQuestionService);
    }

    @Test
    @DisplayName("region 파라미터가 없으면 400")
    void missingRegion() throws Exception {
      mockMvc.perform(get(PATH)).andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("존재하지 않는 지역은 404 C002")
    void unknownRegion() throws Exception {
      given(currentQuestionService.getCurrentQuestion(99L))
          .willThrow(new UnknownRegionException(99L));

      mockMvc
          .perform(get(PATH).param("region", "99"))
          .andExpect(status().isNotFound())
          .andExpect(jsonPath("$.error.code").value("C002"))
          .andExpect(jsonPath("$.error.message").value("존재하지 않는 지역입니다 (regionId: 99)"));
    }
  }

  @Nested
  @DisplayName("서버 오류")
  class ServerErrors {

    @Test
    @DisplayName("저장소 일시 장애는 503 S005 (재시도 가능)")
    void transientFailure() throws Exception {
      given(currentQuestionService.getCurrentQuestion(1L))
          .willThrow(new TransientStoreException("Lookup:loadFromStore"));

      mockMvc
          .perform(get(PATH).param("region", "1"))
          .andExpect(status().isServiceUnavailable())
          .andExpect(jsonPath("$.error.code").value("S005"));
    }

    @Test
    @DisplayName("배정 없음은 500 S002")
    void noActiveAssignment() throws Exception {
      given(currentQuestionService.getCurrentQuestion(2L))
          .willThrow(new NoActiveAssignmentException(2L));

      mockMvc
          .perform(get(PATH).param("region", "2"))
          .andExpect(status().isInternalServerError())
          .andExpect(jsonPath("$.error.code").value("S002"));
    }

    @Test
    @DisplayName("예측하지 못한 예외는 500 S001과 공통 메시지만 노출한다")
    void unexpectedFailure() throws Exception {
      given(currentQuestionService.getCurrentQuestion(3L))
          .willThrow(new IllegalStateException("secret internals"));

      mockMvc
          .perform(get(PATH).param("region", "3"))
          .andExpect(status().isInternalServerError())
          .andExpect(jsonPath("$.error.code").value("S001"))
          .andExpect(jsonPath("$.error.message").value(startsWith("서버 내부 오류")));
    }
  }
}
