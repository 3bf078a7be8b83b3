package question.rotation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import question.rotation.core.domain.model.RotationOutcome;
import question.rotation.core.domain.model.RotationResult;
import question.rotation.core.port.out.LookupCache;
import question.rotation.service.rotation.RotationEngine;

/**
 * MySQL + Redis 위에서 로테이션 → 조회 전체 흐름 검증
 *
 * <p>스케줄러는 끄고 엔진을 직접 호출합니다.
 */
@Tag("integration")
@SpringBootTest(
    properties = {
      "spring.jpa.hibernate.ddl-auto=validate",
      "rotation.scheduler.enabled=false",
      "lookup.cache.l1-max-ttl=0s"
    })
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("로테이션/조회 통합 테스트")
class QuestionRotationIntegrationTest {

  @Container static final MySQLContainer<?> MYSQL = new MySQLContainer<>("mysql:8.0");

  @Container
  static final GenericContainer<?> REDIS =
      new GenericContainer<>("redis:7-alpine").withExposedPorts(6379);

  @DynamicPropertySource
  static void props(DynamicPropertyRegistry registry) {
    registry.add("spring.datasource.url", MYSQL::getJdbcUrl);
    registry.add("spring.datasource.username", MYSQL::getUsername);
    registry.add("spring.datasource.password", MYSQL::getPassword);
    registry.add("spring.data.redis.host", REDIS::getHost);
    registry.add("spring.data.redis.port", () -> REDIS.getMappedPort(6379).toString());
  }

  @Autowired private MockMvc mockMvc;
  @Autowired private RotationEngine rotationEngine;
  @Autowired private LookupCache lookupCache;
  @Autowired private RedissonClient redissonClient;
  @Autowired private JdbcTemplate jdbcTemplate;

  @BeforeEach
  void seed() {
    redissonClient.getKeys().flushdb();
    jdbcTemplate.update("delete from question_assignment");
    jdbcTemplate.update("delete from rotation_cycle");
    jdbcTemplate.update("delete from region_question_eligibility");
    jdbcTemplate.update("delete from question");
    jdbcTemplate.update("delete from region");

    jdbcTemplate.update("insert into region (id, name) values (1, 'R1')");
    jdbcTemplate.update("insert into question (id, content) values (1, 'Q1'), (2, 'Q2')");
    jdbcTemplate.update(
        "insert into region_question_eligibility (region_id, question_id) values (1, 1), (1, 2)");
  }

  @Test
  @DisplayName("부트스트랩 로테이션 직후 조회는 캐시에서 Q1을 반환한다")
  void bootstrapThenLookup() throws Exception {
    RotationResult result = rotationEngine.rotate();

    assertThat(result.outcome()).isEqualTo(RotationOutcome.ROTATED);
    assertThat(result.cachePushed()).isTrue();
    assertThat(lookupCache.get(1L)).isPresent();

    mockMvc
        .perform(get("/api/v1/current-question").param("region", "1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data.question_id").value(1))
        .andExpect(jsonPath("$.data.cycle_id").value(result.cycleId().intValue()));
  }

  @Test
  @DisplayName("캐시가 비어 있으면 저장소에서 읽어 다시 채운다")
  void lookupRefillsCacheFromStore() throws Exception {
    rotationEngine.rotate();
    redissonClient.getKeys().flushdb();

    mockMvc
        .perform(get("/api/v1/current-question").param("region", "1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data.content").value("Q1"));

    assertThat(redissonClient.getKeys().countExists("lookup:region:1")).isEqualTo(1);
  }

  @Test
  @DisplayName("같은 사이클 안의 두 번째 트리거는 NOT_DUE")
  void secondTriggerIsNotDue() {
    rotationEngine.rotate();

    assertThat(rotationEngine.rotate().outcome()).isEqualTo(RotationOutcome.NOT_DUE);
  }

  @Test
  @DisplayName("존재하지 않는 지역은 404")
  void unknownRegion() throws Exception {
    rotationEngine.rotate();

    mockMvc
        .perform(get("/api/v1/current-question").param("region", "404"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error.code").value("C002"));
  }
}
