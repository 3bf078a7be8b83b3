package question.rotation.service.rotation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import question.rotation.config.RotationProperties;
import question.rotation.core.domain.model.Cycle;
import question.rotation.core.domain.model.QuestionView;
import question.rotation.core.domain.model.RotationOutcome;
import question.rotation.core.domain.model.RotationResult;
import question.rotation.core.selector.RoundRobinQuestionSelector;
import question.rotation.error.exception.ConfigMissingException;
import question.rotation.error.exception.NoEligibleQuestionException;
import question.rotation.support.InMemoryAssignmentStore;
import question.rotation.support.InMemoryLookupCache;
import question.rotation.support.MutableClock;
import question.rotation.support.TestLogicExecutors;

@Tag("unit")
@DisplayName("RotationEngine 테스트")
class RotationEngineTest {

  private static final Instant T0 = Instant.parse("2026-03-01T00:00:00Z");
  private static final Duration DAY = Duration.ofHours(24);

  private MutableClock clock;
  private InMemoryAssignmentStore store;
  private InMemoryLookupCache cache;
  private AtomicReference<Duration> cycleDuration;
  private SimpleMeterRegistry meterRegistry;
  private RotationEngine engine;
  private ExecutorService pool;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(T0);
    store =
        new InMemoryAssignmentStore()
            .region(1L, "R1")
            .question(1L, "Q1")
            .question(2L, "Q2")
            .question(3L, "Q3")
            .eligible(1L, 1L, 2L, 3L);
    cache = new InMemoryLookupCache(clock);
    cycleDuration = new AtomicReference<>(DAY);
    meterRegistry = new SimpleMeterRegistry();
    engine = newEngine();
  }

  @AfterEach
  void tearDown() {
    if (pool != null) {
      pool.shutdownNow();
    }
  }

  private RotationEngine newEngine() {
    return newEngine(Duration.ofMinutes(1));
  }

  private RotationEngine newEngine(Duration earlyTriggerTolerance) {
    return new RotationEngine(
        store,
        new RoundRobinQuestionSelector(),
        cache,
        key -> {
          Duration value = cycleDuration.get();
          if (value == null) {
            throw new ConfigMissingException(key);
          }
          return value;
        },
        TestLogicExecutors.real(),
        new RotationProperties(
            earlyTriggerTolerance,
            new RotationProperties.Scheduler(true, Duration.ofMinutes(1), "rotation:lock")),
        new RotationMetrics(meterRegistry),
        clock);
  }

  @Nested
  @DisplayName("정상 로테이션")
  class Rotated {

    @Test
    @DisplayName("부트스트랩: now부터 한 사이클을 열고 캐시에 사이클 길이 TTL로 기록한다")
    void bootstrap() {
      RotationResult result = engine.rotate();

      assertThat(result.outcome()).isEqualTo(RotationOutcome.ROTATED);
      assertThat(result.startTime()).isEqualTo(T0);
      assertThat(result.endTime()).isEqualTo(T0.plus(DAY));
      assertThat(result.previousCycleId()).isNull();
      assertThat(result.assignmentCount()).isEqualTo(1);
      assertThat(result.cachePushed()).isTrue();

      assertThat(cache.writes()).singleElement().satisfies(
          write -> {
            assertThat(write.ttl()).isEqualTo(DAY);
            assertThat(write.view().questionId()).isEqualTo(1L);
            assertThat(write.view().cycleId()).isEqualTo(result.cycleId());
          });
      assertThat(counter("rotated")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("R1 {Q1,Q2,Q3}: 4번 로테이션하면 Q1, Q2, Q3, Q1 순서로 배정된다")
    void roundRobinScenario() {
      List<Long> assigned = new ArrayList<>();
      Instant previousEnd = null;

      for (int i = 0; i < 4; i++) {
        RotationResult result = engine.rotate();
        assertThat(result.isRotated()).isTrue();
        if (previousEnd != null) {
          assertThat(result.startTime()).isEqualTo(previousEnd);
        }
        previousEnd = result.endTime();
        assigned.add(store.findCurrentAssignment(1L).orElseThrow().questionId());
        clock.advance(DAY);
      }

      assertThat(assigned).containsExactly(1L, 2L, 3L, 1L);
      assertThat(store.cycles()).filteredOn(Cycle::active).hasSize(1);
    }

    @Test
    @DisplayName("허용 오차 안에서 조금 일찍 실행돼도 새 사이클은 이전 종료 시각에서 시작한다")
    void earlyWithinTolerance() {
      engine.rotate();
      clock.advance(DAY.minusSeconds(30));

      RotationResult second = engine.rotate();

      assertThat(second.isRotated()).isTrue();
      assertThat(second.startTime()).isEqualTo(T0.plus(DAY));
      assertThat(cache.writes().get(1).ttl()).isEqualTo(DAY.plusSeconds(30));
    }

    @Test
    @DisplayName("사이클 길이는 로테이션마다 다시 읽는다")
    void cycleDurationReadEveryTime() {
      engine.rotate();
      cycleDuration.set(Duration.ofHours(12));
      clock.advance(DAY);

      RotationResult second = engine.rotate();

      assertThat(second.endTime()).isEqualTo(T0.plus(DAY).plus(Duration.ofHours(12)));
    }

    @Test
    @DisplayName("로테이션이 밀렸으면 끝난 사이클은 캐시에 쓰지 않고 한 사이클씩 따라잡는다")
    void catchUpAfterDowntime() {
      engine.rotate();
      clock.advance(Duration.ofHours(72).plusMinutes(5));

      RotationResult second = engine.rotate();
      RotationResult third = engine.rotate();
      RotationResult fourth = engine.rotate();

      assertThat(second.cachePushed()).isFalse();
      assertThat(third.cachePushed()).isFalse();
      assertThat(fourth.cachePushed()).isTrue();
      assertThat(fourth.endTime()).isEqualTo(T0.plus(Duration.ofHours(96)));
      assertThat(cache.writes()).hasSize(2);
      assertThat(meterRegistry.counter("rotation.cache.push.failure").count()).isZero();
    }
  }

  @Nested
  @DisplayName("중복 트리거")
  class DuplicateTrigger {

    @Test
    @DisplayName("활성 사이클이 아직 한참 남았으면 NOT_DUE, 저장소에 쓰지 않는다")
    void notDue() {
      RotationResult first = engine.rotate();
      clock.advance(Duration.ofHours(1));

      RotationResult second = engine.rotate();

      assertThat(second.outcome()).isEqualTo(RotationOutcome.NOT_DUE);
      assertThat(second.previousCycleId()).isEqualTo(first.cycleId());
      assertThat(second.endTime()).isEqualTo(first.endTime());
      assertThat(store.commitCount()).isEqualTo(1);
      assertThat(counter("not_due")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("읽은 뒤 다른 로테이션이 먼저 커밋하면 CONFLICT, 아무것도 바꾸지 않는다")
    void conflictWhenSomeoneElseCommits() {
      AtomicBoolean fired = new AtomicBoolean();
      store.beforeCommit(
          () -> {
            if (fired.compareAndSet(false, true)) {
              store.commitRotation(null, Cycle.open(T0, DAY), List.of());
            }
          });

      RotationResult result = engine.rotate();

      assertThat(result.outcome()).isEqualTo(RotationOutcome.CONFLICT);
      assertThat(result.previousCycleId()).isNull();
      assertThat(store.cycles()).hasSize(1);
      assertThat(store.assignments()).isEmpty();
      assertThat(cache.writes()).isEmpty();
      assertThat(counter("conflict")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("동시에 두 번 실행돼도 정확히 하나만 커밋된다")
    void concurrentTriggersCommitOnce() throws Exception {
      CountDownLatch bothRead = new CountDownLatch(2);
      store.beforeCommit(
          () -> {
            bothRead.countDown();
            try {
              bothRead.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
            }
          });
      pool = Executors.newFixedThreadPool(2);

      Future<RotationResult> a = pool.submit(engine::rotate);
      Future<RotationResult> b = pool.submit(engine::rotate);

      List<RotationOutcome> outcomes =
          List.of(a.get(10, TimeUnit.SECONDS).outcome(), b.get(10, TimeUnit.SECONDS).outcome());
      assertThat(outcomes)
          .containsExactlyInAnyOrder(RotationOutcome.ROTATED, RotationOutcome.CONFLICT);
      assertThat(store.commitCount()).isEqualTo(1);
      assertThat(store.assignments()).hasSize(1);
    }
  }

  @Nested
  @DisplayName("실패")
  class Failures {

    @Test
    @DisplayName("후보가 없는 지역이 하나라도 있으면 전체를 중단하고 아무것도 커밋하지 않는다")
    void noEligibleQuestionAbortsAll() {
      store.region(2L, "R2");

      assertThatThrownBy(() -> engine.rotate())
          .isInstanceOf(NoEligibleQuestionException.class);
      assertThat(store.cycles()).isEmpty();
      assertThat(store.assignments()).isEmpty();
      assertThat(cache.writes()).isEmpty();
    }

    @Test
    @DisplayName("허용 오차가 0이면 종료 직전 트리거는 NOT_DUE, 조회는 종료 시각까지 이전 질문을 본다")
    void zeroToleranceNeverActivatesEarly() {
      engine = newEngine(Duration.ZERO);
      RotationResult first = engine.rotate();
      clock.advance(DAY.minusSeconds(30));

      assertThat(engine.rotate().outcome()).isEqualTo(RotationOutcome.NOT_DUE);
      assertThat(store.findCurrentAssignment(1L))
          .map(QuestionView::cycleId)
          .contains(first.cycleId());

      clock.advance(Duration.ofSeconds(30));
      RotationResult second = engine.rotate();

      assertThat(second.isRotated()).isTrue();
      assertThat(second.startTime()).isEqualTo(clock.instant());
    }

    @Test
    @DisplayName("교체 중 실패해도 이전 사이클은 활성 상태로 남는다")
    void failureKeepsPreviousCycle() {
      RotationResult first = engine.rotate();
      store.region(2L, "R2");
      clock.advance(DAY);

      assertThatThrownBy(() -> engine.rotate())
          .isInstanceOf(NoEligibleQuestionException.class);
      assertThat(store.findActiveCycle()).map(Cycle::id).contains(first.cycleId());
    }

    @Test
    @DisplayName("사이클 길이 설정이 없으면 ConfigMissingException")
    void missingCycleDuration() {
      cycleDuration.set(null);

      assertThatThrownBy(() -> engine.rotate()).isInstanceOf(ConfigMissingException.class);
      assertThat(store.cycles()).isEmpty();
    }

    @Test
    @DisplayName("캐시 기록 실패는 로테이션을 되돌리지 않고 cachePushed=false로 남긴다")
    void cachePushFailureIsTolerated() {
      cache.failWrites();

      RotationResult result = engine.rotate();

      assertThat(result.isRotated()).isTrue();
      assertThat(result.cachePushed()).isFalse();
      assertThat(store.findCurrentAssignment(1L))
          .map(QuestionView::questionId)
          .contains(1L);
      assertThat(meterRegistry.counter("rotation.cache.push.failure").count()).isEqualTo(1.0);
    }
  }

  private double counter(String outcome) {
    return meterRegistry.counter("rotation.attempt", "outcome", outcome).count();
  }
}
