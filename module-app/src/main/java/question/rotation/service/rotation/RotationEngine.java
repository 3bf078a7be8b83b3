package question.rotation.service.rotation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import question.rotation.common.function.ThrowingSupplier;
import question.rotation.config.RotationProperties;
import question.rotation.core.domain.model.Assignment;
import question.rotation.core.domain.model.Cycle;
import question.rotation.core.domain.model.Question;
import question.rotation.core.domain.model.QuestionView;
import question.rotation.core.domain.model.Region;
import question.rotation.core.domain.model.RotationOutcome;
import question.rotation.core.domain.model.RotationResult;
import question.rotation.core.port.out.AssignmentStore;
import question.rotation.core.port.out.DurationConfigSource;
import question.rotation.core.port.out.LookupCache;
import question.rotation.core.selector.QuestionSelector;
import question.rotation.error.exception.RotationConflictException;
import question.rotation.infrastructure.executor.LogicExecutor;
import question.rotation.infrastructure.executor.TaskContext;
import question.rotation.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * 로테이션 엔진
 *
 * <h3>흐름</h3>
 *
 * <ol>
 *   <li>활성 사이클 조회. 아직 종료 시각이 멀었으면 {@code NOT_DUE}
 *   <li>새 사이클 경계 계산: 시작 = 이전 사이클 종료 시각 (부트스트랩이면 now), 종료 = 시작 + cycle-duration
 *   <li>모든 지역에 대해 다음 질문 선택
 *   <li>조건부 원자 커밋 (이전 활성 사이클 ID 기준). 조건 실패 시 {@code CONFLICT}
 *   <li>커밋 후 전체 스냅샷을 조회 캐시에 일괄 기록 (TTL = 새 사이클 잔여 시간)
 * </ol>
 *
 * <p>커밋 전 실패는 이전 사이클을 그대로 둡니다. 캐시 기록 실패는 로그와 메트릭만 남기고 결과에 {@code cachePushed=false}로 표시합니다.
 * 조회 경로가 캐시 미스 시 저장소에서 다시 채웁니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RotationEngine {

  static final String CYCLE_DURATION_KEY = "cycle-duration";

  private final AssignmentStore store;
  private final QuestionSelector selector;
  private final LookupCache lookupCache;
  private final DurationConfigSource configSource;
  private final LogicExecutor executor;
  private final RotationProperties properties;
  private final RotationMetrics metrics;
  private final Clock clock;

  public RotationResult rotate() {
    Instant now = clock.instant();
    Optional<Cycle> active = readStore(store::findActiveCycle, "readActiveCycle");

    if (active.isPresent() && !active.get().isDue(now, properties.earlyTriggerTolerance())) {
      log.info(
          "[Rotation] Not due: activeCycleId={}, endsAt={}",
          active.get().id(),
          active.get().endTime());
      metrics.recordOutcome(RotationOutcome.NOT_DUE);
      return RotationResult.notDue(active.get());
    }

    Long expectedCycleId = active.map(Cycle::id).orElse(null);
    Duration cycleDuration = configSource.getDuration(CYCLE_DURATION_KEY);
    Cycle next = Cycle.open(active.map(Cycle::endTime).orElse(now), cycleDuration);
    List<Assignment> assignments = selectAll();

    Optional<Cycle> committed = commit(expectedCycleId, next, assignments);
    if (committed.isEmpty()) {
      log.info("[Rotation] Conflict, already committed elsewhere: expected={}", expectedCycleId);
      metrics.recordOutcome(RotationOutcome.CONFLICT);
      return RotationResult.conflict(expectedCycleId);
    }

    Cycle cycle = committed.get();
    boolean cachePushed = pushSnapshot(cycle, assignments);
    log.info(
        "[Rotation] Rotated: previous={}, new={}, start={}, end={}, regions={}, cachePushed={}",
        expectedCycleId,
        cycle.id(),
        cycle.startTime(),
        cycle.endTime(),
        assignments.size(),
        cachePushed);
    metrics.recordOutcome(RotationOutcome.ROTATED);
    return RotationResult.rotated(cycle, expectedCycleId, assignments.size(), cachePushed);
  }

  /** 지역 하나라도 후보가 없으면 {@code NoEligibleQuestionException}으로 로테이션 전체를 중단합니다. */
  private List<Assignment> selectAll() {
    List<Region> regions = readStore(store::findAllRegions, "readRegions");
    List<Assignment> assignments = new ArrayList<>(regions.size());
    for (Region region : regions) {
      List<Question> eligible =
          readStore(() -> store.findEligibleQuestions(region.id()), "readEligible");
      List<Question> history =
          readStore(() -> store.findAssignmentHistory(region.id()), "readHistory");
      Question selected = selector.selectNext(region.id(), eligible, history);
      assignments.add(new Assignment(null, region.id(), selected));
    }
    return assignments;
  }

  /** 조건 실패(다른 로테이션이 먼저 커밋)는 empty, 그 외 실패는 전파 */
  private Optional<Cycle> commit(Long expectedCycleId, Cycle next, List<Assignment> assignments) {
    TaskContext context = TaskContext.of("Rotation", "commit", String.valueOf(expectedCycleId));
    return executor.executeOrCatch(
        () ->
            Optional.of(
                executor.executeWithTranslation(
                    () -> store.commitRotation(expectedCycleId, next, assignments),
                    ExceptionTranslator.forRotationCommit(expectedCycleId),
                    context)),
        e -> {
          if (e instanceof RotationConflictException) {
            return Optional.empty();
          }
          throw (RuntimeException) e;
        },
        context);
  }

  private boolean pushSnapshot(Cycle cycle, List<Assignment> assignments) {
    Duration ttl = cycle.remaining(clock.instant());
    if (ttl.isZero() || ttl.isNegative()) {
      log.warn(
          "[Rotation] Cycle already ended, skip cache push: cycleId={}, end={}",
          cycle.id(),
          cycle.endTime());
      return false;
    }
    List<QuestionView> snapshot =
        assignments.stream().map(assignment -> QuestionView.of(assignment, cycle)).toList();

    boolean pushed =
        executor.executeOrDefault(
            () -> {
              lookupCache.putAll(snapshot, ttl);
              return true;
            },
            false,
            TaskContext.of("Rotation", "pushCache", cycle.id()));
    if (!pushed) {
      metrics.recordCachePushFailure();
    }
    return pushed;
  }

  private <T> T readStore(ThrowingSupplier<T> read, String operation) {
    return executor.executeWithTranslation(
        read, ExceptionTranslator.forStore(), TaskContext.of("Rotation", operation));
  }
}
