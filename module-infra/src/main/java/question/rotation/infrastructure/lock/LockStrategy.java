package question.rotation.infrastructure.lock;

/**
 * 분산 락 전략 인터페이스
 *
 * <p>로테이션처럼 클러스터 전체에서 한 번에 하나만 실행되어야 하는 작업을 보호합니다. 저장소의 조건부 커밋이 최종 방어선이며 락은 중복 시도를 줄이는
 * 1차 가드입니다.
 */
public interface LockStrategy {

  /**
   * 기다리지 않고 락 획득을 시도합니다. 획득했다면 {@link #unlock}으로 해제해야 합니다.
   *
   * @param key 락 키 (접두사는 구현체가 붙임)
   * @return 획득 여부. 락 저장소 장애도 false
   */
  boolean tryLockImmediately(String key);

  /** 현재 스레드가 보유한 락만 해제합니다. 해제 실패는 로그만 남깁니다. */
  void unlock(String key);
}
