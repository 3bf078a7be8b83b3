package question.rotation.core.domain.model;

/**
 * 지역 도메인 모델
 *
 * <p>생성 이후 불변입니다.
 *
 * @param id 지역 ID
 * @param name 표시 이름
 */
public record Region(long id, String name) {}
