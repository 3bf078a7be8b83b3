package question.rotation.infrastructure.cache;

import question.rotation.core.domain.model.QuestionView;

/** L1 엔트리: 값 + 엔트리별 만료 시간 */
record TimedEntry(QuestionView view, long ttlNanos) {}
