package question.rotation.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import question.rotation.core.selector.QuestionSelector;
import question.rotation.core.selector.RoundRobinQuestionSelector;

/** 프레임워크 의존이 없는 module-core 구성 요소를 빈으로 등록 */
@Configuration
public class DomainConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public QuestionSelector questionSelector() {
    return new RoundRobinQuestionSelector();
  }
}
