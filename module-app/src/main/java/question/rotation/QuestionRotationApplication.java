package question.rotation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class QuestionRotationApplication {

  public static void main(String[] args) {
    SpringApplication.run(QuestionRotationApplication.class, args);
  }
}
