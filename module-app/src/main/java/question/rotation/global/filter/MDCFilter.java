package question.rotation.global.filter;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * 요청 추적용 MDC 필터
 *
 * <p>{@code X-Correlation-ID} 헤더가 있으면 그대로, 없으면 새로 만들어 MDC {@code requestId}와 응답 헤더에 넣습니다. 조회 풀
 * 워커 스레드로의 전파는 {@code ExecutorConfig.mdcPropagatingDecorator()}가 담당합니다.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MDCFilter implements Filter {

  public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

  public static final String REQUEST_ID_KEY = "requestId";

  @Override
  public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
      throws IOException, ServletException {
    String correlationId = resolveCorrelationId((HttpServletRequest) request);
    MDC.put(REQUEST_ID_KEY, correlationId);
    ((HttpServletResponse) response).setHeader(CORRELATION_ID_HEADER, correlationId);
    try {
      chain.doFilter(request, response);
    } finally {
      MDC.remove(REQUEST_ID_KEY);
    }
  }

  private String resolveCorrelationId(HttpServletRequest request) {
    String id = request.getHeader(CORRELATION_ID_HEADER);
    return (id == null || id.isBlank()) ? UUID.randomUUID().toString() : id;
  }
}
