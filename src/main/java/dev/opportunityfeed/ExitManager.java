package dev.opportunityfeed;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Ends the process after a one-shot ingestion run, closing the context first so the
 * SQLite connection pool shuts down cleanly.
 * Kept separate so tests can mock it instead of killing the test runner.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExitManager {

  private final ApplicationContext context;

  public void exit(int status) {
    if (isTest()) {
      log.debug("Exit with status {} suppressed under test runner", status);
      return;
    }
    System.exit(SpringApplication.exit(context, () -> status));
  }

  protected boolean isTest() {
    String cp = System.getProperty("java.class.path", "");
    return cp.contains("junit") || cp.contains("surefire") || cp.contains("intellij");
  }
}
