package dev.upgrader;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Manages application exit: closes the context, then ends the JVM with the status.
 * Separated to allow mocking in tests and avoid killing the test runner.
 */
@Slf4j
@Component
public class ExitManager {

    private final ApplicationContext context;

    public ExitManager(ApplicationContext context) {
        this.context = context;
    }

    public void exit(int status) {
        if (isTest()) {
            log.info("Exit with status {} suppressed under test", status);
            return;
        }
        System.exit(SpringApplication.exit(context, () -> status));
    }

    protected boolean isTest() {
        String cp = System.getProperty("java.class.path", "");
        return cp.contains("junit") || cp.contains("surefire") || cp.contains("intellij");
    }
}
