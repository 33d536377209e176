package dev.interestmap;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Manages application exit.
 * Separated to allow mocking in tests and avoid killing the test runner.
 */
@Component
public class ExitManager {

    @Value("${mapper.exit-on-complete:true}")
    private boolean exitOnComplete = true;

    public void exit(int status) {
        if (exitOnComplete && !isTest()) {
            System.exit(status);
        }
    }

    protected boolean isTest() {
        String cp = System.getProperty("java.class.path", "");
        return cp.contains("junit") || cp.contains("surefire") || cp.contains("intellij");
    }
}
