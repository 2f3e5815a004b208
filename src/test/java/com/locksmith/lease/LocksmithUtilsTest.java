package com.locksmith.lease;

import ch.qos.logback.classic.Level;
import com.locksmith.test_config.TestAppender;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import uk.org.webcompere.systemstubs.environment.EnvironmentVariables;
import uk.org.webcompere.systemstubs.jupiter.SystemStubsExtension;

import java.util.concurrent.TimeUnit;

import static com.locksmith.lease.LocksmithUtils.*;
import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(SystemStubsExtension.class)
class LocksmithUtilsTest {

    @Test
    void checkEnvVariableNotSet(EnvironmentVariables environmentVariables) {
        environmentVariables.set(SOCKET_TIMEOUT_MILLIS_KEY, null);
        assertEquals(DEFAULT_SOCKET_TIMEOUT_MILLIS, getEffectiveSocketTimeoutMillis(), "Should return default value if env variable is not set");
    }

    @Test
    void checkEnvVariableSetToValidValueAboveMin(EnvironmentVariables environmentVariables) {
        environmentVariables.set(SOCKET_TIMEOUT_MILLIS_KEY, " 60000 ");
        assertEquals(60000L, getEffectiveSocketTimeoutMillis(), "Should return the value from env variable if it is valid and above min");
    }

    @Test
    void checkEnvVariableSetToValidValueBelowMin(EnvironmentVariables environmentVariables) {
        environmentVariables.set(SOCKET_TIMEOUT_MILLIS_KEY, "10");
        assertEquals(MIN_SOCKET_TIMEOUT_MILLIS, getEffectiveSocketTimeoutMillis(), "Should return MIN_SOCKET_TIMEOUT_MILLIS if env variable value is below min");
    }

    @Test
    void checkEnvVariableSetToInvalidValue(EnvironmentVariables environmentVariables) {
        var testAppender = TestAppender.getInstance();
        testAppender.setLogLevel(Level.INFO);
        testAppender.clearLogs();
        environmentVariables.set(SOCKET_TIMEOUT_MILLIS_KEY, "invalid");
        assertEquals(DEFAULT_SOCKET_TIMEOUT_MILLIS, getEffectiveSocketTimeoutMillis(), "Should return default value if env variable is invalid");
        assertTrue(testAppender.contains(Level.ERROR, SOCKET_TIMEOUT_MILLIS_KEY));
    }

    @Test
    void checkEffectiveString(EnvironmentVariables environmentVariables) {
        environmentVariables.set("LOCKSMITH_TEST_NAME", null);
        assertEquals("fallback", getEffectiveString("LOCKSMITH_TEST_NAME", "fallback"));
        environmentVariables.set("LOCKSMITH_TEST_NAME", "  ");
        assertEquals("fallback", getEffectiveString("LOCKSMITH_TEST_NAME", "fallback"));
        environmentVariables.set("LOCKSMITH_TEST_NAME", " value ");
        assertEquals("value", getEffectiveString("LOCKSMITH_TEST_NAME", "fallback"));
    }

    @Test
    void checkToSeconds() {
        assertEquals(1.5, toSeconds(1500, TimeUnit.MILLISECONDS));
        assertEquals(120.0, toSeconds(2, TimeUnit.MINUTES));
        assertEquals(0.0, toSeconds(0, TimeUnit.SECONDS));
    }

}
