package com.locksmith.lease;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import uk.org.webcompere.systemstubs.environment.EnvironmentVariables;
import uk.org.webcompere.systemstubs.jupiter.SystemStubsExtension;

import java.util.concurrent.TimeUnit;

import static com.locksmith.lease.LocksmithUtils.SOCKET_TIMEOUT_MILLIS_KEY;
import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(SystemStubsExtension.class)
class ConnectionSettingsTest {

    @Test
    void checkDefaultTimeout(EnvironmentVariables environmentVariables) {
        environmentVariables.set(SOCKET_TIMEOUT_MILLIS_KEY, null);
        var settings = new ConnectionSettings("localhost", 33013, null, null);
        assertEquals(LocksmithUtils.DEFAULT_SOCKET_TIMEOUT_MILLIS, settings.getTimeoutMillis());
        assertFalse(settings.hasCredentials());
    }

    @Test
    void checkTimeoutFromEnvironment(EnvironmentVariables environmentVariables) {
        environmentVariables.set(SOCKET_TIMEOUT_MILLIS_KEY, "2500");
        assertEquals(2500, new ConnectionSettings("localhost", 33013, null, null).getTimeoutMillis());
    }

    @Test
    void checkInvalidValues() {
        assertThrows(LocksmithConfigurationException.class, () -> new ConnectionSettings(null, 1, null, null));
        assertThrows(LocksmithConfigurationException.class, () -> new ConnectionSettings("  ", 1, null, null));
        assertThrows(LocksmithConfigurationException.class, () -> new ConnectionSettings("h", 0, null, null));
        assertThrows(LocksmithConfigurationException.class, () -> new ConnectionSettings("h", 65536, null, null));
        assertThrows(LocksmithConfigurationException.class, () -> new ConnectionSettings("h", 1, null, null, 0, TimeUnit.SECONDS));
        assertThrows(LocksmithConfigurationException.class, () -> new ConnectionSettings("h", 1, null, null, 10, TimeUnit.MICROSECONDS));
        assertThrows(LocksmithConfigurationException.class, () -> new ConnectionSettings("h", 1, null, null, 1, null));
        assertThrows(LocksmithConfigurationException.class, () -> new ConnectionSettings("h", 1, null, "secret"));
        var ex = assertThrows(LocksmithConfigurationException.class, () -> new ConnectionSettings("", 1, null, null));
        assertEquals("Host and port params must be not empty", ex.getMessage());
    }

    @Test
    void checkValueSemantics() {
        var settings = new ConnectionSettings(" h ", 65535, "user", "secret", 3, TimeUnit.SECONDS);
        assertEquals("h", settings.getHost());
        assertEquals(3000, settings.getTimeoutMillis());
        assertTrue(settings.hasCredentials());
        assertEquals(settings, new ConnectionSettings("h", 65535, "user", "secret", 3000, TimeUnit.MILLISECONDS));
        assertEquals(settings.hashCode(), new ConnectionSettings("h", 65535, "user", "secret", 3000, TimeUnit.MILLISECONDS).hashCode());
        assertNotEquals(settings, new ConnectionSettings("h", 65535, "user", "other", 3, TimeUnit.SECONDS));
        assertFalse(settings.toString().contains("secret"));
        assertTrue(settings.toString().contains("user@h:65535"));
    }

}
