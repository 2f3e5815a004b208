package com.locksmith.lease;

import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class LeaseTest {

    private final Locksmith locksmith = mock(Locksmith.class);

    @Test
    void checkDelegation() {
        when(locksmith.update("id-1", 30, TimeUnit.SECONDS)).thenReturn(true);
        when(locksmith.release("id-1")).thenReturn(false);
        var lease = new Lease(locksmith, "foo", "id-1");

        assertTrue(lease.update(30, TimeUnit.SECONDS));
        assertFalse(lease.release());
        verify(locksmith).update("id-1", 30, TimeUnit.SECONDS);
        verify(locksmith).release("id-1");
    }

    @Test
    void checkIdentity() {
        var lease = new Lease(locksmith, "foo", "id-1");
        assertEquals(lease, new Lease(mock(Locksmith.class), "foo", "id-1"));
        assertEquals(lease.hashCode(), new Lease(locksmith, "foo", "id-1").hashCode());
        assertNotEquals(lease, new Lease(locksmith, "foo", "id-2"));
        assertNotEquals(lease, new Lease(locksmith, "bar", "id-1"));
        assertEquals("<Lease name='foo' id='id-1'>", lease.toString());
    }

    @Test
    void checkMandatoryFields() {
        assertThrows(NullPointerException.class, () -> new Lease(locksmith, null, "id"));
        assertThrows(NullPointerException.class, () -> new Lease(locksmith, "foo", null));
    }

}
