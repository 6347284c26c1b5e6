package de.bsommerfeld.panelvault.app.event;

import de.bsommerfeld.panelvault.core.event.ApplicationEventBus;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class LoggingEventListenerTest {

    @Test
    void constructor_shouldRegisterWithBus() {
        ApplicationEventBus bus = mock(ApplicationEventBus.class);

        LoggingEventListener listener = new LoggingEventListener(bus);

        verify(bus).register(listener);
    }

    @Test
    void isMilestone_shouldReportEveryTenthAndTheLastItem() {
        assertTrue(LoggingEventListener.isMilestone(10, 100));
        assertFalse(LoggingEventListener.isMilestone(11, 100));
        assertTrue(LoggingEventListener.isMilestone(100, 100));
        assertTrue(LoggingEventListener.isMilestone(3, 7));
        assertFalse(LoggingEventListener.isMilestone(0, 0));
    }
}
