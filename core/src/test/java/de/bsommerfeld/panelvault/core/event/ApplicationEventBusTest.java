package de.bsommerfeld.panelvault.core.event;

import com.google.common.eventbus.Subscribe;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ApplicationEventBusTest {

    @Test
    void post_shouldDeliverEventToRegisteredListener() {
        var eventBus = new ApplicationEventBus();
        var received = new AtomicReference<AcquisitionEvents.CrawlFinishedEvent>();

        Object listener = new Object() {
            @Subscribe
            public void onFinished(AcquisitionEvents.CrawlFinishedEvent event) {
                received.set(event);
            }
        };

        eventBus.register(listener);
        eventBus.post(new AcquisitionEvents.CrawlFinishedEvent(1, 3, "END_OF_COMIC"));

        assertEquals(3, received.get().recordsAdded());
    }

    @Test
    void unregister_shouldStopDeliveringEvents() {
        var eventBus = new ApplicationEventBus();
        List<Object> received = new ArrayList<>();

        Object listener = new Object() {
            @Subscribe
            public void onProgress(AcquisitionEvents.DownloadProgressEvent event) {
                received.add(event);
            }
        };

        eventBus.register(listener);
        eventBus.post(new AcquisitionEvents.DownloadProgressEvent(1, 1, 2));
        eventBus.unregister(listener);
        eventBus.post(new AcquisitionEvents.DownloadProgressEvent(1, 2, 2));

        assertEquals(1, received.size());
    }
}
