package com.jamra.offline.service.event;

import com.jamra.offline.service.LoggerService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class EventCoalescerTest {

    @Mock
    private LoggerService logger;

    private final List<ConsolidatedEvent> delivered = new CopyOnWriteArrayList<>();
    private EventCoalescer coalescer;

    @AfterEach
    void tearDown() {
        if (coalescer != null) {
            coalescer.destroy();
        }
    }

    @Test
    void progressForTheSameItemCollapsesToTheLatestState() {
        coalescer = new EventCoalescer(delivered::add, logger, 60_000, 50);

        coalescer.push(OfflineEvent.started(7, "m1", "c1"));
        coalescer.push(OfflineEvent.progress(7, "m1", "c1", 3, 10));
        coalescer.push(OfflineEvent.progress(7, "m1", "c1", 6, 10));
        coalescer.push(OfflineEvent.progress(8, "m1", "c2", 1, 4));
        coalescer.flush();

        assertThat(delivered).hasSize(1);
        ConsolidatedEvent.DownloadUpdate update = (ConsolidatedEvent.DownloadUpdate) delivered.get(0);
        assertThat(update.getType()).isEqualTo("download-update");
        assertThat(update.getItems()).hasSize(2);
        ConsolidatedEvent.DownloadItem first = update.getItems().get(0);
        assertThat(first.getQueueId()).isEqualTo(7);
        assertThat(first.getState()).isEqualTo("progress");
        assertThat(first.getCurrent()).isEqualTo(6);
        assertThat(first.getTotal()).isEqualTo(10);
    }

    @Test
    void envelopesComeOutInQueueDownloadContentSystemOrder() {
        coalescer = new EventCoalescer(delivered::add, logger, 60_000, 50);

        coalescer.push(OfflineEvent.cleanupPerformed(2048, 3));
        coalescer.push(OfflineEvent.chapterDeleted("m1", "c1"));
        coalescer.push(OfflineEvent.progress(1, "m1", "c2", 1, 2));
        coalescer.push(OfflineEvent.queued(2, "m1", "c3"));
        coalescer.push(OfflineEvent.retried(3, "m1", "c4"));
        coalescer.flush();

        assertThat(delivered).extracting(ConsolidatedEvent::getType)
                .containsExactly("queue-update", "download-update", "content-update", "system");
        ConsolidatedEvent.QueueUpdate queue = (ConsolidatedEvent.QueueUpdate) delivered.get(0);
        assertThat(queue.getItems()).extracting(ConsolidatedEvent.QueueItem::getState).containsExactly("queued", "retried");
        ConsolidatedEvent.SystemUpdate system = (ConsolidatedEvent.SystemUpdate) delivered.get(3);
        assertThat(system.getAction()).isEqualTo("cleanup-performed");
        assertThat(system.getDeletedBytes()).isEqualTo(2048);
        assertThat(system.getDeletedChapters()).isEqualTo(3);
    }

    @Test
    void failureFlushesSynchronouslyWithoutWaitingForTheTimer() {
        coalescer = new EventCoalescer(delivered::add, logger, 60_000, 50);

        coalescer.push(OfflineEvent.progress(1, "m1", "c1", 2, 10));
        assertThat(delivered).isEmpty();
        assertThat(coalescer.getPendingCount()).isEqualTo(1);

        coalescer.push(OfflineEvent.failed(1, "m1", "c1", "HTTP 404"));

        assertThat(coalescer.hasPending()).isFalse();
        ConsolidatedEvent.DownloadUpdate update = (ConsolidatedEvent.DownloadUpdate) delivered.get(0);
        assertThat(update.getItems()).singleElement()
                .satisfies(item -> {
                    assertThat(item.getState()).isEqualTo("failed");
                    assertThat(item.getError()).isEqualTo("HTTP 404");
                });
    }

    @Test
    void fullBufferFlushesImmediately() {
        coalescer = new EventCoalescer(delivered::add, logger, 60_000, 3);

        coalescer.push(OfflineEvent.queued(1, "m1", "c1"));
        coalescer.push(OfflineEvent.queued(2, "m1", "c2"));
        assertThat(delivered).isEmpty();
        coalescer.push(OfflineEvent.queued(3, "m1", "c3"));

        assertThat(delivered).hasSize(1);
        assertThat(((ConsolidatedEvent.QueueUpdate) delivered.get(0)).getItems()).hasSize(3);
    }

    @Test
    void timerFlushesBufferedEvents() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        coalescer = new EventCoalescer(envelope -> {
            delivered.add(envelope);
            latch.countDown();
        }, logger, 20, 50);

        coalescer.push(OfflineEvent.newChaptersAvailable("m1", 4));

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        ConsolidatedEvent.ContentUpdate update = (ConsolidatedEvent.ContentUpdate) delivered.get(0);
        assertThat(update.getUpdates()).singleElement()
                .satisfies(item -> {
                    assertThat(item.getAction()).isEqualTo("new-chapters");
                    assertThat(item.getCount()).isEqualTo(4);
                });
    }

    @Test
    void throwingSinkIsLoggedAndRemainingEnvelopesStillGoOut() {
        coalescer = new EventCoalescer(envelope -> {
            if (envelope instanceof ConsolidatedEvent.QueueUpdate) {
                throw new IllegalStateException("pipe closed");
            }
            delivered.add(envelope);
        }, logger, 60_000, 50);

        coalescer.push(OfflineEvent.queued(1, "m1", "c1"));
        coalescer.push(OfflineEvent.mangaDeleted("m2"));
        coalescer.flush();

        assertThat(delivered).extracting(ConsolidatedEvent::getType).containsExactly("content-update");
        verify(logger).error(eq("EVENTS"), anyString(), any(IllegalStateException.class));
    }

    @Test
    void destroyDrainsTheBufferAndLateEventsAreDeliveredDirectly() {
        coalescer = new EventCoalescer(delivered::add, logger, 60_000, 50);

        coalescer.push(OfflineEvent.queued(1, "m1", "c1"));
        coalescer.destroy();
        assertThat(delivered).hasSize(1);

        coalescer.push(OfflineEvent.chapterDeleted("m1", "c1"));

        assertThat(delivered).extracting(ConsolidatedEvent::getType).containsExactly("queue-update", "content-update");
    }
}
