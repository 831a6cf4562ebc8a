package com.sessionhub.ingestion.service.acquisition;

import com.sessionhub.ingestion.model.AcquisitionRequest;
import com.sessionhub.ingestion.model.AcquisitionTask;
import com.sessionhub.ingestion.model.AcquisitionTaskState;
import com.sessionhub.ingestion.model.AssetEntry;
import com.sessionhub.ingestion.model.SlotType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class AcquisitionTaskRegistryTest {

    private final AcquisitionTaskRegistry registry = new AcquisitionTaskRegistry();

    @Test
    void secondRegistrationForActiveKeyIsRejected() {
        AcquisitionRequest request = request(UUID.randomUUID(), SlotType.PRIMARY_DECK);

        Optional<AcquisitionTask> first = registry.register(request);
        Optional<AcquisitionTask> second = registry.register(request);

        assertThat(first).isPresent();
        assertThat(first.get().getState()).isEqualTo(AcquisitionTaskState.PENDING);
        assertThat(second).isEmpty();
        assertThat(registry.isInFlight(request.key())).isTrue();
    }

    @Test
    void differentSlotsOfSameRecordAreIndependent() {
        UUID contentId = UUID.randomUUID();

        assertThat(registry.register(request(contentId, SlotType.PRIMARY_DECK))).isPresent();
        assertThat(registry.register(request(contentId, SlotType.RECAP_DECK))).isPresent();
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    void retiredKeyCanBeRegisteredAgain() {
        AcquisitionRequest request = request(UUID.randomUUID(), SlotType.RECAP_DECK);
        AcquisitionTask task = registry.register(request).orElseThrow();
        task.start();
        task.succeed(List.of());

        registry.retire(task);

        assertThat(registry.find(request.key())).isEmpty();
        assertThat(registry.register(request)).isPresent();
    }

    @Test
    void finishedButUnretiredTaskDoesNotBlock() {
        AcquisitionRequest request = request(UUID.randomUUID(), SlotType.PRIMARY_DECK);
        AcquisitionTask task = registry.register(request).orElseThrow();
        task.start();
        task.fail(List.of(), "gone");

        assertThat(registry.isInFlight(request.key())).isFalse();
        assertThat(registry.register(request)).isPresent();
    }

    @Test
    void retiringStaleTaskLeavesNewerOneInPlace() {
        AcquisitionRequest request = request(UUID.randomUUID(), SlotType.PRIMARY_DECK);
        AcquisitionTask stale = registry.register(request).orElseThrow();
        stale.fail(List.of(), "boom");
        AcquisitionTask fresh = registry.register(request).orElseThrow();

        registry.retire(stale);

        assertThat(registry.find(request.key())).containsSame(fresh);
    }

    @Test
    void concurrentRegistrationAdmitsExactlyOne() throws Exception {
        AcquisitionRequest request = request(UUID.randomUUID(), SlotType.PRIMARY_DECK);
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Callable<Boolean>> calls = IntStream.range(0, threads)
                    .mapToObj(i -> (Callable<Boolean>) () -> {
                        start.await();
                        return registry.register(request).isPresent();
                    })
                    .collect(Collectors.toList());
            List<Future<Boolean>> futures = calls.stream().map(pool::submit).collect(Collectors.toList());
            start.countDown();

            int admitted = 0;
            for (Future<Boolean> future : futures) {
                if (future.get(5, TimeUnit.SECONDS)) {
                    admitted++;
                }
            }
            assertThat(admitted).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    private static AcquisitionRequest request(UUID contentId, SlotType slot) {
        return new AcquisitionRequest(contentId, slot, AssetEntry.builder().slotType(slot).externalId("X").build());
    }
}
