package com.docvault.maintenance;

import com.docvault.share.ShareService;
import com.docvault.store.EncryptedStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for MaintenanceService and MaintenanceScheduler with the store and share service
 * stubbed by Mockito.
 */
@ExtendWith(MockitoExtension.class)
class MaintenanceServiceTest {

    @Mock
    private EncryptedStore store;

    @Mock
    private ShareService shareService;

    private MaintenanceService maintenance;

    @BeforeEach
    void setup() {
        maintenance = new MaintenanceService(store, shareService,
                new MaintenanceProperties(true, Duration.ofHours(1), Duration.ofDays(90)));
    }

    @Test
    void sweepRunsEveryStepAndReportsCounts() {
        when(store.cleanupExpired()).thenReturn(Mono.just(4L));
        when(shareService.cleanupExpiredShares()).thenReturn(Mono.just(2L));
        when(shareService.pruneAccessLogs(Duration.ofDays(90))).thenReturn(Mono.just(11L));

        StepVerifier.create(maintenance.sweep())
                .expectNext(new MaintenanceService.SweepReport(4, 2, 11))
                .verifyComplete();
    }

    @Test
    void failedStepStopsTheSweep() {
        when(store.cleanupExpired()).thenReturn(Mono.error(new IllegalStateException("backend down")));
        when(shareService.cleanupExpiredShares()).thenReturn(Mono.just(0L));

        StepVerifier.create(maintenance.sweep())
                .expectErrorMessage("backend down")
                .verify();
        verify(shareService, never()).pruneAccessLogs(any());
    }

    @Test
    void schedulerLogsFailuresInsteadOfThrowing() {
        when(store.cleanupExpired()).thenReturn(Mono.error(new IllegalStateException("backend down")));
        when(shareService.cleanupExpiredShares()).thenReturn(Mono.just(0L));

        MaintenanceScheduler scheduler = new MaintenanceScheduler(maintenance);

        assertDoesNotThrow(scheduler::runSweep);
    }
}
