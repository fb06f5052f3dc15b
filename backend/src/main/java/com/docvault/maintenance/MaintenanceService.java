package com.docvault.maintenance;

import com.docvault.share.ShareService;
import com.docvault.store.EncryptedStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * One maintenance sweep: purge expired store entries, deactivate expired or exhausted shares,
 * then prune share access logs past retention.
 */
@Service
@EnableConfigurationProperties(MaintenanceProperties.class)
public class MaintenanceService {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceService.class);

    private final EncryptedStore store;
    private final ShareService shareService;
    private final MaintenanceProperties properties;

    public MaintenanceService(EncryptedStore store, ShareService shareService, MaintenanceProperties properties) {
        this.store = store;
        this.shareService = shareService;
        this.properties = properties;
    }

    public Mono<SweepReport> sweep() {
        return store.cleanupExpired()
                .zipWith(shareService.cleanupExpiredShares())
                .flatMap(counts -> shareService.pruneAccessLogs(properties.accessLogRetention())
                        .map(pruned -> new SweepReport(counts.getT1(), counts.getT2(), pruned)))
                .doOnNext(report -> log.info("Maintenance sweep: {} entries purged, {} shares deactivated, {} log entries pruned",
                        report.purgedEntries(), report.deactivatedShares(), report.prunedLogEntries()));
    }

    public record SweepReport(long purgedEntries, long deactivatedShares, long prunedLogEntries) {}
}
