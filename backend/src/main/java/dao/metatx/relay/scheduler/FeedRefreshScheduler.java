package dao.metatx.relay.scheduler;

import dao.metatx.relay.config.DevnetBootstrap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Keeps the devnet price feeds fresh so volatile conversions keep working past the staleness window.
 */
@Slf4j
@Component
public class FeedRefreshScheduler {

    private final DevnetBootstrap bootstrap;

    public FeedRefreshScheduler(DevnetBootstrap bootstrap) {
        this.bootstrap = bootstrap;
    }

    @Scheduled(fixedDelayString = "${vault.feed-refresh-interval-ms:60000}")
    public void refreshFeeds() {
        int refreshed = bootstrap.refreshFeeds();
        if (refreshed > 0) {
            log.debug("Re-stamped {} devnet price feeds", refreshed);
        }
    }
}
