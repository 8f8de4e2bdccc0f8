package org.example.organizer_bot.conversation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.organizer_bot.config.OrganizerProperties;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Раз в минуту чистит беседы, которые давно не трогали.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationCleanerScheduler {

    private final ConversationRegistry registry;
    private final OrganizerProperties properties;

    @Scheduled(fixedDelay = 60_000)
    public void cleanupIdle() {
        Duration idleTimeout = properties.getFlow().getIdleTimeout();
        if (idleTimeout == null || idleTimeout.isZero() || idleTimeout.isNegative()) {
            return;
        }
        int evicted = registry.evictIdle(idleTimeout);
        if (evicted > 0) {
            log.info("Очищено бесед по простою: {}", evicted);
        }
    }
}
