package org.example.organizer_bot.conversation;

import lombok.extern.slf4j.Slf4j;
import org.example.organizer_bot.model.ConversationState;
import org.example.organizer_bot.model.FlowState;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Хранилище состояний бесед (в памяти).
 * <p>
 * События одной беседы обрабатываются строго по очереди: на каждую беседу свой лок,
 * и всё, что делается с её состоянием (включая запросы в БД), идёт под ним.
 * Разные беседы друг друга не ждут.
 */
@Slf4j
@Component
public class ConversationRegistry {

    private final Map<ConversationKey, Slot> conversations = new ConcurrentHashMap<>();
    private final Clock clock;

    public ConversationRegistry(Clock clock) {
        this.clock = clock;
    }

    /**
     * Выполнить действие над состоянием беседы под её локом.
     * Если беседы ещё нет — создаётся пустая.
     */
    public <T> T withConversation(ConversationKey key, Function<ConversationState, T> action) {
        while (true) {
            Slot slot = conversations.computeIfAbsent(key, k -> new Slot(clock.instant()));
            slot.lock.lock();
            try {
                if (slot.evicted) {
                    // Пока ждали лок, беседу выкинули по простою — берём новую
                    continue;
                }
                slot.state.setLastActivity(clock.instant());
                return action.apply(slot.state);
            } finally {
                slot.lock.unlock();
            }
        }
    }

    /**
     * Текущий шаг беседы (без создания). Для тестов и диагностики.
     */
    public Optional<FlowState> currentState(ConversationKey key) {
        Slot slot = conversations.get(key);
        return slot == null ? Optional.empty() : Optional.of(slot.state.getState());
    }

    /**
     * Выкинуть беседы, которых не трогали дольше idleTimeout.
     * Занятые прямо сейчас беседы пропускаем.
     *
     * @return сколько бесед выкинуто
     */
    public int evictIdle(Duration idleTimeout) {
        Instant threshold = clock.instant().minus(idleTimeout);
        int evicted = 0;
        Iterator<Map.Entry<ConversationKey, Slot>> it = conversations.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<ConversationKey, Slot> entry = it.next();
            Slot slot = entry.getValue();
            if (!slot.lock.tryLock()) {
                continue;
            }
            try {
                if (slot.state.getLastActivity().isBefore(threshold)) {
                    slot.evicted = true;
                    it.remove();
                    evicted++;
                    log.debug("Беседа выкинута по простою: chatId={}, userId={}, state={}",
                            entry.getKey().chatId(), entry.getKey().userId(), slot.state.getState());
                }
            } finally {
                slot.lock.unlock();
            }
        }
        return evicted;
    }

    public int size() {
        return conversations.size();
    }

    private static final class Slot {
        private final ReentrantLock lock = new ReentrantLock();
        private final ConversationState state = new ConversationState();
        private boolean evicted;

        private Slot(Instant createdAt) {
            state.setLastActivity(createdAt);
        }
    }
}
