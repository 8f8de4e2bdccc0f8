package org.example.organizer_bot.model;

import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;

/**
 * Фильтры для списка товаров. Любое поле может быть NULL — тогда фильтра нет.
 */
@Getter
@Builder
public class ItemFilter {

    private final Long chatId;
    /** Подстрока имени (без учёта регистра) */
    private final String nameSubstring;
    private final Long creatorId;
    private final LocalDateTime createdFrom;
    private final LocalDateTime createdTo;

    public static ItemFilter forChat(Long chatId) {
        return ItemFilter.builder().chatId(chatId).build();
    }
}
