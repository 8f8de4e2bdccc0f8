package org.example.organizer_bot.model;

import lombok.Data;

import java.time.Instant;

/**
 * Состояние одной беседы (чат + пользователь). Живёт только в памяти.
 * <p>
 * Хранит текущий шаг и черновые данные активного диалога.
 * Любой новый диалог начинается с {@link #reset()}, поэтому данные
 * разных диалогов не смешиваются.
 */
@Data
public class ConversationState {

    private FlowState state = FlowState.NONE;

    /** Черновик для диалога добавления */
    private ItemDraft draft;

    /** Диалог изменения: id найденного товара и накопленные правки */
    private Long updateItemId;
    private ItemPatch patch;

    /** Диалог наличия: имя товара */
    private String itemName;

    /** Управление пользователями: Telegram ID, с которым работаем */
    private Long targetTelegramId;

    /** Когда беседу трогали последний раз (для чистки по простою). Ставит реестр по своим часам */
    private Instant lastActivity;

    public boolean isActive() {
        return state != FlowState.NONE;
    }

    /**
     * Сбросить шаг и все черновые данные.
     */
    public void reset() {
        state = FlowState.NONE;
        draft = null;
        updateItemId = null;
        patch = null;
        itemName = null;
        targetTelegramId = null;
    }
}
