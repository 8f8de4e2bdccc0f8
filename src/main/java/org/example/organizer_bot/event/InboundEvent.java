package org.example.organizer_bot.event;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Входящее событие, уже вытащенное из Telegram Update.
 * <p>
 * payload: для COMMAND — имя команды без "/" и без "@botname",
 * для TEXT — текст сообщения, для BUTTON — callback_data.
 */
@Getter
@AllArgsConstructor
@ToString(exclude = "payload")
public class InboundEvent {

    private final Long chatId;
    private final Long userId;
    private final EventKind kind;
    private final String payload;

    public static InboundEvent command(Long chatId, Long userId, String command) {
        return new InboundEvent(chatId, userId, EventKind.COMMAND, command);
    }

    public static InboundEvent text(Long chatId, Long userId, String text) {
        return new InboundEvent(chatId, userId, EventKind.TEXT, text);
    }

    public static InboundEvent button(Long chatId, Long userId, String callbackData) {
        return new InboundEvent(chatId, userId, EventKind.BUTTON, callbackData);
    }
}
