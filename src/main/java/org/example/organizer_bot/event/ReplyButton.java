package org.example.organizer_bot.event;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Inline-кнопка ответа: подпись + действие.
 */
@Getter
@AllArgsConstructor
@ToString
@EqualsAndHashCode
public class ReplyButton {

    private final String label;
    private final BotAction action;
}
