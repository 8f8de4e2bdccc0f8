package org.example.organizer_bot.event;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;

/**
 * Исходящее сообщение: текст + (необязательно) кнопки.
 * <p>
 * Движок диалогов возвращает список таких ответов, а Bot уже превращает их
 * в SendMessage. Так диалоги тестируются без Telegram.
 */
@Getter
@Builder
@ToString
public class Reply {

    private final Long chatId;
    private final String text;

    /** Inline-кнопки, по строкам */
    @Singular("buttonRow")
    private final List<List<ReplyButton>> buttons;

    /** Постоянная клавиатура меню (подписи кнопок), по строкам */
    @Singular("menuRow")
    private final List<List<String>> menuKeyboard;

    /** Попросить клиента сразу открыть ответ на сообщение */
    private final boolean forceReply;

    public static Reply text(Long chatId, String text) {
        return Reply.builder().chatId(chatId).text(text).build();
    }

    public static Reply prompt(Long chatId, String text) {
        return Reply.builder().chatId(chatId).text(text).forceReply(true).build();
    }

    public boolean hasButtons() {
        return !buttons.isEmpty();
    }

    /** Все действия всех кнопок подряд (удобно в тестах и логах) */
    public List<BotAction> actions() {
        return buttons.stream()
                .flatMap(List::stream)
                .map(ReplyButton::getAction)
                .toList();
    }
}
