package org.example.organizer_bot;

import lombok.extern.slf4j.Slf4j;
import org.example.organizer_bot.event.InboundEvent;
import org.example.organizer_bot.event.Reply;
import org.example.organizer_bot.event.ReplyButton;
import org.example.organizer_bot.handler.UpdateDispatcher;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ForceReplyKeyboard;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboard;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.KeyboardRow;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Главный класс бота: слушает Telegram (long polling).
 * <p>
 * Сам ничего не решает: превращает Update во {@link InboundEvent},
 * отдаёт диспетчеру и отправляет то, что тот вернул.
 */
@Slf4j
@Component
public class Bot extends TelegramLongPollingBot {

    private final String botUsername;
    private final UpdateDispatcher updateDispatcher;

    public Bot(@Value("${telegram.bot.token}") String botToken,
               @Value("${telegram.bot.username}") String botUsername,
               UpdateDispatcher updateDispatcher) {
        super(botToken);
        this.botUsername = botUsername;
        this.updateDispatcher = updateDispatcher;
    }

    @Override
    public void onUpdateReceived(Update update) {
        if (update.hasCallbackQuery()) {
            // Ответить надо всегда, иначе кнопка "висит"
            answerCallbackQuery(update.getCallbackQuery().getId());
        }

        Optional<InboundEvent> event = toEvent(update, botUsername);
        if (event.isEmpty()) {
            log.debug("Update пропущен: updateId={}", update.getUpdateId());
            return;
        }

        List<Reply> replies = updateDispatcher.dispatch(event.get());
        for (Reply reply : replies) {
            send(reply);
        }
    }

    /**
     * Вытащить из Update событие: кнопку, команду или текст.
     * Всё остальное (фото, стикеры, каналы) — пусто.
     */
    static Optional<InboundEvent> toEvent(Update update, String botUsername) {
        if (update.hasCallbackQuery()) {
            CallbackQuery query = update.getCallbackQuery();
            if (query.getMessage() == null || query.getFrom() == null) {
                return Optional.empty();
            }
            return Optional.of(InboundEvent.button(query.getMessage().getChatId(), query.getFrom().getId(), query.getData()));
        }

        if (!update.hasMessage() || !update.getMessage().hasText()) {
            return Optional.empty();
        }
        Message message = update.getMessage();
        if (message.getFrom() == null) {
            return Optional.empty();
        }
        Long chatId = message.getChatId();
        Long userId = message.getFrom().getId();
        String text = message.getText();

        if (text.startsWith("/")) {
            // "/start@my_bot arg" → "start"
            String command = text.substring(1).trim().split("\\s+", 2)[0];
            int at = command.indexOf('@');
            if (at >= 0) {
                String target = command.substring(at + 1);
                if (botUsername != null && !target.equalsIgnoreCase(botUsername)) {
                    // Команда другому боту в групповом чате
                    return Optional.empty();
                }
                command = command.substring(0, at);
            }
            return Optional.of(InboundEvent.command(chatId, userId, command));
        }
        return Optional.of(InboundEvent.text(chatId, userId, text));
    }

    /**
     * Собрать SendMessage из ответа. Inline-кнопки важнее клавиатуры меню.
     */
    static SendMessage toSendMessage(Reply reply) {
        SendMessage message = SendMessage.builder()
                .chatId(reply.getChatId().toString())
                .text(reply.getText())
                .build();
        ReplyKeyboard markup = toMarkup(reply);
        if (markup != null) {
            message.setReplyMarkup(markup);
        }
        return message;
    }

    private static ReplyKeyboard toMarkup(Reply reply) {
        if (reply.hasButtons()) {
            List<List<InlineKeyboardButton>> rows = new ArrayList<>();
            for (List<ReplyButton> row : reply.getButtons()) {
                List<InlineKeyboardButton> buttons = new ArrayList<>();
                for (ReplyButton button : row) {
                    buttons.add(InlineKeyboardButton.builder()
                            .text(button.getLabel())
                            .callbackData(button.getAction().encode())
                            .build());
                }
                rows.add(buttons);
            }
            return InlineKeyboardMarkup.builder().keyboard(rows).build();
        }

        if (!reply.getMenuKeyboard().isEmpty()) {
            List<KeyboardRow> rows = new ArrayList<>();
            for (List<String> labels : reply.getMenuKeyboard()) {
                KeyboardRow row = new KeyboardRow();
                labels.forEach(row::add);
                rows.add(row);
            }
            ReplyKeyboardMarkup keyboard = new ReplyKeyboardMarkup();
            keyboard.setKeyboard(rows);
            keyboard.setResizeKeyboard(true);
            keyboard.setOneTimeKeyboard(false); // меню всегда видно
            return keyboard;
        }

        if (reply.isForceReply()) {
            return ForceReplyKeyboard.builder()
                    .forceReply(true)
                    .selective(true)
                    .build();
        }
        return null;
    }

    private void send(Reply reply) {
        try {
            execute(toSendMessage(reply));
        } catch (TelegramApiException e) {
            log.error("Ошибка отправки сообщения: chatId={}, error={}", reply.getChatId(), e.getMessage());
        }
    }

    private void answerCallbackQuery(String callbackQueryId) {
        try {
            execute(AnswerCallbackQuery.builder()
                    .callbackQueryId(callbackQueryId)
                    .build());
        } catch (TelegramApiException e) {
            log.error("Ошибка ответа на callback query: callbackQueryId={}, error={}", callbackQueryId, e.getMessage());
        }
    }

    @Override
    public String getBotUsername() {
        return botUsername;
    }
}
