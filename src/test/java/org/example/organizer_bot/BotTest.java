package org.example.organizer_bot;

import org.example.organizer_bot.event.ActionType;
import org.example.organizer_bot.event.BotAction;
import org.example.organizer_bot.event.EventKind;
import org.example.organizer_bot.event.InboundEvent;
import org.example.organizer_bot.event.Reply;
import org.example.organizer_bot.event.ReplyButton;
import org.junit.jupiter.api.Test;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Chat;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ForceReplyKeyboard;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboardMarkup;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class BotTest {

    private static final String BOT = "test_bot";

    private static Message message(String text) {
        Message message = new Message();
        message.setChat(new Chat(10L, "group"));
        message.setFrom(new User(5L, "Alice", false));
        message.setText(text);
        return message;
    }

    private static Update withMessage(String text) {
        Update update = new Update();
        update.setMessage(message(text));
        return update;
    }

    @Test
    void plainTextBecomesTextEvent() {
        InboundEvent event = Bot.toEvent(withMessage("Lamp"), BOT).orElseThrow();

        assertThat(event.getKind()).isEqualTo(EventKind.TEXT);
        assertThat(event.getChatId()).isEqualTo(10L);
        assertThat(event.getUserId()).isEqualTo(5L);
        assertThat(event.getPayload()).isEqualTo("Lamp");
    }

    @Test
    void commandLosesSlashMentionAndArguments() {
        InboundEvent event = Bot.toEvent(withMessage("/start@test_bot hello"), BOT).orElseThrow();

        assertThat(event.getKind()).isEqualTo(EventKind.COMMAND);
        assertThat(event.getPayload()).isEqualTo("start");
    }

    @Test
    void commandForAnotherBotIsIgnored() {
        assertThat(Bot.toEvent(withMessage("/start@other_bot"), BOT)).isEmpty();
    }

    @Test
    void callbackBecomesButtonEvent() {
        CallbackQuery query = new CallbackQuery();
        query.setId("q1");
        query.setFrom(new User(5L, "Alice", false));
        query.setMessage(message("menu"));
        query.setData("item_type_spare part");
        Update update = new Update();
        update.setCallbackQuery(query);

        InboundEvent event = Bot.toEvent(update, BOT).orElseThrow();

        assertThat(event.getKind()).isEqualTo(EventKind.BUTTON);
        assertThat(event.getChatId()).isEqualTo(10L);
        assertThat(event.getPayload()).isEqualTo("item_type_spare part");
    }

    @Test
    void updatesWithoutTextAreSkipped() {
        Update update = new Update();
        update.setMessage(message(null));

        Optional<InboundEvent> event = Bot.toEvent(update, BOT);

        assertThat(event).isEmpty();
    }

    @Test
    void inlineButtonsCarryEncodedActions() {
        Reply reply = Reply.builder()
                .chatId(10L)
                .text("Товар в наличии?")
                .buttonRow(List.of(new ReplyButton("Да", BotAction.yesNo(ActionType.ITEM_AVAILABILITY, true))))
                .build();

        SendMessage message = Bot.toSendMessage(reply);

        assertThat(message.getChatId()).isEqualTo("10");
        InlineKeyboardMarkup markup = (InlineKeyboardMarkup) message.getReplyMarkup();
        assertThat(markup.getKeyboard().get(0).get(0).getCallbackData()).isEqualTo("item_availability_yes");
    }

    @Test
    void menuKeyboardAndForceReplyAreMapped() {
        SendMessage menu = Bot.toSendMessage(Reply.builder()
                .chatId(10L)
                .text("Привет")
                .menuRow(List.of("Get", "Add"))
                .build());
        SendMessage prompt = Bot.toSendMessage(Reply.prompt(10L, "Введите название"));
        SendMessage plain = Bot.toSendMessage(Reply.text(10L, "Готово"));

        assertThat(menu.getReplyMarkup()).isInstanceOf(ReplyKeyboardMarkup.class);
        assertThat(prompt.getReplyMarkup()).isInstanceOf(ForceReplyKeyboard.class);
        assertThat(plain.getReplyMarkup()).isNull();
    }
}
