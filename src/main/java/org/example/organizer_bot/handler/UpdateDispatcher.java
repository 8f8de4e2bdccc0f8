package org.example.organizer_bot.handler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.organizer_bot.conversation.ConversationKey;
import org.example.organizer_bot.conversation.ConversationRegistry;
import org.example.organizer_bot.event.BotAction;
import org.example.organizer_bot.event.InboundEvent;
import org.example.organizer_bot.event.Reply;
import org.example.organizer_bot.flow.FlowContext;
import org.example.organizer_bot.flow.FlowEngine;
import org.example.organizer_bot.flow.FlowMessages;
import org.example.organizer_bot.flow.Keyboards;
import org.example.organizer_bot.model.ConversationState;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Маршрутизация входящих событий.
 * <p>
 * Команды → одноразовые обработчики, текст → кнопки меню или активный диалог,
 * кнопки → движок диалогов или одноразовые действия.
 * Всё событие целиком обрабатывается под локом своей беседы.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UpdateDispatcher {

    private final ConversationRegistry conversationRegistry;
    private final FlowEngine flowEngine;
    private final StartCommandHandler startCommandHandler;
    private final MenuActionHandler menuActionHandler;

    public List<Reply> dispatch(InboundEvent event) {
        ConversationKey key = new ConversationKey(event.getChatId(), event.getUserId());
        return conversationRegistry.withConversation(key, state -> dispatchLocked(event, state));
    }

    private List<Reply> dispatchLocked(InboundEvent event, ConversationState state) {
        FlowContext ctx = new FlowContext(event.getChatId(), event.getUserId(), state);
        try {
            switch (event.getKind()) {
                case COMMAND:
                    return onCommand(ctx, event.getPayload());
                case TEXT:
                    return onText(ctx, event.getPayload());
                case BUTTON:
                    return onButton(ctx, event.getPayload());
                default:
                    return List.of();
            }
        } catch (RuntimeException e) {
            log.error("Необработанная ошибка: event={}, state={}, error={}: {}",
                    event, state.getState(), e.getClass().getSimpleName(), e.getMessage(), e);
            ctx.reset();
            return List.of(Reply.text(ctx.getChatId(), FlowMessages.STORAGE_FAULT));
        }
    }

    private List<Reply> onCommand(FlowContext ctx, String command) {
        String name = command == null ? "" : command.toLowerCase(Locale.ROOT);
        log.debug("Команда: /{}, chatId={}, userId={}", name, ctx.getChatId(), ctx.getUserId());

        switch (name) {
            case "start":
                return startCommandHandler.handle(ctx);
            case "menu":
                return menuActionHandler.showMenu(ctx);
            case "cancel":
                return flowEngine.cancel(ctx);
            case "stop":
                return menuActionHandler.stop(ctx);
            default:
                return notUnderstood(ctx);
        }
    }

    /**
     * Подпись кнопки меню важнее ввода в диалоге: "Add" посреди диалога
     * начинает добавление заново.
     */
    private List<Reply> onText(FlowContext ctx, String text) {
        Optional<MainMenu> menu = MainMenu.fromLabel(text);
        if (menu.isPresent()) {
            log.debug("Кнопка меню: {}, chatId={}", menu.get(), ctx.getChatId());
            return runAction(ctx, BotAction.of(menu.get().getAction()));
        }

        if (ctx.getConversation().isActive()) {
            return flowEngine.onText(ctx, text);
        }
        return notUnderstood(ctx);
    }

    private List<Reply> onButton(FlowContext ctx, String data) {
        Optional<BotAction> action = BotAction.parse(data);
        if (action.isEmpty()) {
            log.warn("Неизвестная кнопка: chatId={}, userId={}", ctx.getChatId(), ctx.getUserId());
            return notUnderstood(ctx);
        }
        log.debug("Кнопка: {}, chatId={}, state={}", action.get().getType(), ctx.getChatId(), ctx.getState());
        return runAction(ctx, action.get());
    }

    private List<Reply> runAction(FlowContext ctx, BotAction action) {
        if (flowEngine.handles(action.getType())) {
            return flowEngine.onAction(ctx, action);
        }
        return menuActionHandler.handle(ctx, action.getType());
    }

    private List<Reply> notUnderstood(FlowContext ctx) {
        return List.of(Reply.builder()
                .chatId(ctx.getChatId())
                .text(FlowMessages.NOT_UNDERSTOOD)
                .buttons(Keyboards.mainMenu())
                .build());
    }
}
