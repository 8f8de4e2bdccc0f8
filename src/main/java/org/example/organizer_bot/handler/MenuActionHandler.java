package org.example.organizer_bot.handler;

import lombok.extern.slf4j.Slf4j;
import org.example.organizer_bot.event.ActionType;
import org.example.organizer_bot.event.Reply;
import org.example.organizer_bot.flow.FlowContext;
import org.example.organizer_bot.flow.FlowEngine;
import org.example.organizer_bot.flow.FlowMessages;
import org.example.organizer_bot.flow.FlowSettings;
import org.example.organizer_bot.flow.Keyboards;
import org.example.organizer_bot.model.Item;
import org.example.organizer_bot.model.ItemDraft;
import org.example.organizer_bot.model.ItemFilter;
import org.example.organizer_bot.service.ItemService;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Одноразовые действия меню: список, тестовое сообщение, меню, стоп.
 * Состояние беседы не используют (кроме сброса при открытии меню).
 */
@Slf4j
@Component
public class MenuActionHandler {

    private static final String TEST_ITEM_NAME = "My Item";
    /** Тип демо-товара, если он есть среди разрешённых; иначе берём первый разрешённый */
    private static final String TEST_ITEM_TYPE = "spare part";
    private static final BigDecimal TEST_ITEM_PRICE = new BigDecimal("0.01");

    private final ItemService itemService;
    private final FlowSettings settings;

    public MenuActionHandler(ItemService itemService, FlowEngine flowEngine) {
        this.itemService = itemService;
        this.settings = flowEngine.getSettings();
    }

    public List<Reply> handle(FlowContext ctx, ActionType action) {
        switch (action) {
            case MENU_GET:
                return listItems(ctx);
            case MENU_TEST_MESSAGE:
                return sendTestItem(ctx);
            case MENU_STOP:
                return stop(ctx);
            case SHOW_MENU:
                return showMenu(ctx);
            default:
                log.warn("Неизвестное действие меню: {}", action);
                return List.of(Reply.text(ctx.getChatId(), FlowMessages.NOT_UNDERSTOOD));
        }
    }

    /** /menu: сбросить диалог и показать inline-меню */
    public List<Reply> showMenu(FlowContext ctx) {
        ctx.reset();
        return List.of(Reply.builder()
                .chatId(ctx.getChatId())
                .text("📋 Меню")
                .buttons(Keyboards.mainMenu())
                .build());
    }

    /**
     * Остановка разрешена только id из app.access.authorized-ids.
     * Процесс не гасим: только подтверждаем и пишем в лог.
     */
    public List<Reply> stop(FlowContext ctx) {
        Long userId = ctx.getUserId();
        if (userId == null || !settings.getAuthorizedIds().contains(userId)) {
            log.info("Попытка остановить бота без прав: userId={}", userId);
            return List.of(Reply.text(ctx.getChatId(),
                    "⛔ Ваш id (" + userId + ") не может останавливать бота."));
        }
        log.warn("Запрошена остановка бота: userId={}, chatId={}", userId, ctx.getChatId());
        return List.of(Reply.text(ctx.getChatId(), "⏹ Запрос на остановку принят."));
    }

    private List<Reply> listItems(FlowContext ctx) {
        List<Item> items;
        try {
            items = itemService.list(ItemFilter.forChat(ctx.getChatId()), settings.getListLimit());
        } catch (RuntimeException e) {
            log.error("Ошибка получения списка товаров: chatId={}, error={}: {}",
                    ctx.getChatId(), e.getClass().getSimpleName(), e.getMessage());
            return List.of(Reply.text(ctx.getChatId(), FlowMessages.STORAGE_FAULT));
        }
        if (items.isEmpty()) {
            return List.of(Reply.text(ctx.getChatId(), "📦 Товаров пока нет."));
        }

        StringBuilder sb = new StringBuilder("📦 Товары (" + items.size() + "):\n\n");
        for (Item item : items) {
            sb.append(item.getName()).append(", ").append(item.getAmount()).append('\n');
        }
        return List.of(Reply.text(ctx.getChatId(), sb.toString().trim()));
    }

    /** Демо-товар с тем же подтверждением, что и у диалога добавления */
    private List<Reply> sendTestItem(FlowContext ctx) {
        ItemDraft draft = new ItemDraft();
        draft.setName(TEST_ITEM_NAME);
        draft.setAmount(1);
        draft.setType(testItemType());
        draft.setPrice(TEST_ITEM_PRICE);
        draft.setAvailable(true);

        Item item;
        try {
            item = itemService.create(draft, ctx.getChatId(), ctx.getUserId());
        } catch (RuntimeException e) {
            log.error("Ошибка создания тестового товара: chatId={}, error={}: {}",
                    ctx.getChatId(), e.getClass().getSimpleName(), e.getMessage());
            return List.of(Reply.text(ctx.getChatId(), FlowMessages.STORAGE_FAULT));
        }
        return List.of(Reply.text(ctx.getChatId(), FlowMessages.itemAccepted(item, settings)));
    }

    private String testItemType() {
        if (settings.isAllowedType(TEST_ITEM_TYPE)) {
            return TEST_ITEM_TYPE;
        }
        return settings.getAllowedTypes().get(0);
    }
}
