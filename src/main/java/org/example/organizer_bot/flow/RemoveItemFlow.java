package org.example.organizer_bot.flow;

import lombok.extern.slf4j.Slf4j;
import org.example.organizer_bot.event.ActionType;
import org.example.organizer_bot.event.BotAction;
import org.example.organizer_bot.event.Reply;
import org.example.organizer_bot.model.FlowFamily;
import org.example.organizer_bot.model.FlowState;
import org.example.organizer_bot.model.RoleName;
import org.example.organizer_bot.service.ItemService;
import org.example.organizer_bot.service.PermissionService;

import java.util.List;
import java.util.Optional;

/**
 * Удаление товаров по имени. Админ удаляет все совпадения в чате,
 * обычный пользователь — только свои.
 */
@Slf4j
class RemoveItemFlow implements ConversationFlow {

    private final ItemFieldParser parser;
    private final ItemService itemService;
    private final PermissionService permissionService;

    RemoveItemFlow(ItemFieldParser parser, ItemService itemService, PermissionService permissionService) {
        this.parser = parser;
        this.itemService = itemService;
        this.permissionService = permissionService;
    }

    @Override
    public FlowFamily getFamily() {
        return FlowFamily.REMOVE_ITEM;
    }

    List<Reply> start(FlowContext ctx) {
        ctx.reset();
        ctx.moveTo(FlowState.WAITING_REMOVE_ITEM_NAME);
        return List.of(Reply.prompt(ctx.getChatId(), "🗑 Удаление товара\n\n" +
                "Введите точное название товара:"));
    }

    @Override
    public List<Reply> onText(FlowContext ctx, String text) {
        Optional<String> name = parser.name(text);
        if (name.isEmpty()) {
            return List.of(Reply.prompt(ctx.getChatId(), FlowMessages.INVALID_VALUE + parser.namePrompt()));
        }

        Optional<RoleName> role = permissionService.resolveRole(ctx.getUserId());
        if (role.isEmpty()) {
            ctx.reset();
            return List.of(Reply.text(ctx.getChatId(), FlowMessages.NOT_AUTHORIZED));
        }
        // NULL — без фильтра по создателю
        Long creatorId = role.get() == RoleName.ADMIN ? null : ctx.getUserId();

        int deleted;
        try {
            deleted = itemService.deleteByNameAndChat(name.get(), ctx.getChatId(), creatorId);
        } catch (RuntimeException e) {
            log.error("Ошибка удаления товара: chatId={}, error={}: {}",
                    ctx.getChatId(), e.getClass().getSimpleName(), e.getMessage());
            ctx.reset();
            return List.of(Reply.text(ctx.getChatId(), FlowMessages.STORAGE_FAULT));
        }
        ctx.reset();

        String result;
        if (deleted == 0) {
            result = creatorId == null
                    ? "❌ Товар «" + name.get() + "» не найден."
                    : "❌ Среди ваших товаров нет «" + name.get() + "».";
        } else {
            result = "🗑 Удалено товаров «" + name.get() + "»: " + deleted;
        }
        return List.of(Reply.builder()
                .chatId(ctx.getChatId())
                .text(result)
                .buttons(Keyboards.nextActions("🗑 Удалить другой", ActionType.REMOVE_ANOTHER))
                .build());
    }

    @Override
    public List<Reply> onAction(FlowContext ctx, BotAction action) {
        return List.of();
    }
}
