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
 * Смена наличия по имени товара: имя → да/нет.
 * Те же правила, что у удаления: админ меняет все совпадения в чате, пользователь — свои.
 */
@Slf4j
class AvailabilityFlow implements ConversationFlow {

    private final ItemFieldParser parser;
    private final ItemService itemService;
    private final PermissionService permissionService;

    AvailabilityFlow(ItemFieldParser parser, ItemService itemService, PermissionService permissionService) {
        this.parser = parser;
        this.itemService = itemService;
        this.permissionService = permissionService;
    }

    @Override
    public FlowFamily getFamily() {
        return FlowFamily.CHANGE_AVAILABILITY;
    }

    List<Reply> start(FlowContext ctx) {
        ctx.reset();
        ctx.moveTo(FlowState.WAITING_AVAILABILITY_ITEM_NAME);
        return List.of(Reply.prompt(ctx.getChatId(), "🔄 Наличие товара\n\n" +
                "Введите точное название товара:"));
    }

    @Override
    public List<Reply> onText(FlowContext ctx, String text) {
        switch (ctx.getState()) {
            case WAITING_AVAILABILITY_ITEM_NAME: {
                Optional<String> name = parser.name(text);
                if (name.isEmpty()) {
                    return List.of(Reply.prompt(ctx.getChatId(), FlowMessages.INVALID_VALUE + parser.namePrompt()));
                }
                ctx.getConversation().setItemName(name.get());
                ctx.moveTo(FlowState.WAITING_AVAILABILITY_STATUS);
                return List.of(statusQuestion(ctx, "Товар «" + name.get() + "» в наличии?"));
            }
            case WAITING_AVAILABILITY_STATUS: {
                Optional<Boolean> available = ItemFieldParser.yesNo(text);
                if (available.isEmpty()) {
                    return List.of(statusQuestion(ctx, FlowMessages.INVALID_VALUE + "Товар в наличии? (да/нет)"));
                }
                return apply(ctx, available.get());
            }
            default:
                log.warn("Неожиданный шаг наличия: state={}", ctx.getState());
                return List.of();
        }
    }

    @Override
    public List<Reply> onAction(FlowContext ctx, BotAction action) {
        if (action.getType() != ActionType.AVAILABILITY_STATUS) {
            return List.of();
        }
        if (!action.isYesNo()) {
            return List.of(statusQuestion(ctx, FlowMessages.INVALID_VALUE + "Товар в наличии?"));
        }
        return apply(ctx, action.isYes());
    }

    private List<Reply> apply(FlowContext ctx, boolean available) {
        String name = ctx.getConversation().getItemName();

        Optional<RoleName> role = permissionService.resolveRole(ctx.getUserId());
        if (role.isEmpty()) {
            ctx.reset();
            return List.of(Reply.text(ctx.getChatId(), FlowMessages.NOT_AUTHORIZED));
        }
        Long creatorId = role.get() == RoleName.ADMIN ? null : ctx.getUserId();

        int updated;
        try {
            updated = itemService.updateAvailability(name, available, ctx.getChatId(), creatorId);
        } catch (RuntimeException e) {
            log.error("Ошибка смены наличия: chatId={}, error={}: {}",
                    ctx.getChatId(), e.getClass().getSimpleName(), e.getMessage());
            ctx.reset();
            return List.of(Reply.text(ctx.getChatId(), FlowMessages.STORAGE_FAULT));
        }
        ctx.reset();

        String result = updated == 0
                ? "❌ Товар «" + name + "» не найден" + (creatorId == null ? "." : " среди ваших товаров.")
                : "✅ Наличие «" + name + "»: " + (available ? "в наличии" : "нет в наличии") +
                " (обновлено: " + updated + ")";
        return List.of(Reply.builder()
                .chatId(ctx.getChatId())
                .text(result)
                .buttons(Keyboards.nextActions("🔄 Изменить ещё", ActionType.AVAILABILITY_AGAIN))
                .build());
    }

    private Reply statusQuestion(FlowContext ctx, String text) {
        return Reply.builder()
                .chatId(ctx.getChatId())
                .text(text)
                .buttons(Keyboards.yesNo(ActionType.AVAILABILITY_STATUS))
                .build();
    }
}
