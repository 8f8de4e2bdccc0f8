package org.example.organizer_bot.flow;

import lombok.extern.slf4j.Slf4j;
import org.example.organizer_bot.event.ActionType;
import org.example.organizer_bot.event.BotAction;
import org.example.organizer_bot.event.Reply;
import org.example.organizer_bot.model.FlowFamily;
import org.example.organizer_bot.model.FlowState;
import org.example.organizer_bot.model.Item;
import org.example.organizer_bot.model.ItemField;
import org.example.organizer_bot.model.ItemPatch;
import org.example.organizer_bot.model.RoleName;
import org.example.organizer_bot.service.ItemService;
import org.example.organizer_bot.service.PermissionService;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Изменение товара.
 * <p>
 * Товар ищется по точному имени в чате. Не найден, найдено несколько
 * или нет прав — диалог заканчивается. Дальше пользователь выбирает поля,
 * правки копятся в {@link ItemPatch} и применяются одним запросом по «Готово».
 */
@Slf4j
class UpdateItemFlow implements ConversationFlow {

    static final String DONE = "done";

    private final FlowSettings settings;
    private final ItemFieldParser parser;
    private final ItemService itemService;
    private final PermissionService permissionService;

    UpdateItemFlow(FlowSettings settings, ItemFieldParser parser,
                   ItemService itemService, PermissionService permissionService) {
        this.settings = settings;
        this.parser = parser;
        this.itemService = itemService;
        this.permissionService = permissionService;
    }

    @Override
    public FlowFamily getFamily() {
        return FlowFamily.UPDATE_ITEM;
    }

    List<Reply> start(FlowContext ctx) {
        ctx.reset();
        ctx.moveTo(FlowState.WAITING_UPDATE_ITEM_NAME);
        log.info("Начало изменения товара: chatId={}, userId={}", ctx.getChatId(), ctx.getUserId());
        return List.of(Reply.prompt(ctx.getChatId(), "✏️ Изменение товара\n\n" +
                "Введите точное название товара:"));
    }

    @Override
    public List<Reply> onText(FlowContext ctx, String text) {
        ItemPatch patch = ctx.getConversation().getPatch();

        switch (ctx.getState()) {
            case WAITING_UPDATE_ITEM_NAME:
                return lookup(ctx, text);
            case WAITING_UPDATE_FIELD:
                // Поле можно и написать текстом: "price", "done"
                return selectField(ctx, text == null ? "" : text.trim().toLowerCase(Locale.ROOT));
            case WAITING_UPDATE_NAME: {
                Optional<String> name = parser.name(text);
                if (name.isEmpty()) {
                    return retry(ctx, parser.namePrompt());
                }
                patch.setName(name.get());
                return backToFields(ctx);
            }
            case WAITING_UPDATE_AMOUNT: {
                Optional<Integer> amount = parser.amount(text);
                if (amount.isEmpty()) {
                    return retry(ctx, parser.amountPrompt());
                }
                patch.setAmount(amount.get());
                return backToFields(ctx);
            }
            case WAITING_UPDATE_TYPE: {
                Optional<String> type = parser.type(text);
                if (type.isEmpty()) {
                    return List.of(typeQuestion(ctx, FlowMessages.INVALID_VALUE + parser.typePrompt()));
                }
                patch.setType(type.get());
                return backToFields(ctx);
            }
            case WAITING_UPDATE_PRICE: {
                Optional<BigDecimal> price = parser.price(text);
                if (price.isEmpty()) {
                    return retry(ctx, parser.pricePrompt());
                }
                patch.setPrice(price.get());
                return backToFields(ctx);
            }
            case WAITING_UPDATE_AVAILABILITY: {
                Optional<Boolean> available = ItemFieldParser.yesNo(text);
                if (available.isEmpty()) {
                    return List.of(availabilityQuestion(ctx, FlowMessages.INVALID_VALUE + "Товар в наличии? (да/нет)"));
                }
                patch.setAvailable(available.get());
                return backToFields(ctx);
            }
            default:
                log.warn("Неожиданный шаг изменения: state={}", ctx.getState());
                return List.of();
        }
    }

    @Override
    public List<Reply> onAction(FlowContext ctx, BotAction action) {
        switch (action.getType()) {
            case UPDATE_FIELD:
                return selectField(ctx, action.getValue());
            case UPDATE_TYPE: {
                Optional<String> type = parser.type(action.getValue());
                if (type.isEmpty()) {
                    return List.of(typeQuestion(ctx, FlowMessages.INVALID_VALUE + parser.typePrompt()));
                }
                ctx.getConversation().getPatch().setType(type.get());
                return backToFields(ctx);
            }
            case UPDATE_AVAILABILITY:
                if (!action.isYesNo()) {
                    return List.of(availabilityQuestion(ctx, FlowMessages.INVALID_VALUE + "Товар в наличии?"));
                }
                ctx.getConversation().getPatch().setAvailable(action.isYes());
                return backToFields(ctx);
            default:
                return List.of();
        }
    }

    /**
     * Найти товар по имени и проверить права.
     */
    private List<Reply> lookup(FlowContext ctx, String text) {
        Optional<String> name = parser.name(text);
        if (name.isEmpty()) {
            return retry(ctx, parser.namePrompt());
        }

        List<Item> matches;
        try {
            matches = itemService.findByExactName(ctx.getChatId(), name.get());
        } catch (RuntimeException e) {
            return storageFault(ctx, e, true);
        }

        if (matches.isEmpty()) {
            ctx.reset();
            return List.of(finished(ctx, "❌ Товар «" + name.get() + "» не найден."));
        }
        if (matches.size() > 1) {
            log.info("Неоднозначное имя при изменении: chatId={}, matches={}", ctx.getChatId(), matches.size());
            ctx.reset();
            return List.of(finished(ctx, "⚠️ Найдено несколько товаров с названием «" + name.get() + "» (" +
                    matches.size() + ").\nУдалите лишние и повторите изменение."));
        }

        Item item = matches.get(0);
        if (!canManage(ctx, item)) {
            log.info("Нет прав на изменение: itemId={}, userId={}", item.getId(), ctx.getUserId());
            ctx.reset();
            return List.of(Reply.text(ctx.getChatId(), FlowMessages.NOT_AUTHORIZED));
        }

        ctx.getConversation().setUpdateItemId(item.getId());
        ctx.getConversation().setPatch(new ItemPatch());
        ctx.moveTo(FlowState.WAITING_UPDATE_FIELD);
        return List.of(fieldMenu(ctx, "Найден товар:\n" + describe(item) + "\n\nЧто изменить?"));
    }

    private List<Reply> selectField(FlowContext ctx, String code) {
        if (DONE.equals(code)) {
            return apply(ctx);
        }
        Optional<ItemField> field = ItemField.fromCode(code);
        if (field.isEmpty()) {
            return List.of(fieldMenu(ctx, FlowMessages.INVALID_VALUE + "Выберите поле:"));
        }

        switch (field.get()) {
            case NAME:
                ctx.moveTo(FlowState.WAITING_UPDATE_NAME);
                return List.of(Reply.prompt(ctx.getChatId(), "Новое название.\n" + parser.namePrompt()));
            case AMOUNT:
                ctx.moveTo(FlowState.WAITING_UPDATE_AMOUNT);
                return List.of(Reply.prompt(ctx.getChatId(), "Новое количество.\n" + parser.amountPrompt()));
            case TYPE:
                ctx.moveTo(FlowState.WAITING_UPDATE_TYPE);
                return List.of(typeQuestion(ctx, "Новый тип.\n" + parser.typePrompt()));
            case PRICE:
                ctx.moveTo(FlowState.WAITING_UPDATE_PRICE);
                return List.of(Reply.prompt(ctx.getChatId(), "Новая цена.\n" + parser.pricePrompt()));
            case AVAILABILITY:
                ctx.moveTo(FlowState.WAITING_UPDATE_AVAILABILITY);
                return List.of(availabilityQuestion(ctx, "Товар в наличии?"));
            default:
                return List.of(fieldMenu(ctx, "Выберите поле:"));
        }
    }

    /**
     * «Готово»: перечитать товар, ещё раз проверить права и сохранить правки.
     * Ошибка БД оставляет пользователя в меню полей, чтобы можно было повторить.
     */
    private List<Reply> apply(FlowContext ctx) {
        ItemPatch patch = ctx.getConversation().getPatch();
        if (patch == null || patch.isEmpty()) {
            return List.of(fieldMenu(ctx, "Изменений нет. Выберите поле или нажмите «Готово» после правок."));
        }
        Long itemId = ctx.getConversation().getUpdateItemId();

        Optional<Item> updated;
        try {
            Optional<Item> current = itemService.getById(itemId);
            if (current.isEmpty()) {
                ctx.reset();
                return List.of(finished(ctx, "❌ Товар уже удалён."));
            }
            if (!canManage(ctx, current.get())) {
                log.info("Права пропали до сохранения: itemId={}, userId={}", itemId, ctx.getUserId());
                ctx.reset();
                return List.of(Reply.text(ctx.getChatId(), FlowMessages.NOT_AUTHORIZED));
            }
            updated = itemService.updateById(itemId, patch);
        } catch (RuntimeException e) {
            return storageFault(ctx, e, false);
        }

        ctx.reset();
        if (updated.isEmpty()) {
            return List.of(finished(ctx, "❌ Товар уже удалён."));
        }
        log.info("Товар изменён через диалог: itemId={}, userId={}", itemId, ctx.getUserId());
        return List.of(finished(ctx, "✅ Товар изменён:\n" + describe(updated.get())));
    }

    private boolean canManage(FlowContext ctx, Item item) {
        RoleName role = permissionService.resolveRole(ctx.getUserId()).orElse(null);
        return permissionService.canManageItem(item.getCreatedByUserId(), ctx.getUserId(), role);
    }

    private List<Reply> backToFields(FlowContext ctx) {
        ctx.moveTo(FlowState.WAITING_UPDATE_FIELD);
        return List.of(fieldMenu(ctx, "Правки:\n" + describe(ctx.getConversation().getPatch()) +
                "\n\nИзменить ещё что-то или «Готово»?"));
    }

    private List<Reply> storageFault(FlowContext ctx, RuntimeException e, boolean terminal) {
        log.error("Ошибка БД в диалоге изменения: chatId={}, error={}: {}",
                ctx.getChatId(), e.getClass().getSimpleName(), e.getMessage());
        if (terminal) {
            ctx.reset();
            return List.of(Reply.text(ctx.getChatId(), FlowMessages.STORAGE_FAULT));
        }
        return List.of(fieldMenu(ctx, FlowMessages.STORAGE_FAULT));
    }

    private String describe(Item item) {
        StringBuilder sb = new StringBuilder()
                .append("Название: ").append(item.getName()).append('\n')
                .append("Количество: ").append(item.getAmount()).append('\n')
                .append("Тип: ").append(item.getType()).append('\n')
                .append("Цена: ").append(item.getPrice() == null ? "—" : item.getPrice().toPlainString()).append('\n')
                .append("В наличии: ").append(FlowMessages.yesNo(Boolean.TRUE.equals(item.getAvailable())));
        return sb.toString();
    }

    private String describe(ItemPatch patch) {
        StringBuilder sb = new StringBuilder();
        if (patch.getName() != null) {
            sb.append("Название → ").append(patch.getName()).append('\n');
        }
        if (patch.getAmount() != null) {
            sb.append("Количество → ").append(patch.getAmount()).append('\n');
        }
        if (patch.getType() != null) {
            sb.append("Тип → ").append(patch.getType()).append('\n');
        }
        if (patch.getPrice() != null) {
            sb.append("Цена → ").append(patch.getPrice().toPlainString()).append('\n');
        }
        if (patch.getAvailable() != null) {
            sb.append("В наличии → ").append(FlowMessages.yesNo(patch.getAvailable())).append('\n');
        }
        return sb.toString().trim();
    }

    private Reply fieldMenu(FlowContext ctx, String text) {
        return Reply.builder()
                .chatId(ctx.getChatId())
                .text(text)
                .buttons(Keyboards.updateFields())
                .build();
    }

    private Reply typeQuestion(FlowContext ctx, String text) {
        return Reply.builder()
                .chatId(ctx.getChatId())
                .text(text)
                .buttons(Keyboards.itemTypes(ActionType.UPDATE_TYPE, settings.getAllowedTypes()))
                .build();
    }

    private Reply availabilityQuestion(FlowContext ctx, String text) {
        return Reply.builder()
                .chatId(ctx.getChatId())
                .text(text)
                .buttons(Keyboards.yesNo(ActionType.UPDATE_AVAILABILITY))
                .build();
    }

    private Reply finished(FlowContext ctx, String text) {
        return Reply.builder()
                .chatId(ctx.getChatId())
                .text(text)
                .buttons(Keyboards.nextActions("✏️ Изменить другой", ActionType.UPDATE_ANOTHER))
                .build();
    }

    private List<Reply> retry(FlowContext ctx, String question) {
        return List.of(Reply.prompt(ctx.getChatId(), FlowMessages.INVALID_VALUE + question));
    }
}
