package org.example.organizer_bot.flow;

import lombok.extern.slf4j.Slf4j;
import org.example.organizer_bot.event.ActionType;
import org.example.organizer_bot.event.BotAction;
import org.example.organizer_bot.event.Reply;
import org.example.organizer_bot.model.FlowFamily;
import org.example.organizer_bot.model.FlowState;
import org.example.organizer_bot.model.Item;
import org.example.organizer_bot.model.ItemDraft;
import org.example.organizer_bot.service.ItemService;
import org.example.organizer_bot.validation.WorkingHours;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Добавление товара: название → количество → тип → цена → наличие → сохранение.
 */
@Slf4j
class AddItemFlow implements ConversationFlow {

    private final FlowSettings settings;
    private final ItemFieldParser parser;
    private final ItemService itemService;
    private final Clock clock;

    AddItemFlow(FlowSettings settings, ItemFieldParser parser, ItemService itemService, Clock clock) {
        this.settings = settings;
        this.parser = parser;
        this.itemService = itemService;
        this.clock = clock;
    }

    @Override
    public FlowFamily getFamily() {
        return FlowFamily.ADD_ITEM;
    }

    /**
     * Начать добавление. Вне рабочего времени диалог не начинается.
     */
    List<Reply> start(FlowContext ctx) {
        if (!WorkingHours.withinWorkingHours(clock.instant(), settings.getWorkingHoursZone(),
                settings.isSkipWorkingHours())) {
            log.info("Добавление вне рабочего времени: chatId={}, userId={}", ctx.getChatId(), ctx.getUserId());
            return List.of(Reply.text(ctx.getChatId(), FlowMessages.OUTSIDE_WORKING_HOURS));
        }

        ctx.reset();
        ctx.getConversation().setDraft(new ItemDraft());
        ctx.moveTo(FlowState.WAITING_ITEM_NAME);
        log.info("Начало добавления товара: chatId={}, userId={}", ctx.getChatId(), ctx.getUserId());

        return List.of(Reply.prompt(ctx.getChatId(), "📦 Добавление товара\n\n" +
                "Шаг 1 из 5\n" + parser.namePrompt()));
    }

    @Override
    public List<Reply> onText(FlowContext ctx, String text) {
        ItemDraft draft = ctx.getConversation().getDraft();

        switch (ctx.getState()) {
            case WAITING_ITEM_NAME: {
                Optional<String> name = parser.name(text);
                if (name.isEmpty()) {
                    return retry(ctx, parser.namePrompt());
                }
                draft.setName(name.get());
                ctx.moveTo(FlowState.WAITING_ITEM_AMOUNT);
                return List.of(Reply.prompt(ctx.getChatId(), "Шаг 2 из 5\n" + parser.amountPrompt()));
            }
            case WAITING_ITEM_AMOUNT: {
                Optional<Integer> amount = parser.amount(text);
                if (amount.isEmpty()) {
                    return retry(ctx, parser.amountPrompt());
                }
                draft.setAmount(amount.get());
                ctx.moveTo(FlowState.WAITING_ITEM_TYPE);
                return List.of(typeQuestion(ctx, "Шаг 3 из 5\n" + parser.typePrompt()));
            }
            case WAITING_ITEM_TYPE: {
                Optional<String> type = parser.type(text);
                if (type.isEmpty()) {
                    return List.of(typeQuestion(ctx, FlowMessages.INVALID_VALUE + parser.typePrompt()));
                }
                return acceptType(ctx, type.get());
            }
            case WAITING_ITEM_PRICE: {
                Optional<BigDecimal> price = parser.price(text);
                if (price.isEmpty()) {
                    return retry(ctx, parser.pricePrompt());
                }
                draft.setPrice(price.get());
                ctx.moveTo(FlowState.WAITING_ITEM_AVAILABILITY);
                return List.of(availabilityQuestion(ctx, "Шаг 5 из 5\nТовар в наличии?"));
            }
            case WAITING_ITEM_AVAILABILITY: {
                Optional<Boolean> available = ItemFieldParser.yesNo(text);
                if (available.isEmpty()) {
                    return List.of(availabilityQuestion(ctx, FlowMessages.INVALID_VALUE + "Товар в наличии? (да/нет)"));
                }
                return commit(ctx, available.get());
            }
            default:
                log.warn("Неожиданный шаг добавления: state={}", ctx.getState());
                return List.of();
        }
    }

    @Override
    public List<Reply> onAction(FlowContext ctx, BotAction action) {
        switch (action.getType()) {
            case ITEM_TYPE: {
                // Кнопка могла остаться от старых настроек
                Optional<String> type = parser.type(action.getValue());
                if (type.isEmpty()) {
                    return List.of(typeQuestion(ctx, FlowMessages.INVALID_VALUE + parser.typePrompt()));
                }
                return acceptType(ctx, type.get());
            }
            case ITEM_AVAILABILITY:
                if (!action.isYesNo()) {
                    return List.of(availabilityQuestion(ctx, FlowMessages.INVALID_VALUE + "Товар в наличии?"));
                }
                return commit(ctx, action.isYes());
            default:
                return List.of();
        }
    }

    private List<Reply> acceptType(FlowContext ctx, String type) {
        ctx.getConversation().getDraft().setType(type);
        ctx.moveTo(FlowState.WAITING_ITEM_PRICE);
        return List.of(Reply.prompt(ctx.getChatId(), "Шаг 4 из 5\n" + parser.pricePrompt()));
    }

    private List<Reply> commit(FlowContext ctx, boolean available) {
        ItemDraft draft = ctx.getConversation().getDraft();
        draft.setAvailable(available);

        Item item;
        try {
            item = itemService.create(draft, ctx.getChatId(), ctx.getUserId());
        } catch (RuntimeException e) {
            log.error("Ошибка сохранения товара: chatId={}, error={}: {}",
                    ctx.getChatId(), e.getClass().getSimpleName(), e.getMessage());
            ctx.reset();
            return List.of(Reply.text(ctx.getChatId(), FlowMessages.STORAGE_FAULT));
        }
        ctx.reset();

        return List.of(Reply.builder()
                .chatId(ctx.getChatId())
                .text(FlowMessages.itemAccepted(item, settings))
                .buttons(Keyboards.nextActions("➕ Добавить ещё", ActionType.ADD_ANOTHER))
                .build());
    }

    private Reply typeQuestion(FlowContext ctx, String text) {
        return Reply.builder()
                .chatId(ctx.getChatId())
                .text(text)
                .buttons(Keyboards.itemTypes(ActionType.ITEM_TYPE, settings.getAllowedTypes()))
                .build();
    }

    private Reply availabilityQuestion(FlowContext ctx, String text) {
        return Reply.builder()
                .chatId(ctx.getChatId())
                .text(text)
                .buttons(Keyboards.yesNo(ActionType.ITEM_AVAILABILITY))
                .build();
    }

    private List<Reply> retry(FlowContext ctx, String question) {
        return List.of(Reply.prompt(ctx.getChatId(), FlowMessages.INVALID_VALUE + question));
    }
}
