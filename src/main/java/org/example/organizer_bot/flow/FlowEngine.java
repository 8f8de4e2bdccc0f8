package org.example.organizer_bot.flow;

import lombok.extern.slf4j.Slf4j;
import org.example.organizer_bot.event.ActionType;
import org.example.organizer_bot.event.BotAction;
import org.example.organizer_bot.event.Reply;
import org.example.organizer_bot.model.FlowFamily;
import org.example.organizer_bot.model.FlowState;
import org.example.organizer_bot.service.ItemService;
import org.example.organizer_bot.service.PermissionService;
import org.example.organizer_bot.service.UserService;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Движок диалогов.
 * <p>
 * На вход — текст или разобранная кнопка плюс состояние беседы, на выход — ответы.
 * Шаг беседы меняется только здесь и в диалогах. Сам движок ничего не знает
 * про Telegram и вызывается уже под локом беседы.
 */
@Slf4j
public class FlowEngine {

    private final FlowSettings settings;

    private final AddItemFlow addItemFlow;
    private final UpdateItemFlow updateItemFlow;
    private final RemoveItemFlow removeItemFlow;
    private final AvailabilityFlow availabilityFlow;
    private final AdminUserFlow adminUserFlow;

    private final Map<FlowFamily, ConversationFlow> flows = new EnumMap<>(FlowFamily.class);

    public FlowEngine(FlowSettings settings,
                      ItemService itemService,
                      UserService userService,
                      PermissionService permissionService,
                      Clock clock) {
        this.settings = settings;
        ItemFieldParser parser = new ItemFieldParser(settings);

        this.addItemFlow = new AddItemFlow(settings, parser, itemService, clock);
        this.updateItemFlow = new UpdateItemFlow(settings, parser, itemService, permissionService);
        this.removeItemFlow = new RemoveItemFlow(parser, itemService, permissionService);
        this.availabilityFlow = new AvailabilityFlow(parser, itemService, permissionService);
        this.adminUserFlow = new AdminUserFlow(userService, permissionService);

        register(addItemFlow);
        register(updateItemFlow);
        register(removeItemFlow);
        register(availabilityFlow);
        register(adminUserFlow);
        log.info("Движок диалогов создан: {}", settings);
    }

    private void register(ConversationFlow flow) {
        flows.put(flow.getFamily(), flow);
    }

    public FlowSettings getSettings() {
        return settings;
    }

    /**
     * Может ли движок обработать это действие (старт диалога или кнопка внутри диалога).
     * Остальные действия (список, тестовое сообщение, меню) — одноразовые, их делает диспетчер.
     */
    public boolean handles(ActionType type) {
        if (type.isFlowBound()) {
            return true;
        }
        switch (type) {
            case MENU_ADD:
            case ADD_ANOTHER:
            case MENU_UPDATE:
            case UPDATE_ANOTHER:
            case MENU_REMOVE:
            case REMOVE_ANOTHER:
            case MENU_AVAILABILITY:
            case AVAILABILITY_AGAIN:
            case MENU_ADMIN:
            case ADMIN_LIST_USERS:
            case ADMIN_ADD_USER:
            case ADMIN_SET_ROLE:
            case ADMIN_REMOVE_USER:
                return true;
            default:
                return false;
        }
    }

    /**
     * Текст пользователя. Если активного диалога нет — пустой список,
     * диспетчер сам ответит «не понял».
     */
    public List<Reply> onText(FlowContext ctx, String text) {
        FlowState state = ctx.getState();
        if (state == FlowState.NONE) {
            return List.of();
        }
        return flows.get(state.getFamily()).onText(ctx, text);
    }

    /**
     * Нажатие кнопки. Кнопка внутри диалога принимается только на том шаге,
     * на котором её показали; иначе — «действие устарело», состояние не трогаем.
     */
    public List<Reply> onAction(FlowContext ctx, BotAction action) {
        ActionType type = action.getType();

        if (type.isFlowBound()) {
            if (ctx.getState() != type.getExpectedState()) {
                log.info("Устаревшая кнопка: action={}, state={}, chatId={}", type, ctx.getState(), ctx.getChatId());
                return List.of(Reply.builder()
                        .chatId(ctx.getChatId())
                        .text(FlowMessages.EXPIRED)
                        .buttons(Keyboards.mainMenu())
                        .build());
            }
            return flows.get(type.getExpectedState().getFamily()).onAction(ctx, action);
        }

        switch (type) {
            case MENU_ADD:
            case ADD_ANOTHER:
                return addItemFlow.start(ctx);
            case MENU_UPDATE:
            case UPDATE_ANOTHER:
                return updateItemFlow.start(ctx);
            case MENU_REMOVE:
            case REMOVE_ANOTHER:
                return removeItemFlow.start(ctx);
            case MENU_AVAILABILITY:
            case AVAILABILITY_AGAIN:
                return availabilityFlow.start(ctx);
            case MENU_ADMIN:
                return adminUserFlow.openPanel(ctx);
            case ADMIN_LIST_USERS:
                return adminUserFlow.listUsers(ctx);
            case ADMIN_ADD_USER:
                return adminUserFlow.startAddUser(ctx);
            case ADMIN_SET_ROLE:
                return adminUserFlow.startSetRole(ctx);
            case ADMIN_REMOVE_USER:
                return adminUserFlow.startRemoveUser(ctx);
            default:
                throw new IllegalArgumentException("Действие не для движка диалогов: " + type);
        }
    }

    /**
     * Отмена. Повторная отмена без диалога даёт тот же ответ.
     */
    public List<Reply> cancel(FlowContext ctx) {
        if (ctx.getConversation().isActive()) {
            log.info("Диалог отменён: state={}, chatId={}, userId={}", ctx.getState(), ctx.getChatId(), ctx.getUserId());
        }
        ctx.reset();
        return List.of(Reply.text(ctx.getChatId(), FlowMessages.CANCELLED));
    }
}
