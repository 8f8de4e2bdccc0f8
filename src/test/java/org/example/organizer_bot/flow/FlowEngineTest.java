package org.example.organizer_bot.flow;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.example.organizer_bot.event.ActionType;
import org.example.organizer_bot.event.BotAction;
import org.example.organizer_bot.event.Reply;
import org.example.organizer_bot.model.ConversationState;
import org.example.organizer_bot.model.FlowState;
import org.example.organizer_bot.model.Item;
import org.example.organizer_bot.model.ItemDraft;
import org.example.organizer_bot.model.ItemPatch;
import org.example.organizer_bot.model.RoleName;
import org.example.organizer_bot.service.ItemService;
import org.example.organizer_bot.service.PermissionService;
import org.example.organizer_bot.service.UserService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;

class FlowEngineTest {

    private static final long CHAT = 10L;
    private static final long USER = 5L;
    private static final long OTHER_USER = 7L;

    private ItemService itemService;
    private UserService userService;
    private PermissionService permissionService;
    private FlowEngine engine;

    private ConversationState state;
    private FlowContext ctx;

    @BeforeEach
    void setUp() {
        itemService = Mockito.mock(ItemService.class);
        userService = Mockito.mock(UserService.class);
        permissionService = Mockito.mock(PermissionService.class);

        Mockito.when(permissionService.resolveRole(anyLong())).thenReturn(Optional.of(RoleName.USER));
        Mockito.when(permissionService.canManageItem(any(), any(), any())).thenCallRealMethod();

        engine = newEngine(FlowSettings.builder()
                .allowedType("spare part")
                .allowedType("miscellaneous")
                .pricedType("spare part")
                .build(), Clock.systemUTC());

        state = new ConversationState();
        ctx = new FlowContext(CHAT, USER, state);
    }

    private FlowEngine newEngine(FlowSettings settings, Clock clock) {
        return new FlowEngine(settings, itemService, userService, permissionService, clock);
    }

    private List<Reply> text(String value) {
        return engine.onText(ctx, value);
    }

    private List<Reply> press(BotAction action) {
        return engine.onAction(ctx, action);
    }

    private static Item item(long id, String name, Long creator) {
        return Item.builder()
                .id(id)
                .name(name)
                .amount(1)
                .type("miscellaneous")
                .available(false)
                .chatId(CHAT)
                .createdByUserId(creator)
                .build();
    }

    private static String lastText(List<Reply> replies) {
        assertThat(replies).isNotEmpty();
        return replies.get(replies.size() - 1).getText();
    }

    // ============================================
    // ДОБАВЛЕНИЕ
    // ============================================

    @Test
    void addFlowCreatesItemAndOffersNextActions() {
        Mockito.when(itemService.create(any(), eq(CHAT), eq(USER)))
                .thenAnswer(inv -> {
                    ItemDraft d = inv.getArgument(0);
                    return Item.builder().id(1L).name(d.getName()).amount(d.getAmount()).type(d.getType())
                            .price(d.getPrice()).available(d.getAvailable()).chatId(CHAT).createdByUserId(USER).build();
                });

        press(BotAction.of(ActionType.MENU_ADD));
        assertThat(state.getState()).isEqualTo(FlowState.WAITING_ITEM_NAME);

        text("Lamp");
        text("3");
        assertThat(state.getState()).isEqualTo(FlowState.WAITING_ITEM_TYPE);

        press(BotAction.of(ActionType.ITEM_TYPE, "miscellaneous"));
        text("9.99");
        List<Reply> replies = press(BotAction.yesNo(ActionType.ITEM_AVAILABILITY, false));

        ArgumentCaptor<ItemDraft> draft = ArgumentCaptor.forClass(ItemDraft.class);
        Mockito.verify(itemService).create(draft.capture(), eq(CHAT), eq(USER));
        assertThat(draft.getValue().getName()).isEqualTo("Lamp");
        assertThat(draft.getValue().getAmount()).isEqualTo(3);
        assertThat(draft.getValue().getType()).isEqualTo("miscellaneous");
        assertThat(draft.getValue().getPrice()).isEqualByComparingTo("9.99");
        assertThat(draft.getValue().getAvailable()).isFalse();

        assertThat(state.getState()).isEqualTo(FlowState.NONE);
        assertThat(state.getDraft()).isNull();
        assertThat(replies.get(0).actions()).containsExactly(
                BotAction.of(ActionType.ADD_ANOTHER), BotAction.of(ActionType.SHOW_MENU));
        // Цена показывается только для priced-типов
        assertThat(replies.get(0).getText()).doesNotContain("Цена");
    }

    @Test
    void typedTypeAndAvailabilityWorkLikeButtons() {
        Mockito.when(itemService.create(any(), anyLong(), anyLong()))
                .thenReturn(item(1L, "Bolt", USER));

        press(BotAction.of(ActionType.MENU_ADD));
        text("Bolt");
        text("2");
        text("Spare Part");
        assertThat(state.getDraft().getType()).isEqualTo("spare part");
        text("1.005");
        assertThat(state.getDraft().getPrice()).isEqualByComparingTo("1.01");
        text("да");

        Mockito.verify(itemService).create(any(), eq(CHAT), eq(USER));
        assertThat(state.getState()).isEqualTo(FlowState.NONE);
    }

    @Test
    void invalidInputRepromptsWithoutAdvancing() {
        press(BotAction.of(ActionType.MENU_ADD));

        text("Лампа");
        assertThat(state.getState()).isEqualTo(FlowState.WAITING_ITEM_NAME);

        text("Lamp");
        for (String bad : List.of("0", "-1", "1000001", "3.5", "three")) {
            text(bad);
            assertThat(state.getState()).isEqualTo(FlowState.WAITING_ITEM_AMOUNT);
        }

        text("1000000");
        text("furniture");
        assertThat(state.getState()).isEqualTo(FlowState.WAITING_ITEM_TYPE);

        text("miscellaneous");
        for (String bad : List.of("-1", "1000000.01", "1,5", "abc")) {
            text(bad);
            assertThat(state.getState()).isEqualTo(FlowState.WAITING_ITEM_PRICE);
        }

        text("0");
        text("maybe");
        assertThat(state.getState()).isEqualTo(FlowState.WAITING_ITEM_AVAILABILITY);
        Mockito.verifyNoInteractions(itemService);
    }

    @Test
    void addFlowIsClosedOutsideWorkingHours() {
        // 2024-06-16 — воскресенье
        Clock sunday = Clock.fixed(Instant.parse("2024-06-16T12:00:00Z"), ZoneOffset.UTC);
        engine = newEngine(FlowSettings.builder()
                .allowedType("miscellaneous")
                .skipWorkingHours(false)
                .build(), sunday);

        List<Reply> replies = press(BotAction.of(ActionType.MENU_ADD));

        assertThat(lastText(replies)).isEqualTo(FlowMessages.OUTSIDE_WORKING_HOURS);
        assertThat(state.getState()).isEqualTo(FlowState.NONE);
    }

    @Test
    void storageFaultOnCommitClearsState() {
        Mockito.when(itemService.create(any(), anyLong(), anyLong()))
                .thenThrow(new DataAccessResourceFailureException("db down"));

        press(BotAction.of(ActionType.MENU_ADD));
        text("Lamp");
        text("1");
        text("miscellaneous");
        text("1");
        List<Reply> replies = text("no");

        assertThat(lastText(replies)).isEqualTo(FlowMessages.STORAGE_FAULT);
        assertThat(state.getState()).isEqualTo(FlowState.NONE);
    }

    // ============================================
    // УСТАРЕВШИЕ КНОПКИ, ОТМЕНА
    // ============================================

    @Test
    void staleButtonIsRejectedWithoutMutation() {
        press(BotAction.of(ActionType.MENU_ADD));
        text("Lamp");

        List<Reply> replies = press(BotAction.of(ActionType.ITEM_TYPE, "miscellaneous"));

        assertThat(lastText(replies)).isEqualTo(FlowMessages.EXPIRED);
        assertThat(state.getState()).isEqualTo(FlowState.WAITING_ITEM_AMOUNT);
        assertThat(state.getDraft().getType()).isNull();
    }

    @Test
    void buttonFromFinishedFlowIsExpired() {
        List<Reply> replies = press(BotAction.yesNo(ActionType.AVAILABILITY_STATUS, true));

        assertThat(lastText(replies)).isEqualTo(FlowMessages.EXPIRED);
        assertThat(state.getState()).isEqualTo(FlowState.NONE);
        Mockito.verifyNoInteractions(itemService);
    }

    @Test
    void cancelTwiceIsNeutralBothTimes() {
        List<Reply> first = engine.cancel(ctx);
        List<Reply> second = engine.cancel(ctx);

        assertThat(lastText(first)).isEqualTo(FlowMessages.CANCELLED);
        assertThat(lastText(second)).isEqualTo(FlowMessages.CANCELLED);
        assertThat(state.getState()).isEqualTo(FlowState.NONE);
    }

    @Test
    void cancelClearsActiveFlow() {
        press(BotAction.of(ActionType.MENU_ADD));
        text("Lamp");

        engine.cancel(ctx);

        assertThat(state.getState()).isEqualTo(FlowState.NONE);
        assertThat(state.getDraft()).isNull();
    }

    @Test
    void startingAnotherFlowDropsScratchData() {
        press(BotAction.of(ActionType.MENU_AVAILABILITY));
        text("Lamp");
        assertThat(state.getItemName()).isEqualTo("Lamp");

        press(BotAction.of(ActionType.MENU_ADD));

        assertThat(state.getState()).isEqualTo(FlowState.WAITING_ITEM_NAME);
        assertThat(state.getItemName()).isNull();
    }

    @Test
    void textWithoutActiveFlowIsNotHandled() {
        assertThat(text("hello")).isEmpty();
    }

    // ============================================
    // ИЗМЕНЕНИЕ
    // ============================================

    @Test
    void ambiguousNameEndsUpdateFlow() {
        Mockito.when(itemService.findByExactName(CHAT, "Dup"))
                .thenReturn(List.of(item(1L, "Dup", USER), item(2L, "Dup", USER)));

        press(BotAction.of(ActionType.MENU_UPDATE));
        List<Reply> replies = text("Dup");

        assertThat(lastText(replies)).contains("несколько");
        assertThat(state.getState()).isEqualTo(FlowState.NONE);
        assertThat(state.getUpdateItemId()).isNull();
    }

    @Test
    void missingItemEndsUpdateFlow() {
        Mockito.when(itemService.findByExactName(CHAT, "Ghost")).thenReturn(List.of());

        press(BotAction.of(ActionType.MENU_UPDATE));
        List<Reply> replies = text("Ghost");

        assertThat(lastText(replies)).contains("не найден");
        assertThat(state.getState()).isEqualTo(FlowState.NONE);
    }

    @Test
    void userCannotUpdateForeignItem() {
        Mockito.when(itemService.findByExactName(CHAT, "Gear")).thenReturn(List.of(item(1L, "Gear", OTHER_USER)));

        press(BotAction.of(ActionType.MENU_UPDATE));
        List<Reply> replies = text("Gear");

        assertThat(lastText(replies)).isEqualTo(FlowMessages.NOT_AUTHORIZED);
        assertThat(state.getState()).isEqualTo(FlowState.NONE);
    }

    @Test
    void updateDenialIsNotLoggedAsFault() {
        Logger logger = (Logger) LoggerFactory.getLogger(UpdateItemFlow.class);
        ListAppender<ILoggingEvent> logs = new ListAppender<>();
        logs.start();
        logger.addAppender(logs);
        try {
            Mockito.when(itemService.findByExactName(CHAT, "Gear")).thenReturn(List.of(item(1L, "Gear", OTHER_USER)));

            press(BotAction.of(ActionType.MENU_UPDATE));
            text("Gear");
        } finally {
            logger.detachAppender(logs);
        }

        assertThat(logs.list)
                .filteredOn(e -> e.getFormattedMessage().contains("Нет прав"))
                .extracting(ILoggingEvent::getLevel)
                .containsOnly(Level.INFO)
                .isNotEmpty();
    }

    @Test
    void adminCanUpdateLegacyItem() {
        Mockito.when(permissionService.resolveRole(USER)).thenReturn(Optional.of(RoleName.ADMIN));
        Mockito.when(itemService.findByExactName(CHAT, "Old")).thenReturn(List.of(item(3L, "Old", null)));

        press(BotAction.of(ActionType.MENU_UPDATE));
        text("Old");

        assertThat(state.getState()).isEqualTo(FlowState.WAITING_UPDATE_FIELD);
        assertThat(state.getUpdateItemId()).isEqualTo(3L);
    }

    @Test
    void updateAccumulatesPatchAndAppliesOnDone() {
        Item gear = item(1L, "Gear", USER);
        Mockito.when(itemService.findByExactName(CHAT, "gear")).thenReturn(List.of(gear));
        Mockito.when(itemService.getById(1L)).thenReturn(Optional.of(gear));
        Mockito.when(itemService.updateById(eq(1L), any())).thenReturn(Optional.of(gear));

        press(BotAction.of(ActionType.MENU_UPDATE));
        text("gear");

        press(BotAction.of(ActionType.UPDATE_FIELD, "amount"));
        assertThat(state.getState()).isEqualTo(FlowState.WAITING_UPDATE_AMOUNT);
        text("4");
        assertThat(state.getState()).isEqualTo(FlowState.WAITING_UPDATE_FIELD);

        // Повторный выбор поля перезаписывает правку
        press(BotAction.of(ActionType.UPDATE_FIELD, "amount"));
        text("6");
        press(BotAction.of(ActionType.UPDATE_FIELD, "type"));
        press(BotAction.of(ActionType.UPDATE_TYPE, "spare part"));
        press(BotAction.of(ActionType.UPDATE_FIELD, "availability"));
        press(BotAction.yesNo(ActionType.UPDATE_AVAILABILITY, true));

        List<Reply> replies = press(BotAction.of(ActionType.UPDATE_FIELD, UpdateItemFlow.DONE));

        ArgumentCaptor<ItemPatch> patch = ArgumentCaptor.forClass(ItemPatch.class);
        Mockito.verify(itemService).updateById(eq(1L), patch.capture());
        assertThat(patch.getValue().getAmount()).isEqualTo(6);
        assertThat(patch.getValue().getType()).isEqualTo("spare part");
        assertThat(patch.getValue().getAvailable()).isTrue();
        assertThat(patch.getValue().getName()).isNull();

        assertThat(state.getState()).isEqualTo(FlowState.NONE);
        assertThat(replies.get(0).actions()).contains(BotAction.of(ActionType.UPDATE_ANOTHER));
    }

    @Test
    void doneWithoutChangesStaysInFieldMenu() {
        Mockito.when(itemService.findByExactName(CHAT, "Gear")).thenReturn(List.of(item(1L, "Gear", USER)));

        press(BotAction.of(ActionType.MENU_UPDATE));
        text("Gear");
        List<Reply> replies = text("done");

        assertThat(lastText(replies)).contains("Изменений нет");
        assertThat(state.getState()).isEqualTo(FlowState.WAITING_UPDATE_FIELD);
        Mockito.verify(itemService, Mockito.never()).updateById(anyLong(), any());
    }

    @Test
    void storageFaultOnDoneKeepsUserInFieldMenu() {
        Item gear = item(1L, "Gear", USER);
        Mockito.when(itemService.findByExactName(CHAT, "Gear")).thenReturn(List.of(gear));
        Mockito.when(itemService.getById(1L)).thenReturn(Optional.of(gear));
        Mockito.when(itemService.updateById(eq(1L), any()))
                .thenThrow(new DataAccessResourceFailureException("db down"));

        press(BotAction.of(ActionType.MENU_UPDATE));
        text("Gear");
        press(BotAction.of(ActionType.UPDATE_FIELD, "name"));
        text("Gear 2");
        List<Reply> replies = press(BotAction.of(ActionType.UPDATE_FIELD, UpdateItemFlow.DONE));

        assertThat(lastText(replies)).isEqualTo(FlowMessages.STORAGE_FAULT);
        assertThat(state.getState()).isEqualTo(FlowState.WAITING_UPDATE_FIELD);
        assertThat(state.getPatch().getName()).isEqualTo("Gear 2");
    }

    @Test
    void doneRechecksOwnershipBeforeSaving() {
        Mockito.when(itemService.findByExactName(CHAT, "Gear")).thenReturn(List.of(item(1L, "Gear", USER)));
        // Пока правили, товар "переехал" к другому создателю
        Mockito.when(itemService.getById(1L)).thenReturn(Optional.of(item(1L, "Gear", OTHER_USER)));

        press(BotAction.of(ActionType.MENU_UPDATE));
        text("Gear");
        press(BotAction.of(ActionType.UPDATE_FIELD, "amount"));
        text("2");
        List<Reply> replies = press(BotAction.of(ActionType.UPDATE_FIELD, UpdateItemFlow.DONE));

        assertThat(lastText(replies)).isEqualTo(FlowMessages.NOT_AUTHORIZED);
        Mockito.verify(itemService, Mockito.never()).updateById(anyLong(), any());
    }

    // ============================================
    // УДАЛЕНИЕ И НАЛИЧИЕ
    // ============================================

    @Test
    void userRemovesOnlyOwnRows() {
        Mockito.when(itemService.deleteByNameAndChat("Bolt", CHAT, USER)).thenReturn(1);

        press(BotAction.of(ActionType.MENU_REMOVE));
        List<Reply> replies = text("Bolt");

        Mockito.verify(itemService).deleteByNameAndChat("Bolt", CHAT, USER);
        assertThat(lastText(replies)).contains("1");
        assertThat(state.getState()).isEqualTo(FlowState.NONE);
    }

    @Test
    void adminRemovesAllRowsInChat() {
        Mockito.when(permissionService.resolveRole(USER)).thenReturn(Optional.of(RoleName.ADMIN));

        press(BotAction.of(ActionType.MENU_REMOVE));
        List<Reply> replies = text("Bolt");

        Mockito.verify(itemService).deleteByNameAndChat("Bolt", CHAT, null);
        assertThat(lastText(replies)).contains("не найден");
        assertThat(replies.get(0).actions()).contains(BotAction.of(ActionType.REMOVE_ANOTHER));
    }

    @Test
    void unknownRoleCannotRemove() {
        Mockito.when(permissionService.resolveRole(USER)).thenReturn(Optional.empty());

        press(BotAction.of(ActionType.MENU_REMOVE));
        List<Reply> replies = text("Bolt");

        assertThat(lastText(replies)).isEqualTo(FlowMessages.NOT_AUTHORIZED);
        Mockito.verifyNoInteractions(itemService);
    }

    @Test
    void availabilityByButtonIsScopedToUser() {
        Mockito.when(itemService.updateAvailability("Lamp", true, CHAT, USER)).thenReturn(2);

        press(BotAction.of(ActionType.MENU_AVAILABILITY));
        text("Lamp");
        assertThat(state.getState()).isEqualTo(FlowState.WAITING_AVAILABILITY_STATUS);
        List<Reply> replies = press(BotAction.yesNo(ActionType.AVAILABILITY_STATUS, true));

        assertThat(lastText(replies)).contains("2");
        assertThat(state.getState()).isEqualTo(FlowState.NONE);
    }

    @Test
    void availabilityByTextForAdminTouchesAllRows() {
        Mockito.when(permissionService.resolveRole(USER)).thenReturn(Optional.of(RoleName.ADMIN));

        press(BotAction.of(ActionType.AVAILABILITY_AGAIN));
        text("Lamp");
        text("No");

        Mockito.verify(itemService).updateAvailability("Lamp", false, CHAT, null);
    }
}
