package org.example.organizer_bot.flow;

import org.example.organizer_bot.event.ActionType;
import org.example.organizer_bot.event.BotAction;
import org.example.organizer_bot.event.Reply;
import org.example.organizer_bot.model.ConversationState;
import org.example.organizer_bot.model.FlowState;
import org.example.organizer_bot.model.Item;
import org.example.organizer_bot.model.RoleName;
import org.example.organizer_bot.service.ItemService;
import org.example.organizer_bot.service.PermissionService;
import org.example.organizer_bot.service.UserService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;

/**
 * Диалоги поверх настоящего ItemService и H2.
 */
@DataJpaTest
@Import(ItemService.class)
class ItemFlowsJpaTest {

    private static final long CHAT = 10L;
    private static final long ALICE = 5L;
    private static final long BOB = 7L;
    private static final long ADMIN = 1L;

    @Autowired
    private ItemService itemService;

    private FlowEngine engine;

    @BeforeEach
    void setUp() {
        PermissionService permissionService = Mockito.mock(PermissionService.class);
        Mockito.when(permissionService.resolveRole(ALICE)).thenReturn(Optional.of(RoleName.USER));
        Mockito.when(permissionService.resolveRole(BOB)).thenReturn(Optional.of(RoleName.USER));
        Mockito.when(permissionService.resolveRole(ADMIN)).thenReturn(Optional.of(RoleName.ADMIN));
        Mockito.when(permissionService.canManageItem(any(), any(), any())).thenCallRealMethod();

        engine = new FlowEngine(FlowSettings.builder()
                .allowedType("spare part")
                .allowedType("miscellaneous")
                .pricedType("spare part")
                .build(), itemService, Mockito.mock(UserService.class), permissionService, Clock.systemUTC());
    }

    private FlowContext conversation(long userId) {
        return new FlowContext(CHAT, userId, new ConversationState());
    }

    private List<Reply> addItem(FlowContext ctx, String name, String amount, String type, String price, boolean available) {
        engine.onAction(ctx, BotAction.of(ActionType.MENU_ADD));
        engine.onText(ctx, name);
        engine.onText(ctx, amount);
        engine.onAction(ctx, BotAction.of(ActionType.ITEM_TYPE, type));
        engine.onText(ctx, price);
        return engine.onAction(ctx, BotAction.yesNo(ActionType.ITEM_AVAILABILITY, available));
    }

    @Test
    void widgetRoundTrip() {
        FlowContext ctx = conversation(ALICE);

        List<Reply> replies = addItem(ctx, "Widget", "2", "spare part", "1.50", true);

        List<Item> stored = itemService.findByExactName(CHAT, "widget");
        assertThat(stored).hasSize(1);
        Item widget = stored.get(0);
        assertThat(widget.getName()).isEqualTo("Widget");
        assertThat(widget.getAmount()).isEqualTo(2);
        assertThat(widget.getType()).isEqualTo("spare part");
        assertThat(widget.getPrice()).isEqualByComparingTo("1.50");
        assertThat(widget.getAvailable()).isTrue();
        assertThat(widget.getCreatedByUserId()).isEqualTo(ALICE);

        assertThat(replies.get(0).getText()).contains("Цена: 1.50");
        assertThat(ctx.getState()).isEqualTo(FlowState.NONE);
    }

    @Test
    void lampEndToEnd() {
        FlowContext ctx = conversation(ALICE);

        addItem(ctx, "Lamp", "3", "miscellaneous", "9.99", false);

        Item lamp = itemService.findByExactName(CHAT, "Lamp").get(0);
        assertThat(lamp.getAmount()).isEqualTo(3);
        assertThat(lamp.getType()).isEqualTo("miscellaneous");
        assertThat(lamp.getPrice()).isEqualByComparingTo("9.99");
        assertThat(lamp.getAvailable()).isFalse();
    }

    @Test
    void duplicateNamesAreAmbiguousForUpdate() {
        addItem(conversation(ALICE), "Dup", "1", "miscellaneous", "1", false);
        addItem(conversation(ALICE), "Dup", "2", "miscellaneous", "1", false);

        FlowContext ctx = conversation(ALICE);
        engine.onAction(ctx, BotAction.of(ActionType.MENU_UPDATE));
        engine.onText(ctx, "Dup");

        assertThat(ctx.getState()).isEqualTo(FlowState.NONE);
        assertThat(ctx.getConversation().getUpdateItemId()).isNull();
    }

    @Test
    void updateFlowPersistsPatch() {
        addItem(conversation(ALICE), "Gear", "1", "miscellaneous", "1", false);

        FlowContext ctx = conversation(ALICE);
        engine.onAction(ctx, BotAction.of(ActionType.MENU_UPDATE));
        engine.onText(ctx, "GEAR");
        engine.onAction(ctx, BotAction.of(ActionType.UPDATE_FIELD, "price"));
        engine.onText(ctx, "12.345");
        engine.onAction(ctx, BotAction.of(ActionType.UPDATE_FIELD, UpdateItemFlow.DONE));

        Item gear = itemService.findByExactName(CHAT, "gear").get(0);
        assertThat(gear.getPrice()).isEqualByComparingTo("12.35");
        assertThat(ctx.getState()).isEqualTo(FlowState.NONE);
    }

    @Test
    void userRemoveLeavesOtherUsersRows() {
        addItem(conversation(ALICE), "Bolt", "1", "miscellaneous", "1", false);
        addItem(conversation(BOB), "Bolt", "1", "miscellaneous", "1", false);

        FlowContext ctx = conversation(ALICE);
        engine.onAction(ctx, BotAction.of(ActionType.MENU_REMOVE));
        engine.onText(ctx, "bolt");

        assertThat(itemService.findByExactName(CHAT, "Bolt"))
                .extracting(Item::getCreatedByUserId)
                .containsExactly(BOB);
    }

    @Test
    void adminRemoveDeletesAllMatchingRows() {
        addItem(conversation(ALICE), "Bolt", "1", "miscellaneous", "1", false);
        addItem(conversation(BOB), "Bolt", "1", "miscellaneous", "1", false);

        FlowContext ctx = conversation(ADMIN);
        engine.onAction(ctx, BotAction.of(ActionType.MENU_REMOVE));
        List<Reply> replies = engine.onText(ctx, "Bolt");

        assertThat(itemService.findByExactName(CHAT, "Bolt")).isEmpty();
        assertThat(replies.get(0).getText()).endsWith("2");
    }
}
