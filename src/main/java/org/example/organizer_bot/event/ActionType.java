package org.example.organizer_bot.event;

import org.example.organizer_bot.model.FlowState;

/**
 * Все действия, которые можно закодировать в callback_data кнопки.
 * <p>
 * Простые действия (меню, «ещё раз») кодируются фиксированной строкой.
 * Действия внутри диалога — префиксом + значением ("item_type_spare part")
 * и привязаны к шагу, на котором кнопку показали: если беседа уже на другом шаге,
 * кнопка считается протухшей.
 */
public enum ActionType {

    // ============================================
    // МЕНЮ (без состояния)
    // ============================================

    MENU_GET("Get", false, null),
    MENU_ADD("Add", false, null),
    MENU_UPDATE("update_item", false, null),
    MENU_REMOVE("remove_item", false, null),
    MENU_AVAILABILITY("availability_status", false, null),
    MENU_ADMIN("Admin", false, null),
    MENU_TEST_MESSAGE("Send test message", false, null),
    MENU_STOP("stop_bot", false, null),
    SHOW_MENU("show_menu", false, null),

    // ============================================
    // ПОСЛЕ ЗАВЕРШЕНИЯ ДИАЛОГА
    // ============================================

    ADD_ANOTHER("add_another", false, null),
    UPDATE_ANOTHER("update_another_item", false, null),
    REMOVE_ANOTHER("remove_another_item", false, null),
    AVAILABILITY_AGAIN("change_availability_again", false, null),

    // ============================================
    // АДМИНКА (вход в подменю)
    // ============================================

    ADMIN_LIST_USERS("mu_list", false, null),
    ADMIN_ADD_USER("mu_add", false, null),
    ADMIN_SET_ROLE("mu_set_role", false, null),
    ADMIN_REMOVE_USER("mu_remove", false, null),

    // ============================================
    // ВЫБОР ВНУТРИ ДИАЛОГА (префикс + значение)
    // ============================================

    ITEM_TYPE("item_type_", true, FlowState.WAITING_ITEM_TYPE),
    ITEM_AVAILABILITY("item_availability_", true, FlowState.WAITING_ITEM_AVAILABILITY),
    AVAILABILITY_STATUS("avail_status_", true, FlowState.WAITING_AVAILABILITY_STATUS),
    UPDATE_FIELD("update_field_", true, FlowState.WAITING_UPDATE_FIELD),
    UPDATE_TYPE("update_type_", true, FlowState.WAITING_UPDATE_TYPE),
    UPDATE_AVAILABILITY("update_avail_", true, FlowState.WAITING_UPDATE_AVAILABILITY),
    ADMIN_ADD_USER_ROLE("mu_add_role_", true, FlowState.WAITING_MANAGE_ADD_USER_ROLE),
    ADMIN_SET_ROLE_CHOICE("mu_set_role_", true, FlowState.WAITING_MANAGE_SET_ROLE_CHOICE);

    private final String code;
    private final boolean prefixed;
    private final FlowState expectedState;

    ActionType(String code, boolean prefixed, FlowState expectedState) {
        this.code = code;
        this.prefixed = prefixed;
        this.expectedState = expectedState;
    }

    public String getCode() {
        return code;
    }

    public boolean isPrefixed() {
        return prefixed;
    }

    /** Шаг, на котором действие допустимо; null — действие не привязано к диалогу */
    public FlowState getExpectedState() {
        return expectedState;
    }

    public boolean isFlowBound() {
        return expectedState != null;
    }
}
