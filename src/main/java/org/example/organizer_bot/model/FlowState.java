package org.example.organizer_bot.model;

/**
 * Шаги всех диалогов бота.
 * <p>
 * Каждый шаг — это один вопрос от бота.
 * Юзер отвечает (текстом или кнопкой) → переходим на следующий шаг.
 *
 * ДОБАВЛЕНИЕ:
 * ITEM_NAME → ITEM_AMOUNT → ITEM_TYPE → ITEM_PRICE → ITEM_AVAILABILITY → сохранение
 *
 * ИЗМЕНЕНИЕ:
 * UPDATE_ITEM_NAME → UPDATE_FIELD ⇄ UPDATE_NAME / AMOUNT / TYPE / PRICE / AVAILABILITY → Done
 *
 * УДАЛЕНИЕ:
 * REMOVE_ITEM_NAME → удаление
 *
 * НАЛИЧИЕ:
 * AVAILABILITY_ITEM_NAME → AVAILABILITY_STATUS → обновление
 *
 * ПОЛЬЗОВАТЕЛИ (только админ):
 * MANAGE_ADD_USER_ID → MANAGE_ADD_USER_ROLE
 * MANAGE_SET_ROLE_ID → MANAGE_SET_ROLE_CHOICE
 * MANAGE_REMOVE_USER_ID
 */
public enum FlowState {

    /** Не в диалоге */
    NONE(null),

    // ============================================
    // ДОБАВЛЕНИЕ ТОВАРА
    // ============================================

    WAITING_ITEM_NAME(FlowFamily.ADD_ITEM),
    WAITING_ITEM_AMOUNT(FlowFamily.ADD_ITEM),
    WAITING_ITEM_TYPE(FlowFamily.ADD_ITEM),
    WAITING_ITEM_PRICE(FlowFamily.ADD_ITEM),
    WAITING_ITEM_AVAILABILITY(FlowFamily.ADD_ITEM),

    // ============================================
    // ИЗМЕНЕНИЕ ТОВАРА
    // ============================================

    /** Ждём точное имя товара, который будем менять */
    WAITING_UPDATE_ITEM_NAME(FlowFamily.UPDATE_ITEM),
    /** Меню полей (name/amount/type/price/availability/Done) */
    WAITING_UPDATE_FIELD(FlowFamily.UPDATE_ITEM),
    WAITING_UPDATE_NAME(FlowFamily.UPDATE_ITEM),
    WAITING_UPDATE_AMOUNT(FlowFamily.UPDATE_ITEM),
    WAITING_UPDATE_TYPE(FlowFamily.UPDATE_ITEM),
    WAITING_UPDATE_PRICE(FlowFamily.UPDATE_ITEM),
    WAITING_UPDATE_AVAILABILITY(FlowFamily.UPDATE_ITEM),

    // ============================================
    // УДАЛЕНИЕ ТОВАРА
    // ============================================

    WAITING_REMOVE_ITEM_NAME(FlowFamily.REMOVE_ITEM),

    // ============================================
    // СМЕНА НАЛИЧИЯ
    // ============================================

    WAITING_AVAILABILITY_ITEM_NAME(FlowFamily.CHANGE_AVAILABILITY),
    WAITING_AVAILABILITY_STATUS(FlowFamily.CHANGE_AVAILABILITY),

    // ============================================
    // УПРАВЛЕНИЕ ПОЛЬЗОВАТЕЛЯМИ
    // ============================================

    WAITING_MANAGE_ADD_USER_ID(FlowFamily.ADMIN_USERS),
    WAITING_MANAGE_ADD_USER_ROLE(FlowFamily.ADMIN_USERS),
    WAITING_MANAGE_SET_ROLE_ID(FlowFamily.ADMIN_USERS),
    WAITING_MANAGE_SET_ROLE_CHOICE(FlowFamily.ADMIN_USERS),
    WAITING_MANAGE_REMOVE_USER_ID(FlowFamily.ADMIN_USERS);

    private final FlowFamily family;

    FlowState(FlowFamily family) {
        this.family = family;
    }

    /** Семейство диалога; null для NONE */
    public FlowFamily getFamily() {
        return family;
    }
}
