package org.example.organizer_bot.flow;

import org.example.organizer_bot.event.ActionType;
import org.example.organizer_bot.event.BotAction;
import org.example.organizer_bot.event.ReplyButton;
import org.example.organizer_bot.model.ItemField;
import org.example.organizer_bot.model.RoleName;

import java.util.ArrayList;
import java.util.List;

/**
 * Сборка inline-клавиатур.
 */
public final class Keyboards {

    public static final String MENU_LABEL = "📋 Меню";

    private Keyboards() {
    }

    public static ReplyButton btn(String label, BotAction action) {
        return new ReplyButton(label, action);
    }

    public static ReplyButton btn(String label, ActionType type) {
        return new ReplyButton(label, BotAction.of(type));
    }

    /** «Ещё раз» + «Меню» после завершённого диалога */
    public static List<List<ReplyButton>> nextActions(String againLabel, ActionType again) {
        return List.of(List.of(btn(againLabel, again), btn(MENU_LABEL, ActionType.SHOW_MENU)));
    }

    public static List<List<ReplyButton>> yesNo(ActionType type) {
        return List.of(List.of(
                btn("✅ Да", BotAction.yesNo(type, true)),
                btn("❌ Нет", BotAction.yesNo(type, false))));
    }

    /** По кнопке на каждый разрешённый тип */
    public static List<List<ReplyButton>> itemTypes(ActionType type, List<String> allowedTypes) {
        List<List<ReplyButton>> rows = new ArrayList<>();
        for (String itemType : allowedTypes) {
            rows.add(List.of(btn(itemType, BotAction.of(type, itemType))));
        }
        return rows;
    }

    public static List<List<ReplyButton>> roles(ActionType type) {
        List<ReplyButton> row = new ArrayList<>();
        for (RoleName role : RoleName.values()) {
            row.add(btn(role.getDbName(), BotAction.of(type, role.getDbName())));
        }
        return List.of(row);
    }

    /** Меню полей диалога изменения + «Готово» */
    public static List<List<ReplyButton>> updateFields() {
        List<List<ReplyButton>> rows = new ArrayList<>();
        List<ReplyButton> row = new ArrayList<>();
        for (ItemField field : ItemField.values()) {
            row.add(btn(field.getLabel(), BotAction.of(ActionType.UPDATE_FIELD, field.getCode())));
            if (row.size() == 3) {
                rows.add(row);
                row = new ArrayList<>();
            }
        }
        row.add(btn("✅ Готово", BotAction.of(ActionType.UPDATE_FIELD, UpdateItemFlow.DONE)));
        rows.add(row);
        return rows;
    }

    public static List<List<ReplyButton>> adminPanel() {
        return List.of(
                List.of(btn("👥 Список", ActionType.ADMIN_LIST_USERS), btn("➕ Добавить", ActionType.ADMIN_ADD_USER)),
                List.of(btn("🔁 Сменить роль", ActionType.ADMIN_SET_ROLE), btn("🗑 Удалить", ActionType.ADMIN_REMOVE_USER)),
                List.of(btn(MENU_LABEL, ActionType.SHOW_MENU)));
    }

    public static List<List<ReplyButton>> mainMenu() {
        return List.of(
                List.of(btn("📋 Список", ActionType.MENU_GET), btn("➕ Добавить", ActionType.MENU_ADD)),
                List.of(btn("✏️ Изменить товар", ActionType.MENU_UPDATE), btn("🗑 Удалить товар", ActionType.MENU_REMOVE)),
                List.of(btn("👤 Админ", ActionType.MENU_ADMIN), btn("🔄 Изменить наличие", ActionType.MENU_AVAILABILITY)),
                List.of(btn("🧪 Тестовое сообщение", ActionType.MENU_TEST_MESSAGE), btn("⏹ Стоп", ActionType.MENU_STOP)));
    }
}
