package org.example.organizer_bot.handler;

import org.example.organizer_bot.event.ActionType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Кнопки постоянной клавиатуры меню. Приходят обычным текстом.
 */
public enum MainMenu {

    GET("Get", ActionType.MENU_GET),
    ADD("Add", ActionType.MENU_ADD),
    UPDATE("Update item", ActionType.MENU_UPDATE),
    REMOVE("Remove item", ActionType.MENU_REMOVE),
    AVAILABILITY("Change availability status", ActionType.MENU_AVAILABILITY),
    ADMIN("Admin", ActionType.MENU_ADMIN),
    TEST_MESSAGE("Send test message", ActionType.MENU_TEST_MESSAGE);

    private final String label;
    private final ActionType action;

    MainMenu(String label, ActionType action) {
        this.label = label;
        this.action = action;
    }

    public String getLabel() {
        return label;
    }

    public ActionType getAction() {
        return action;
    }

    /** Подпись кнопки без учёта регистра и пробелов по краям */
    public static Optional<MainMenu> fromLabel(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String value = text.trim();
        return Arrays.stream(values())
                .filter(m -> m.label.equalsIgnoreCase(value))
                .findFirst();
    }

    /** Раскладка клавиатуры: по две кнопки в ряд */
    public static List<List<String>> keyboardRows() {
        List<List<String>> rows = new ArrayList<>();
        List<String> row = new ArrayList<>();
        for (MainMenu item : values()) {
            row.add(item.label);
            if (row.size() == 2) {
                rows.add(row);
                row = new ArrayList<>();
            }
        }
        if (!row.isEmpty()) {
            rows.add(row);
        }
        return rows;
    }
}
