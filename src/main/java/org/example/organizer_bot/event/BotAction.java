package org.example.organizer_bot.event;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Optional;

/**
 * Разобранное действие кнопки: тип + значение (для префиксных типов).
 * <p>
 * callback_data разбирается ровно один раз — в диспетчере. Дальше по коду
 * ходит только этот объект, строки никто не парсит.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class BotAction {

    public static final String YES = "yes";
    public static final String NO = "no";

    private final ActionType type;
    private final String value;

    private BotAction(ActionType type, String value) {
        this.type = type;
        this.value = value;
    }

    public static BotAction of(ActionType type) {
        if (type.isPrefixed()) {
            throw new IllegalArgumentException("Действию " + type + " нужно значение");
        }
        return new BotAction(type, null);
    }

    public static BotAction of(ActionType type, String value) {
        if (!type.isPrefixed()) {
            return of(type);
        }
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Пустое значение для " + type);
        }
        return new BotAction(type, value);
    }

    public static BotAction yesNo(ActionType type, boolean yes) {
        return of(type, yes ? YES : NO);
    }

    public boolean isYes() {
        return YES.equals(value);
    }

    /** Значение — одно из yes / no */
    public boolean isYesNo() {
        return YES.equals(value) || NO.equals(value);
    }

    /**
     * Закодировать в callback_data.
     */
    public String encode() {
        return type.isPrefixed() ? type.getCode() + value : type.getCode();
    }

    /**
     * Разобрать callback_data. Сначала точные совпадения, потом префиксы
     * ("mu_set_role" и "mu_set_role_admin" — разные действия).
     */
    public static Optional<BotAction> parse(String data) {
        if (data == null || data.isEmpty()) {
            return Optional.empty();
        }
        for (ActionType type : ActionType.values()) {
            if (!type.isPrefixed() && type.getCode().equals(data)) {
                return Optional.of(new BotAction(type, null));
            }
        }
        for (ActionType type : ActionType.values()) {
            if (type.isPrefixed() && data.startsWith(type.getCode()) && data.length() > type.getCode().length()) {
                return Optional.of(new BotAction(type, data.substring(type.getCode().length())));
            }
        }
        return Optional.empty();
    }
}
