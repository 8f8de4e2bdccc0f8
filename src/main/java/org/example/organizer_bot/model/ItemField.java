package org.example.organizer_bot.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Поля товара, которые можно менять в диалоге изменения.
 */
public enum ItemField {

    NAME("name", "Название"),
    AMOUNT("amount", "Количество"),
    TYPE("type", "Тип"),
    PRICE("price", "Цена"),
    AVAILABILITY("availability", "Наличие");

    private final String code;
    private final String label;

    ItemField(String code, String label) {
        this.code = code;
        this.label = label;
    }

    public String getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }

    public static Optional<ItemField> fromCode(String code) {
        return Arrays.stream(values())
                .filter(f -> f.code.equals(code))
                .findFirst();
    }
}
