package org.example.organizer_bot.model;

import lombok.Data;

import java.math.BigDecimal;

/**
 * Данные нового товара (хранятся в памяти, пока идёт диалог добавления).
 */
@Data
public class ItemDraft {

    private String name;
    private Integer amount;
    /** Уже в нижнем регистре */
    private String type;
    private BigDecimal price;
    private Boolean available;
}
