package org.example.organizer_bot.model;

import lombok.Data;

import java.math.BigDecimal;

/**
 * Накопленные изменения товара. Пока юзер не нажал Done, в БД ничего не пишем.
 * NULL в поле — поле не трогаем.
 */
@Data
public class ItemPatch {

    private String name;
    private Integer amount;
    private String type;
    private BigDecimal price;
    private Boolean available;

    public boolean isEmpty() {
        return name == null && amount == null && type == null && price == null && available == null;
    }
}
