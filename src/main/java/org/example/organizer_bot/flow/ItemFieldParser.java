package org.example.organizer_bot.flow;

import lombok.RequiredArgsConstructor;
import org.example.organizer_bot.validation.InputValidator;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Optional;

/**
 * Разбор значений полей товара. Одни и те же правила для добавления и изменения.
 * Пусто — значение не подходит, шаг надо переспросить.
 */
@RequiredArgsConstructor
class ItemFieldParser {

    private final FlowSettings settings;

    Optional<String> name(String text) {
        if (!InputValidator.validateText(text, settings.getMinNameLength(), settings.getMaxNameLength())) {
            return Optional.empty();
        }
        return Optional.of(text);
    }

    /** Целое от 1 до maxAmount */
    Optional<Integer> amount(String text) {
        String value = text == null ? null : text.trim();
        if (!InputValidator.isInt(value)) {
            return Optional.empty();
        }
        BigInteger amount = new BigInteger(value);
        if (amount.signum() <= 0 || amount.compareTo(BigInteger.valueOf(settings.getMaxAmount())) > 0) {
            return Optional.empty();
        }
        return Optional.of(amount.intValue());
    }

    /** Тип из списка разрешённых, в нижнем регистре */
    Optional<String> type(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String value = text.trim().toLowerCase(Locale.ROOT);
        return settings.isAllowedType(value) ? Optional.of(value) : Optional.empty();
    }

    /**
     * Цена: число с плавающей точкой, округляется до 2 знаков,
     * после округления должна быть в [0, maxPrice].
     */
    Optional<BigDecimal> price(String text) {
        String value = text == null ? null : text.trim();
        if (!InputValidator.isFloat(value)) {
            return Optional.empty();
        }
        double parsed = Double.parseDouble(value);
        if (!Double.isFinite(parsed)) {
            return Optional.empty();
        }
        BigDecimal price = BigDecimal.valueOf(parsed).setScale(2, RoundingMode.HALF_UP);
        if (price.signum() < 0 || price.compareTo(settings.getMaxPrice()) > 0) {
            return Optional.empty();
        }
        return Optional.of(price);
    }

    /** yes/no, да/нет в любом регистре */
    static Optional<Boolean> yesNo(String text) {
        if (text == null) {
            return Optional.empty();
        }
        switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "yes":
            case "да":
                return Optional.of(Boolean.TRUE);
            case "no":
            case "нет":
                return Optional.of(Boolean.FALSE);
            default:
                return Optional.empty();
        }
    }

    String namePrompt() {
        return "Введите название (латиница, цифры и знаки, " + settings.getMinNameLength()
                + "–" + settings.getMaxNameLength() + " символов):";
    }

    String amountPrompt() {
        return "Введите количество (целое число от 1 до " + settings.getMaxAmount() + "):";
    }

    String typePrompt() {
        return "Выберите тип (" + String.join(", ", settings.getAllowedTypes()) + "):";
    }

    String pricePrompt() {
        return "Введите цену (от 0 до " + settings.getMaxPrice().toPlainString() + ", например 9.99):";
    }
}
