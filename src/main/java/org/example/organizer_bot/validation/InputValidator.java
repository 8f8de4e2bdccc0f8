package org.example.organizer_bot.validation;

import java.util.regex.Pattern;

/**
 * Проверки пользовательского ввода. Только чистые функции, без состояния.
 */
public final class InputValidator {

    private static final Pattern INT = Pattern.compile("[+-]?\\d+");
    // Без локалей: "1,5" не число, "NaN" и "Infinity" тоже
    private static final Pattern FLOAT = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private InputValidator() {
    }

    /**
     * Текст подходит, если длина в [minLen, maxLen] и все символы — печатный ASCII:
     * буквы, цифры, пробел и знаки !"#$%&'()*+,-./:;<=>?@[\]^_`{|}~.
     * Управляющие символы, кириллица и эмодзи не проходят.
     */
    public static boolean validateText(String text, int minLen, int maxLen) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        if (text.length() < minLen || text.length() > maxLen) {
            return false;
        }
        return text.chars().allMatch(c -> c >= ' ' && c <= '~');
    }

    public static boolean isInt(String value) {
        return value != null && INT.matcher(value).matches();
    }

    public static boolean isFloat(String value) {
        return value != null && FLOAT.matcher(value).matches();
    }
}
