package org.example.organizer_bot.flow;

import org.example.organizer_bot.model.Item;

/**
 * Общие тексты ответов. Тексты конкретных шагов живут в своих диалогах.
 */
public final class FlowMessages {

    public static final String EXPIRED =
            "⌛ Это действие устарело. Начните заново из меню.";

    public static final String STORAGE_FAULT =
            "❌ Не удалось выполнить запрос. Попробуйте позже.";

    public static final String NOT_AUTHORIZED =
            "⛔ У вас нет прав на это действие.";

    public static final String CANCELLED =
            "Действие отменено.";

    public static final String NOT_UNDERSTOOD =
            "🤔 Я не понял. Используйте /menu или кнопки ниже.";

    public static final String OUTSIDE_WORKING_HOURS =
            "⏰ Сейчас нерабочее время — попробуйте позже.";

    public static final String INVALID_VALUE = "❌ Некорректное значение.\n\n";

    private FlowMessages() {
    }

    public static String yesNo(boolean value) {
        return value ? "да" : "нет";
    }

    /**
     * Подтверждение созданного товара. Цену и наличие показываем
     * только для типов из app.items.priced-types.
     */
    public static String itemAccepted(Item item, FlowSettings settings) {
        StringBuilder text = new StringBuilder("✅ Заявка принята в обработку\n\n")
                .append("Название: ").append(item.getName()).append('\n')
                .append("Количество: ").append(item.getAmount()).append('\n')
                .append("Тип: ").append(item.getType());
        if (settings.isPricedType(item.getType())) {
            text.append('\n')
                    .append("Цена: ").append(item.getPrice() == null ? "—" : item.getPrice().toPlainString()).append('\n')
                    .append("В наличии: ").append(yesNo(Boolean.TRUE.equals(item.getAvailable())));
        }
        return text.toString();
    }
}
