package org.example.organizer_bot.validation;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Проверка рабочего времени для добавления товаров.
 * <p>
 * Рабочее время: 09:30–19:00 по часовому поясу из настроек (Europe/Lisbon).
 * Выходным считается только день с индексом > 5 при нумерации с понедельника = 0,
 * то есть воскресенье; суббота проходит.
 */
@Slf4j
public final class WorkingHours {

    public static final LocalTime OPENS_AT = LocalTime.of(9, 30);
    public static final LocalTime CLOSES_AT = LocalTime.of(19, 0);

    private WorkingHours() {
    }

    /**
     * @param now  текущий момент
     * @param zone часовой пояс
     * @param skip true — проверка выключена, всегда можно
     * @return можно ли сейчас принимать заявки; при любой ошибке — true
     */
    public static boolean withinWorkingHours(Instant now, ZoneId zone, boolean skip) {
        if (skip) {
            return true;
        }
        try {
            return withinWorkingHours(now.atZone(zone));
        } catch (RuntimeException e) {
            log.error("Ошибка проверки рабочего времени: {}: {}", e.getClass().getSimpleName(), e.getMessage());
            return true;
        }
    }

    static boolean withinWorkingHours(ZonedDateTime localNow) {
        int weekdayIndex = localNow.getDayOfWeek().getValue() - 1;
        if (weekdayIndex > 5) {
            return false;
        }
        LocalTime time = localNow.toLocalTime();
        return !time.isBefore(OPENS_AT) && !time.isAfter(CLOSES_AT);
    }
}
