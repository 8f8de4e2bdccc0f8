package org.example.organizer_bot.flow;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.ZoneId;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Неизменяемые настройки диалогов. Передаются в конструктор {@link FlowEngine};
 * чтобы поменять настройки — создаём новый движок.
 */
@Getter
@Builder
@ToString
public class FlowSettings {

    /** Разрешённые типы, в нижнем регистре, в порядке из настроек */
    @Singular
    private final List<String> allowedTypes;

    /** Типы, для которых в подтверждении показываем цену и наличие */
    @Singular
    private final Set<String> pricedTypes;

    @Builder.Default
    private final int minNameLength = 1;

    @Builder.Default
    private final int maxNameLength = 255;

    @Builder.Default
    private final int maxAmount = 1_000_000;

    @Builder.Default
    private final BigDecimal maxPrice = new BigDecimal("1000000.00");

    @Builder.Default
    private final int listLimit = 50;

    @Builder.Default
    private final boolean skipWorkingHours = true;

    @Builder.Default
    private final ZoneId workingHoursZone = ZoneId.of("Europe/Lisbon");

    /** Кому можно /stop */
    @Singular
    private final Set<Long> authorizedIds;

    public boolean isAllowedType(String type) {
        return type != null && allowedTypes.contains(type.toLowerCase(Locale.ROOT));
    }

    public boolean isPricedType(String type) {
        return type != null && pricedTypes.contains(type.toLowerCase(Locale.ROOT));
    }
}
