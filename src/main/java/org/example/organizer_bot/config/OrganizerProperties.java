package org.example.organizer_bot.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Настройки бота из application.properties (всё, что начинается с app.*).
 * <p>
 * Сюда смотрят только при старте: {@link FlowEngineConfig} один раз собирает
 * из них неизменяемый {@link org.example.organizer_bot.flow.FlowSettings}.
 */
@Configuration
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class OrganizerProperties {

    private Items items = new Items();
    private WorkingHours workingHours = new WorkingHours();
    private Access access = new Access();
    private Flow flow = new Flow();

    @Getter
    @Setter
    public static class Items {
        /** Разрешённые типы товара (сравниваются без учёта регистра) */
        private List<String> allowedTypes = new ArrayList<>(List.of("spare part", "miscellaneous"));
        /** Типы, для которых в подтверждении показываем цену и наличие */
        private List<String> pricedTypes = new ArrayList<>(List.of("spare part"));
        private int minNameLength = 1;
        private int maxNameLength = 255;
        private int maxAmount = 1_000_000;
        private BigDecimal maxPrice = new BigDecimal("1000000.00");
        /** Сколько товаров показывать по кнопке Get */
        private int listLimit = 50;
    }

    @Getter
    @Setter
    public static class WorkingHours {
        private boolean skip = true;
        private String zone = "Europe/Lisbon";
    }

    @Getter
    @Setter
    public static class Access {
        /** Эти id получают роль admin, если в БД про них ничего нет (или БД недоступна) */
        private List<Long> fallbackAdminIds = new ArrayList<>();
        /** Кому разрешена команда /stop */
        private List<Long> authorizedIds = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Flow {
        /** Через сколько простоя забывать незаконченный диалог. 0 — никогда */
        private Duration idleTimeout = Duration.ofHours(12);
    }
}
