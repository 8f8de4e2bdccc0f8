package org.example.organizer_bot.config;

import lombok.extern.slf4j.Slf4j;
import org.example.organizer_bot.flow.FlowEngine;
import org.example.organizer_bot.flow.FlowSettings;
import org.example.organizer_bot.service.ItemService;
import org.example.organizer_bot.service.PermissionService;
import org.example.organizer_bot.service.UserService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;
import java.util.Locale;

/**
 * Собирает движок диалогов из настроек app.*.
 */
@Slf4j
@Configuration
public class FlowEngineConfig {

    @Bean
    FlowSettings flowSettings(OrganizerProperties properties) {
        OrganizerProperties.Items items = properties.getItems();
        FlowSettings.FlowSettingsBuilder builder = FlowSettings.builder()
                .minNameLength(items.getMinNameLength())
                .maxNameLength(items.getMaxNameLength())
                .maxAmount(items.getMaxAmount())
                .maxPrice(items.getMaxPrice())
                .listLimit(items.getListLimit())
                .skipWorkingHours(properties.getWorkingHours().isSkip())
                .workingHoursZone(ZoneId.of(properties.getWorkingHours().getZone()))
                .authorizedIds(properties.getAccess().getAuthorizedIds());

        // Типы храним в нижнем регистре, дубли выкидываем
        items.getAllowedTypes().stream()
                .map(t -> t.trim().toLowerCase(Locale.ROOT))
                .filter(t -> !t.isEmpty())
                .distinct()
                .forEach(builder::allowedType);
        items.getPricedTypes().stream()
                .map(t -> t.trim().toLowerCase(Locale.ROOT))
                .forEach(builder::pricedType);

        FlowSettings settings = builder.build();
        if (settings.getAllowedTypes().isEmpty()) {
            throw new IllegalStateException("app.items.allowed-types не может быть пустым");
        }
        return settings;
    }

    @Bean
    FlowEngine flowEngine(FlowSettings flowSettings,
                          ItemService itemService,
                          UserService userService,
                          PermissionService permissionService,
                          Clock clock) {
        return new FlowEngine(flowSettings, itemService, userService, permissionService, clock);
    }
}
