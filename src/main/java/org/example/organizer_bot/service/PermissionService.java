package org.example.organizer_bot.service;

import lombok.extern.slf4j.Slf4j;
import org.example.organizer_bot.config.OrganizerProperties;
import org.example.organizer_bot.model.RoleName;
import org.example.organizer_bot.model.User;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.Set;

/**
 * Роли и права.
 * <p>
 * Роль берём из БД. Если юзера в БД нет или БД упала — смотрим в список
 * запасных админов из настроек: кто там есть — admin, остальные — user.
 * Ошибка БД наружу не пробрасывается.
 */
@Slf4j
@Service
public class PermissionService {

    private final UserService userService;
    private final Set<Long> fallbackAdminIds;

    @Autowired
    public PermissionService(UserService userService, OrganizerProperties properties) {
        this(userService, Set.copyOf(properties.getAccess().getFallbackAdminIds()));
    }

    PermissionService(UserService userService, Set<Long> fallbackAdminIds) {
        this.userService = userService;
        this.fallbackAdminIds = fallbackAdminIds;
    }

    /**
     * Определить роль пользователя.
     *
     * @param telegramUserId Telegram ID (может быть NULL)
     * @return роль; пусто, если id неизвестен (NULL) или в БД лежит роль, которую бот не знает
     */
    public Optional<RoleName> resolveRole(Long telegramUserId) {
        if (telegramUserId == null) {
            return Optional.empty();
        }
        try {
            Optional<User> user = userService.getByTelegramId(telegramUserId);
            if (user.isPresent() && user.get().getRole() != null) {
                String name = user.get().getRole().getName();
                Optional<RoleName> role = RoleName.fromName(name);
                if (role.isEmpty()) {
                    log.warn("Неизвестная роль в БД: telegramId={}, role={}", telegramUserId, name);
                }
                return role;
            }
        } catch (RuntimeException e) {
            log.warn("Не удалось получить роль из БД: telegramId={}, error={}: {}",
                    telegramUserId, e.getClass().getSimpleName(), e.getMessage());
        }
        return Optional.of(isFallbackAdmin(telegramUserId) ? RoleName.ADMIN : RoleName.USER);
    }

    public boolean isAdmin(Long telegramUserId) {
        return resolveRole(telegramUserId).filter(r -> r == RoleName.ADMIN).isPresent();
    }

    public boolean isFallbackAdmin(Long telegramUserId) {
        return telegramUserId != null && fallbackAdminIds.contains(telegramUserId);
    }

    /**
     * Может ли пользователь менять/удалять товар.
     * Админ — любой; обычный пользователь — только созданный им самим
     * (товары без создателя обычному пользователю недоступны).
     */
    public boolean canManageItem(Long createdByUserId, Long currentUserId, RoleName role) {
        if (currentUserId == null || role == null) {
            return false;
        }
        switch (role) {
            case ADMIN:
                return true;
            case USER:
                return createdByUserId != null && createdByUserId.equals(currentUserId);
            default:
                return false;
        }
    }
}
