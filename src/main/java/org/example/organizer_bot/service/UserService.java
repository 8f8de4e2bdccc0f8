package org.example.organizer_bot.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.organizer_bot.model.Role;
import org.example.organizer_bot.model.RoleName;
import org.example.organizer_bot.model.User;
import org.example.organizer_bot.repository.RoleRepository;
import org.example.organizer_bot.repository.UserRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service  // Говорит Spring: "Это сервис, создай для него бин!"
@RequiredArgsConstructor
@Slf4j
@Transactional  // Все методы выполняются в транзакции БД
public class UserService {

    private final UserRepository userRepository;
    private final RoleRepository roleRepository;

    /**
     * Найти пользователя по Telegram ID (роль подгружена).
     *
     * @param telegramUserId - Telegram ID пользователя
     * @return пользователь, если найден, иначе пусто
     */
    @Transactional(readOnly = true)
    public Optional<User> getByTelegramId(Long telegramUserId) {
        log.debug("Поиск пользователя по Telegram ID: {}", telegramUserId);
        return userRepository.findByTelegramUserIdWithRole(telegramUserId);
    }

    /**
     * Создать пользователя с ролью.
     *
     * @throws IllegalArgumentException если пользователь с таким Telegram ID уже есть
     * @throws IllegalStateException    если роли нет в справочнике (не засеяна)
     */
    public User create(Long telegramUserId, RoleName roleName) {
        log.debug("Создание пользователя: telegramId={}, role={}", telegramUserId, roleName.getDbName());

        if (userRepository.existsByTelegramUserId(telegramUserId)) {
            log.debug("Пользователь с telegramId={} уже существует", telegramUserId);
            throw new IllegalArgumentException("Пользователь уже существует!");
        }

        User user = User.builder()
                .telegramUserId(telegramUserId)
                .role(requireRole(roleName))
                .build();

        User saved = userRepository.save(user);
        log.info("Пользователь создан: id={}, role={}", saved.getId(), roleName.getDbName());
        return saved;
    }

    /**
     * Поменять роль пользователя.
     *
     * @return обновлённый пользователь или пусто, если такого нет
     */
    public Optional<User> setRole(Long telegramUserId, RoleName roleName) {
        Optional<User> userOpt = userRepository.findByTelegramUserIdWithRole(telegramUserId);
        if (userOpt.isEmpty()) {
            log.debug("Смена роли: пользователь telegramId={} не найден", telegramUserId);
            return Optional.empty();
        }

        User user = userOpt.get();
        user.setRole(requireRole(roleName));
        User saved = userRepository.save(user);
        log.info("Роль пользователя обновлена: id={}, role={}", saved.getId(), roleName.getDbName());
        return Optional.of(saved);
    }

    /**
     * Удалить пользователя.
     *
     * @return true если удалён, false если такого не было
     */
    public boolean delete(Long telegramUserId) {
        Optional<User> userOpt = userRepository.findByTelegramUserIdWithRole(telegramUserId);
        if (userOpt.isEmpty()) {
            log.debug("Удаление: пользователь telegramId={} не найден", telegramUserId);
            return false;
        }
        userRepository.delete(userOpt.get());
        log.info("Пользователь удалён: id={}", userOpt.get().getId());
        return true;
    }

    /**
     * Последние пользователи, новые сверху.
     */
    @Transactional(readOnly = true)
    public List<User> list(int limit) {
        return userRepository.findAllWithRole(PageRequest.of(0, Math.max(1, limit)));
    }

    private Role requireRole(RoleName roleName) {
        return roleRepository.findByName(roleName.getDbName())
                .orElseThrow(() -> new IllegalStateException("Роль не найдена в справочнике: " + roleName.getDbName()));
    }
}
