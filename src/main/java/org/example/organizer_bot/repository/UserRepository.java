package org.example.organizer_bot.repository;

import org.example.organizer_bot.model.User;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Репозиторий пользователей (таблица users).
 * <p>
 * Роль грузим сразу через JOIN FETCH — почти всегда она нужна
 * (проверка прав), а ленивая загрузка вне транзакции упадёт.
 */
@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    /**
     * Найти пользователя по Telegram ID вместе с ролью.
     */
    @Query("SELECT u FROM User u JOIN FETCH u.role WHERE u.telegramUserId = :telegramUserId")
    Optional<User> findByTelegramUserIdWithRole(@Param("telegramUserId") Long telegramUserId);

    boolean existsByTelegramUserId(Long telegramUserId);

    @Query("SELECT u FROM User u JOIN FETCH u.role ORDER BY u.createdAt DESC, u.id DESC")
    List<User> findAllWithRole(Pageable pageable);
}
