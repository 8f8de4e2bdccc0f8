package org.example.organizer_bot.repository;

import org.example.organizer_bot.model.Item;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Репозиторий товаров (таблица organizer_items).
 * <p>
 * Все поиски по имени — точное совпадение без учёта регистра:
 * "widget", "Widget" и "WIDGET" — один и тот же товар.
 */
@Repository
public interface ItemRepository extends JpaRepository<Item, Long> {

    /**
     * Все товары чата с точно таким именем (без учёта регистра).
     * Используется диалогом изменения: 0 — не найден, 2+ — дубликаты.
     */
    @Query("SELECT i FROM Item i WHERE i.chatId = :chatId AND LOWER(i.name) = LOWER(:name) ORDER BY i.id")
    List<Item> findByChatIdAndNameIgnoreCase(@Param("chatId") Long chatId, @Param("name") String name);

    /**
     * Список с необязательными фильтрами, новые сверху.
     * NULL-параметр — фильтр не применяется.
     */
    @Query("SELECT i FROM Item i WHERE (:chatId IS NULL OR i.chatId = :chatId)"
            + " AND (:namePattern IS NULL OR LOWER(i.name) LIKE :namePattern)"
            + " AND (:creatorId IS NULL OR i.createdByUserId = :creatorId)"
            + " AND (:createdFrom IS NULL OR i.createdAt >= :createdFrom)"
            + " AND (:createdTo IS NULL OR i.createdAt <= :createdTo)"
            + " ORDER BY i.createdAt DESC, i.id DESC")
    List<Item> search(@Param("chatId") Long chatId,
                      @Param("namePattern") String namePattern,
                      @Param("creatorId") Long creatorId,
                      @Param("createdFrom") LocalDateTime createdFrom,
                      @Param("createdTo") LocalDateTime createdTo,
                      Pageable pageable);

    /**
     * Поменять наличие у всех подходящих строк.
     * chatId / creatorId = NULL — не ограничивать.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Item i SET i.available = :available WHERE LOWER(i.name) = LOWER(:name)"
            + " AND (:chatId IS NULL OR i.chatId = :chatId)"
            + " AND (:creatorId IS NULL OR i.createdByUserId = :creatorId)")
    int updateAvailability(@Param("name") String name,
                           @Param("available") Boolean available,
                           @Param("chatId") Long chatId,
                           @Param("creatorId") Long creatorId);

    /** Удалить все товары чата с таким именем (админ) */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM Item i WHERE i.chatId = :chatId AND LOWER(i.name) = LOWER(:name)")
    int deleteByChatIdAndName(@Param("chatId") Long chatId, @Param("name") String name);

    /** Удалить только свои товары с таким именем (обычный пользователь) */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM Item i WHERE i.chatId = :chatId AND LOWER(i.name) = LOWER(:name)"
            + " AND i.createdByUserId = :creatorId")
    int deleteByChatIdAndNameAndCreator(@Param("chatId") Long chatId,
                                        @Param("name") String name,
                                        @Param("creatorId") Long creatorId);
}
