package org.example.organizer_bot.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Товар, который пользователь зарегистрировал в чате.
 * <p>
 * Тип всегда хранится в нижнем регистре. Цена может быть NULL,
 * а created_by_user_id — NULL у старых строк (до появления владельцев).
 */
@Entity
@Table(name = "organizer_items", indexes = {
        @Index(name = "idx_organizer_chat_created", columnList = "chat_id, created_at"),
        @Index(name = "idx_organizer_chat_name", columnList = "chat_id, item_name"),
        @Index(name = "idx_organizer_created_by", columnList = "created_by_user_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Item {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "item_name", nullable = false, length = 255)
    private String name;

    @Column(name = "item_amount", nullable = false)
    private Integer amount;

    /** Тип товара в нижнем регистре ("spare part", "miscellaneous", ...) */
    @Column(name = "item_type", nullable = false, length = 255)
    private String type;

    @Column(name = "item_price", precision = 10, scale = 2)
    private BigDecimal price;

    @Column(name = "availability", nullable = false)
    @Builder.Default
    private Boolean available = false;

    /** Чат, в котором товар создан (все поиски идут внутри чата) */
    @Column(name = "chat_id", nullable = false)
    private Long chatId;

    /**
     * Telegram ID создателя.
     * NULL — строка старая, обычный пользователь её менять не может.
     */
    @Column(name = "created_by_user_id")
    private Long createdByUserId;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
