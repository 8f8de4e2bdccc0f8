package org.example.organizer_bot.model;

import jakarta.persistence.*;
import lombok.*;

/**
 * Справочник ролей. Строки "admin" и "user" создаёт RoleSeeder при старте,
 * больше роли нигде не создаются.
 */
@Entity
@Table(name = "roles")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Role {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Integer id;

    @Column(name = "name", nullable = false, unique = true, length = 50)
    private String name;
}
