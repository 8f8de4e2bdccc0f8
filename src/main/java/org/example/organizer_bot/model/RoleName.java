package org.example.organizer_bot.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Роли, которые понимает бот.
 * В БД лежат строкой в таблице roles (admin / user).
 */
public enum RoleName {

    ADMIN("admin"),

    USER("user");

    private final String dbName;

    RoleName(String dbName) {
        this.dbName = dbName;
    }

    public String getDbName() {
        return dbName;
    }

    /**
     * Разобрать имя роли из БД или из текста админа ("Admin", "USER" и т.п.).
     */
    public static Optional<RoleName> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(r -> r.dbName.equals(normalized))
                .findFirst();
    }
}
