package org.example.organizer_bot.event;

public enum EventKind {
    /** Слэш-команда (/start, /menu, /cancel, /stop) */
    COMMAND,
    /** Обычный текст */
    TEXT,
    /** Нажатие inline-кнопки */
    BUTTON
}
