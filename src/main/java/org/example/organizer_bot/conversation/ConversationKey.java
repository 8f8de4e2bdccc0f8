package org.example.organizer_bot.conversation;

/**
 * Ключ беседы: чат + пользователь. В групповом чате у каждого участника свой диалог.
 */
public record ConversationKey(Long chatId, Long userId) {
}
