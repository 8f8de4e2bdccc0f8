package org.example.organizer_bot;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;

import java.time.Clock;

@Slf4j
@Configuration
public class Config {

    /**
     * Регистрирует Telegram-бота (long polling).
     *
     * @param bot основной Bot
     * @return TelegramBotsApi
     */
    @Bean
    TelegramBotsApi telegramBotsApi(Bot bot) {
        try {
            TelegramBotsApi telegramBotsApi = new TelegramBotsApi(DefaultBotSession.class);
            telegramBotsApi.registerBot(bot);
            log.info("Бот зарегистрирован: username={}", bot.getBotUsername());
            return telegramBotsApi;
        } catch (TelegramApiException e) {
            log.error("Не удалось зарегистрировать бота в Telegram API: {}", e.getMessage());
            throw new IllegalStateException("Не удалось зарегистрировать Telegram бота. Проверьте токен и подключение к интернету.", e);
        }
    }

    /**
     * Часы для рабочего времени и простоя бесед (в тестах подменяются).
     */
    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
