package org.example.organizer_bot.handler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.organizer_bot.event.Reply;
import org.example.organizer_bot.flow.FlowContext;
import org.example.organizer_bot.model.RoleName;
import org.example.organizer_bot.service.PermissionService;
import org.example.organizer_bot.service.UserService;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class StartCommandHandler {

    private final UserService userService;
    private final PermissionService permissionService;

    /**
     * Обработать команду /start.
     * Сбрасывает диалог, при первом заходе регистрирует юзера с ролью user
     * и показывает клавиатуру меню.
     */
    public List<Reply> handle(FlowContext ctx) {
        ctx.reset();
        Long telegramId = ctx.getUserId();
        log.info("Обработка команды /start: telegramId={}, chatId={}", telegramId, ctx.getChatId());

        registerIfNew(telegramId);

        return List.of(Reply.builder()
                .chatId(ctx.getChatId())
                .text("Привет! 👋\n\n" +
                        "Я помогу вести учёт товаров: добавлять, менять, удалять и отмечать наличие.\n" +
                        "Выберите действие на клавиатуре или откройте /menu.")
                .menuKeyboard(MainMenu.keyboardRows())
                .build());
    }

    /**
     * Запасных админов в БД не пишем: их роль берётся из настроек.
     * Ошибка регистрации пользователю не показывается.
     */
    private void registerIfNew(Long telegramId) {
        if (telegramId == null || permissionService.isFallbackAdmin(telegramId)) {
            return;
        }
        try {
            if (userService.getByTelegramId(telegramId).isEmpty()) {
                userService.create(telegramId, RoleName.USER);
                log.info("Новый пользователь зарегистрирован: telegramId={}", telegramId);
            }
        } catch (IllegalArgumentException e) {
            // Параллельный /start успел раньше
            log.debug("Пользователь уже зарегистрирован: telegramId={}", telegramId);
        } catch (RuntimeException e) {
            log.error("Ошибка при регистрации пользователя: telegramId={}, error={}: {}",
                    telegramId, e.getClass().getSimpleName(), e.getMessage());
        }
    }
}
