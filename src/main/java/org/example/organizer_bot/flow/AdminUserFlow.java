package org.example.organizer_bot.flow;

import lombok.extern.slf4j.Slf4j;
import org.example.organizer_bot.event.ActionType;
import org.example.organizer_bot.event.BotAction;
import org.example.organizer_bot.event.Reply;
import org.example.organizer_bot.model.FlowFamily;
import org.example.organizer_bot.model.FlowState;
import org.example.organizer_bot.model.RoleName;
import org.example.organizer_bot.model.User;
import org.example.organizer_bot.service.PermissionService;
import org.example.organizer_bot.service.UserService;

import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Управление пользователями: список, добавление, смена роли, удаление.
 * Права админа проверяются на каждом шаге, а не только на входе.
 */
@Slf4j
class AdminUserFlow implements ConversationFlow {

    private static final Pattern TELEGRAM_ID = Pattern.compile("\\d{1,18}");
    private static final DateTimeFormatter CREATED_FORMAT = DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm");
    private static final int USER_LIST_LIMIT = 50;

    private static final String ID_PROMPT = "Введите Telegram ID пользователя (только цифры):";

    private final UserService userService;
    private final PermissionService permissionService;

    AdminUserFlow(UserService userService, PermissionService permissionService) {
        this.userService = userService;
        this.permissionService = permissionService;
    }

    @Override
    public FlowFamily getFamily() {
        return FlowFamily.ADMIN_USERS;
    }

    /** Вход в админку */
    List<Reply> openPanel(FlowContext ctx) {
        if (!permissionService.isAdmin(ctx.getUserId())) {
            return deny(ctx);
        }
        return List.of(panel(ctx, "👤 Управление пользователями"));
    }

    List<Reply> listUsers(FlowContext ctx) {
        if (!permissionService.isAdmin(ctx.getUserId())) {
            return deny(ctx);
        }
        List<User> users;
        try {
            users = userService.list(USER_LIST_LIMIT);
        } catch (RuntimeException e) {
            return storageFault(ctx, e);
        }
        if (users.isEmpty()) {
            return List.of(panel(ctx, "Пользователей пока нет."));
        }
        StringBuilder sb = new StringBuilder("👥 Пользователи (" + users.size() + "):\n\n");
        for (User user : users) {
            sb.append(user.getTelegramUserId())
                    .append(" — ").append(user.getRole() == null ? "?" : user.getRole().getName());
            if (user.getCreatedAt() != null) {
                sb.append(" (с ").append(user.getCreatedAt().format(CREATED_FORMAT)).append(')');
            }
            sb.append('\n');
        }
        return List.of(panel(ctx, sb.toString().trim()));
    }

    List<Reply> startAddUser(FlowContext ctx) {
        return startStep(ctx, FlowState.WAITING_MANAGE_ADD_USER_ID, "➕ Добавление пользователя\n\n");
    }

    List<Reply> startSetRole(FlowContext ctx) {
        return startStep(ctx, FlowState.WAITING_MANAGE_SET_ROLE_ID, "🔁 Смена роли\n\n");
    }

    List<Reply> startRemoveUser(FlowContext ctx) {
        return startStep(ctx, FlowState.WAITING_MANAGE_REMOVE_USER_ID, "🗑 Удаление пользователя\n\n");
    }

    @Override
    public List<Reply> onText(FlowContext ctx, String text) {
        if (!permissionService.isAdmin(ctx.getUserId())) {
            return deny(ctx);
        }

        switch (ctx.getState()) {
            case WAITING_MANAGE_ADD_USER_ID: {
                Optional<Long> id = parseId(text);
                if (id.isEmpty()) {
                    return retryId(ctx);
                }
                ctx.getConversation().setTargetTelegramId(id.get());
                ctx.moveTo(FlowState.WAITING_MANAGE_ADD_USER_ROLE);
                return List.of(roleQuestion(ctx, ActionType.ADMIN_ADD_USER_ROLE, "Роль для " + id.get() + "?"));
            }
            case WAITING_MANAGE_ADD_USER_ROLE: {
                Optional<RoleName> role = RoleName.fromName(text);
                if (role.isEmpty()) {
                    return List.of(roleQuestion(ctx, ActionType.ADMIN_ADD_USER_ROLE,
                            FlowMessages.INVALID_VALUE + "Выберите роль:"));
                }
                return commitAdd(ctx, role.get());
            }
            case WAITING_MANAGE_SET_ROLE_ID: {
                Optional<Long> id = parseId(text);
                if (id.isEmpty()) {
                    return retryId(ctx);
                }
                Optional<User> user;
                try {
                    user = userService.getByTelegramId(id.get());
                } catch (RuntimeException e) {
                    return storageFault(ctx, e);
                }
                if (user.isEmpty()) {
                    ctx.reset();
                    return List.of(panel(ctx, "❌ Пользователь " + id.get() + " не найден."));
                }
                ctx.getConversation().setTargetTelegramId(id.get());
                ctx.moveTo(FlowState.WAITING_MANAGE_SET_ROLE_CHOICE);
                return List.of(roleQuestion(ctx, ActionType.ADMIN_SET_ROLE_CHOICE,
                        "Сейчас роль: " + user.get().getRole().getName() + "\nНовая роль?"));
            }
            case WAITING_MANAGE_SET_ROLE_CHOICE: {
                Optional<RoleName> role = RoleName.fromName(text);
                if (role.isEmpty()) {
                    return List.of(roleQuestion(ctx, ActionType.ADMIN_SET_ROLE_CHOICE,
                            FlowMessages.INVALID_VALUE + "Выберите роль:"));
                }
                return commitSetRole(ctx, role.get());
            }
            case WAITING_MANAGE_REMOVE_USER_ID: {
                Optional<Long> id = parseId(text);
                if (id.isEmpty()) {
                    return retryId(ctx);
                }
                return commitRemove(ctx, id.get());
            }
            default:
                log.warn("Неожиданный шаг админки: state={}", ctx.getState());
                return List.of();
        }
    }

    @Override
    public List<Reply> onAction(FlowContext ctx, BotAction action) {
        if (!permissionService.isAdmin(ctx.getUserId())) {
            return deny(ctx);
        }
        Optional<RoleName> role = RoleName.fromName(action.getValue());

        switch (action.getType()) {
            case ADMIN_ADD_USER_ROLE:
                if (role.isEmpty()) {
                    return List.of(roleQuestion(ctx, ActionType.ADMIN_ADD_USER_ROLE,
                            FlowMessages.INVALID_VALUE + "Выберите роль:"));
                }
                return commitAdd(ctx, role.get());
            case ADMIN_SET_ROLE_CHOICE:
                if (role.isEmpty()) {
                    return List.of(roleQuestion(ctx, ActionType.ADMIN_SET_ROLE_CHOICE,
                            FlowMessages.INVALID_VALUE + "Выберите роль:"));
                }
                return commitSetRole(ctx, role.get());
            default:
                return List.of();
        }
    }

    private List<Reply> startStep(FlowContext ctx, FlowState state, String title) {
        if (!permissionService.isAdmin(ctx.getUserId())) {
            return deny(ctx);
        }
        ctx.reset();
        ctx.moveTo(state);
        return List.of(Reply.prompt(ctx.getChatId(), title + ID_PROMPT));
    }

    private List<Reply> commitAdd(FlowContext ctx, RoleName role) {
        Long target = ctx.getConversation().getTargetTelegramId();
        try {
            userService.create(target, role);
        } catch (IllegalArgumentException e) {
            ctx.reset();
            return List.of(panel(ctx, "⚠️ Пользователь " + target + " уже существует."));
        } catch (RuntimeException e) {
            return storageFault(ctx, e);
        }
        ctx.reset();
        log.info("Админ {} добавил пользователя с ролью {}", ctx.getUserId(), role.getDbName());
        log.debug("Добавлен пользователь: telegramId={}", target);
        return List.of(panel(ctx, "✅ Пользователь " + target + " добавлен с ролью " + role.getDbName() + "."));
    }

    private List<Reply> commitSetRole(FlowContext ctx, RoleName role) {
        Long target = ctx.getConversation().getTargetTelegramId();
        Optional<User> updated;
        try {
            updated = userService.setRole(target, role);
        } catch (RuntimeException e) {
            return storageFault(ctx, e);
        }
        ctx.reset();
        if (updated.isEmpty()) {
            return List.of(panel(ctx, "❌ Пользователь " + target + " не найден."));
        }
        log.info("Админ {} сменил роль пользователя на {}", ctx.getUserId(), role.getDbName());
        log.debug("Сменена роль: telegramId={}", target);
        return List.of(panel(ctx, "✅ Роль пользователя " + target + " изменена на " + role.getDbName() + "."));
    }

    private List<Reply> commitRemove(FlowContext ctx, Long target) {
        boolean deleted;
        try {
            deleted = userService.delete(target);
        } catch (RuntimeException e) {
            return storageFault(ctx, e);
        }
        ctx.reset();
        if (!deleted) {
            return List.of(panel(ctx, "❌ Пользователь " + target + " не найден."));
        }
        log.info("Админ {} удалил пользователя", ctx.getUserId());
        log.debug("Удалён пользователь: telegramId={}", target);
        return List.of(panel(ctx, "🗑 Пользователь " + target + " удалён."));
    }

    private static Optional<Long> parseId(String text) {
        String value = text == null ? "" : text.trim();
        if (!TELEGRAM_ID.matcher(value).matches()) {
            return Optional.empty();
        }
        return Optional.of(Long.parseLong(value));
    }

    private List<Reply> retryId(FlowContext ctx) {
        return List.of(Reply.prompt(ctx.getChatId(), FlowMessages.INVALID_VALUE + ID_PROMPT));
    }

    private List<Reply> deny(FlowContext ctx) {
        log.info("Попытка доступа к админке без прав: userId={}", ctx.getUserId());
        ctx.reset();
        return List.of(Reply.text(ctx.getChatId(), FlowMessages.NOT_AUTHORIZED));
    }

    private List<Reply> storageFault(FlowContext ctx, RuntimeException e) {
        log.error("Ошибка БД в админке: chatId={}, error={}: {}",
                ctx.getChatId(), e.getClass().getSimpleName(), e.getMessage());
        ctx.reset();
        return List.of(Reply.text(ctx.getChatId(), FlowMessages.STORAGE_FAULT));
    }

    private Reply roleQuestion(FlowContext ctx, ActionType type, String text) {
        return Reply.builder()
                .chatId(ctx.getChatId())
                .text(text)
                .buttons(Keyboards.roles(type))
                .build();
    }

    private Reply panel(FlowContext ctx, String text) {
        return Reply.builder()
                .chatId(ctx.getChatId())
                .text(text)
                .buttons(Keyboards.adminPanel())
                .build();
    }
}
