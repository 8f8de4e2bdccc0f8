package org.example.organizer_bot.service;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.example.organizer_bot.model.RoleName;
import org.example.organizer_bot.model.User;
import org.example.organizer_bot.repository.RoleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import(UserService.class)
class UserServiceTest {

    @Autowired
    private UserService userService;

    @Autowired
    private RoleRepository roleRepository;

    @BeforeEach
    void seedRoles() {
        new RoleSeeder(roleRepository).seed();
    }

    @Test
    void seedingTwiceKeepsOneRowPerRole() {
        new RoleSeeder(roleRepository).seed();

        assertThat(roleRepository.findAll()).hasSize(RoleName.values().length);
    }

    @Test
    void createdUserIsFoundWithRole() {
        userService.create(500L, RoleName.ADMIN);

        User user = userService.getByTelegramId(500L).orElseThrow();

        assertThat(user.getRole().getName()).isEqualTo("admin");
    }

    @Test
    void duplicateCreateIsRejected() {
        userService.create(501L, RoleName.USER);

        assertThatThrownBy(() -> userService.create(501L, RoleName.ADMIN))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void setRoleChangesRoleOfKnownUser() {
        userService.create(502L, RoleName.USER);

        assertThat(userService.setRole(502L, RoleName.ADMIN)).isPresent();
        assertThat(userService.getByTelegramId(502L).orElseThrow().getRole().getName()).isEqualTo("admin");
    }

    @Test
    void setRoleAndDeleteReportUnknownUser() {
        assertThat(userService.setRole(999L, RoleName.ADMIN)).isEmpty();
        assertThat(userService.delete(999L)).isFalse();
    }

    @Test
    void deleteRemovesUser() {
        userService.create(503L, RoleName.USER);

        assertThat(userService.delete(503L)).isTrue();
        assertThat(userService.getByTelegramId(503L)).isEmpty();
    }

    @Test
    void listReturnsUsersWithRoles() {
        userService.create(504L, RoleName.USER);
        userService.create(505L, RoleName.ADMIN);

        List<User> users = userService.list(10);

        assertThat(users).extracting(User::getTelegramUserId).contains(504L, 505L);
        assertThat(users).allSatisfy(u -> assertThat(u.getRole()).isNotNull());
    }

    @Test
    void telegramIdsAreLoggedOnlyAtDebug() {
        Logger logger = (Logger) LoggerFactory.getLogger(UserService.class);
        ListAppender<ILoggingEvent> logs = new ListAppender<>();
        logs.start();
        logger.addAppender(logs);
        try {
            userService.create(9_100_200_300L, RoleName.USER);
            userService.setRole(9_100_200_300L, RoleName.ADMIN);
            userService.delete(9_100_200_300L);
            userService.delete(9_100_200_300L);
        } finally {
            logger.detachAppender(logs);
        }

        assertThat(logs.list)
                .filteredOn(e -> e.getLevel().isGreaterOrEqual(Level.INFO))
                .isNotEmpty()
                .extracting(ILoggingEvent::getFormattedMessage)
                .noneMatch(m -> m.contains("9100200300"));
    }
}
