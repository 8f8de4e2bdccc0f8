package org.example.organizer_bot.service;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.organizer_bot.model.Role;
import org.example.organizer_bot.model.RoleName;
import org.example.organizer_bot.repository.RoleRepository;
import org.springframework.stereotype.Component;

/**
 * Засеивает справочник ролей при старте (admin, user).
 * Уже существующие строки не трогает.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoleSeeder {

    private final RoleRepository roleRepository;

    @PostConstruct
    public void seed() {
        for (RoleName roleName : RoleName.values()) {
            if (roleRepository.findByName(roleName.getDbName()).isEmpty()) {
                roleRepository.save(Role.builder().name(roleName.getDbName()).build());
                log.info("Роль создана: {}", roleName.getDbName());
            }
        }
    }
}
