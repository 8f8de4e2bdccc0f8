package org.example.organizer_bot.model;

/**
 * Семейства диалогов. В каждый момент у беседы активно не больше одного.
 */
public enum FlowFamily {
    ADD_ITEM,
    UPDATE_ITEM,
    REMOVE_ITEM,
    CHANGE_AVAILABILITY,
    ADMIN_USERS
}
