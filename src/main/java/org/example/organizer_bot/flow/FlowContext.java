package org.example.organizer_bot.flow;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.example.organizer_bot.model.ConversationState;
import org.example.organizer_bot.model.FlowState;

/**
 * Кто пишет, куда отвечать и состояние его беседы.
 * Создаётся диспетчером на одно событие, уже под локом беседы.
 */
@Getter
@AllArgsConstructor
public class FlowContext {

    private final Long chatId;
    private final Long userId;
    private final ConversationState conversation;

    public FlowState getState() {
        return conversation.getState();
    }

    public void moveTo(FlowState state) {
        conversation.setState(state);
    }

    /** Сбросить шаг и черновые данные */
    public void reset() {
        conversation.reset();
    }
}
