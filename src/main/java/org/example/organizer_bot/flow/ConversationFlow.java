package org.example.organizer_bot.flow;

import org.example.organizer_bot.event.BotAction;
import org.example.organizer_bot.event.Reply;
import org.example.organizer_bot.model.FlowFamily;

import java.util.List;

/**
 * Один многошаговый диалог. Движок зовёт его, только когда текущий шаг
 * беседы принадлежит этому диалогу.
 */
interface ConversationFlow {

    FlowFamily getFamily();

    /** Текст пользователя на одном из шагов диалога */
    List<Reply> onText(FlowContext ctx, String text);

    /** Кнопка, привязанная к текущему шагу (протухшие отсеяны движком) */
    List<Reply> onAction(FlowContext ctx, BotAction action);
}
