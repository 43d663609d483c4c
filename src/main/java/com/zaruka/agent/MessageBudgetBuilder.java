package com.zaruka.agent;

import com.zaruka.shared.config.AgentSettings;
import com.zaruka.shared.model.Attachment;
import com.zaruka.shared.model.ChatMessage;
import com.zaruka.shared.model.ContentPart;
import com.zaruka.shared.model.ConversationTurn;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Assembles the message list for one request so that system prompt, tool
 * catalog, current turn and as much recent history as fits stay within the
 * context ceiling minus the response reserve.
 *
 * <p>History is taken newest-first and the walk stops at the first turn that
 * does not fit, so an older turn is never included once a newer one is skipped.
 */
public class MessageBudgetBuilder {

    private final AgentSettings settings;

    public MessageBudgetBuilder(AgentSettings settings) {
        this.settings = settings;
    }

    public List<ChatMessage> build(String systemPrompt, List<String> toolNames, String userMessage,
                                   List<ConversationTurn> history, List<Attachment> attachments) {
        var tools = toolNames != null ? toolNames : List.<String>of();
        var files = attachments != null ? attachments : List.<Attachment>of();

        int budget = settings.maxContextTokens() - fixedOverhead(systemPrompt, tools)
                - currentTurnCost(userMessage, files);

        var messages = new ArrayList<ChatMessage>();
        if (history != null && budget > 0) {
            var fitting = new ArrayList<ChatMessage>();
            for (int i = history.size() - 1; i >= 0; i--) {
                var turn = history.get(i);
                var text = render(turn);
                int tokens = TokenEstimator.estimate(text);
                if (tokens > budget) break;
                budget -= tokens;
                fitting.add(ChatMessage.of(turn.role(), text));
            }
            Collections.reverse(fitting);
            messages.addAll(fitting);
        }
        messages.add(currentTurn(userMessage, files));
        return messages;
    }

    /** System prompt, tool names, per-tool schema estimate and the response reserve. */
    int fixedOverhead(String systemPrompt, List<String> toolNames) {
        return TokenEstimator.estimate(systemPrompt)
                + TokenEstimator.estimate(toolNameList(toolNames))
                + toolNames.size() * settings.tokensPerTool()
                + settings.responseReserve();
    }

    int currentTurnCost(String userMessage, List<Attachment> attachments) {
        return TokenEstimator.estimate(userMessage)
                + TokenEstimator.estimate(attachments, settings.imageTokens());
    }

    String render(ConversationTurn turn) {
        var text = turn.text();
        if (text.length() > settings.historyCharLimit()) {
            text = text.substring(0, settings.historyCharLimit()) + "...";
        }
        return turn.hasAttachment() ? "[attached: " + turn.attachmentDescriptor() + "] " + text : text;
    }

    private static ChatMessage currentTurn(String userMessage, List<Attachment> attachments) {
        if (attachments.isEmpty()) {
            return ChatMessage.user(userMessage);
        }
        var parts = new ArrayList<ContentPart>();
        for (var a : attachments) parts.add(ContentPart.of(a));
        parts.add(new ContentPart.Text(userMessage));
        return ChatMessage.user(parts);
    }

    private static String toolNameList(List<String> names) {
        if (names.isEmpty()) return "[]";
        return "[\"" + String.join("\",\"", names) + "\"]";
    }
}
