package com.prodomme.session;

import com.prodomme.AppLogger;
import com.prodomme.models.Message;
import com.prodomme.models.ModelResponse;
import com.prodomme.models.Role;
import com.prodomme.models.ToolResultContent;
import com.prodomme.providers.chat.ChatProvider;
import com.prodomme.providers.chat.InferenceException;
import com.prodomme.workspace.ProjectTree;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Conversation history bound to one provider.
 * <p>
 * History only ever reflects complete, successful turns: each {@link #send} works on a
 * copy and commits it only when the provider answers, so a failed send leaves history
 * exactly as it was and can be retried without duplicating the user message.
 * One turn at a time; concurrent sends are serialized.
 */
public class ChatSession {

    private final List<Message> history = new ArrayList<>();
    private final ChatProvider provider;
    private final TokenEstimator tokenEstimator;
    private final ProjectTree projectTree;
    private final int maxTokens;
    private final AppLogger logger = AppLogger.get();

    public ChatSession(ChatProvider provider, TokenEstimator tokenEstimator, ProjectTree projectTree, int maxTokens) {
        this.provider = provider;
        this.tokenEstimator = tokenEstimator;
        this.projectTree = projectTree;
        this.maxTokens = Math.max(0, maxTokens);
    }

    /**
     * Send a user message and return the assistant's reply.
     *
     * @throws InvalidRoleException if the message is not from the user
     * @throws IOException if the project file tree cannot be listed
     * @throws InferenceException if the provider query fails; history is unchanged
     */
    public synchronized Message send(Message userMessage)
        throws InferenceException, IOException, InterruptedException {
        if (userMessage.getRole() != Role.USER) {
            throw new InvalidRoleException(userMessage.getRole());
        }
        String systemMessage = SystemPrompts.codingAssistant(projectTree.getTree());

        List<Message> working = new ArrayList<>(history);
        int evicted = trimToBudget(working);
        if (evicted > 0) {
            logger.info("Dropped " + evicted + " oldest message(s) to stay within " + maxTokens + " tokens");
        }
        working.add(userMessage);

        ModelResponse response;
        try {
            response = provider.query(Collections.unmodifiableList(working), systemMessage);
        } catch (InferenceException e) {
            logger.warn("Turn rolled back: " + e.getMessage());
            throw e;
        }

        Message reply = response.toAssistantMessage();
        working.add(reply);
        history.clear();
        history.addAll(working);
        return reply;
    }

    /**
     * Drop the oldest messages until the estimate fits the budget or nothing is left,
     * then keep dropping until the first message is plain user input, so no tool result
     * outlives the assistant message that called the tool. What remains is always a
     * contiguous suffix of the input.
     *
     * @return number of messages removed
     */
    int trimToBudget(List<Message> messages) {
        int evicted = 0;
        while (!messages.isEmpty() && estimateTokens(messages) > maxTokens) {
            messages.remove(0);
            evicted++;
        }
        while (!messages.isEmpty() && !startsTurn(messages.get(0))) {
            messages.remove(0);
            evicted++;
        }
        return evicted;
    }

    private static boolean startsTurn(Message message) {
        return message.getRole() == Role.USER
            && message.getContent().stream().noneMatch(ToolResultContent.class::isInstance);
    }

    int estimateTokens(List<Message> messages) {
        int total = 0;
        for (Message message : messages) {
            total += estimateTokens(message);
        }
        return total;
    }

    public int estimateTokens(Message message) {
        return tokenEstimator.countTokens(message.getRole().wireName() + " " + message.flattenText());
    }

    public synchronized int estimateTokens() {
        return estimateTokens(history);
    }

    public synchronized List<Message> getHistory() {
        return List.copyOf(history);
    }

    public synchronized void clear() {
        history.clear();
    }

    public ChatProvider getProvider() {
        return provider;
    }

    public int getMaxTokens() {
        return maxTokens;
    }
}
