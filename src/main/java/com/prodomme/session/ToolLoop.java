package com.prodomme.session;

import com.prodomme.AppLogger;
import com.prodomme.models.ContentItem;
import com.prodomme.models.Message;
import com.prodomme.models.Role;
import com.prodomme.models.TextContent;
import com.prodomme.models.ToolResultContent;
import com.prodomme.models.ToolUseContent;
import com.prodomme.providers.chat.InferenceException;
import com.prodomme.tools.ToolDispatcher;
import com.prodomme.tools.ToolInputException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Drives a user request to completion: send, run every tool the model asks for,
 * send the results back, and repeat until the model stops calling tools.
 */
public class ToolLoop {

    public static final int DEFAULT_MAX_ROUNDS = 25;

    private final ChatSession session;
    private final ToolDispatcher dispatcher;
    private final TurnListener listener;
    private final int maxRounds;
    private final AppLogger logger = AppLogger.get();
    // Results owed to tool calls the last reply left unanswered.
    private final List<ToolResultContent> pendingResults = new ArrayList<>();

    public ToolLoop(ChatSession session, ToolDispatcher dispatcher, TurnListener listener) {
        this(session, dispatcher, listener, DEFAULT_MAX_ROUNDS);
    }

    public ToolLoop(ChatSession session, ToolDispatcher dispatcher, TurnListener listener, int maxRounds) {
        this.session = session;
        this.dispatcher = dispatcher;
        this.listener = listener != null ? listener : TurnListener.NONE;
        this.maxRounds = Math.max(1, maxRounds);
    }

    /**
     * @return the model's final reply, the first one without tool calls, or the last one
     *         received before the round limit
     */
    public Message run(String userText) throws InferenceException, IOException, InterruptedException {
        List<ContentItem> content = new ArrayList<>(pendingResults);
        content.add(new TextContent(userText));
        Message reply = session.send(new Message(Role.USER, content));
        pendingResults.clear();
        listener.onAssistantMessage(reply);

        int rounds = 0;
        while (!reply.toolUses().isEmpty()) {
            if (rounds >= maxRounds) {
                logger.warn("Stopping tool loop after " + maxRounds + " rounds");
                for (ToolUseContent toolUse : reply.toolUses()) {
                    pendingResults.add(new ToolResultContent(toolUse.getId(),
                        "Tool call skipped: round limit of " + maxRounds + " reached."));
                }
                break;
            }
            rounds++;
            List<ToolResultContent> results = new ArrayList<>();
            for (ToolUseContent toolUse : reply.toolUses()) {
                results.add(new ToolResultContent(toolUse.getId(), runTool(toolUse)));
            }
            try {
                reply = session.send(Message.toolResults(results));
            } catch (InferenceException | IOException e) {
                // The send was rolled back; deliver these results with the next request.
                pendingResults.addAll(results);
                throw e;
            }
            listener.onAssistantMessage(reply);
        }
        return reply;
    }

    private String runTool(ToolUseContent toolUse) throws InterruptedException {
        listener.onToolUse(toolUse);
        String output;
        try {
            output = dispatcher.dispatch(toolUse);
        } catch (ToolInputException e) {
            // Providers reject a tool call that has no matching result.
            logger.warn("Malformed tool call " + toolUse.getId() + ": " + e.getMessage());
            output = "Error: " + e.getMessage();
        }
        listener.onToolResult(toolUse, output);
        return output;
    }

    /**
     * Forget the conversation, including results owed to calls that belonged to it.
     */
    public void clear() {
        pendingResults.clear();
        session.clear();
    }

    public List<ToolResultContent> getPendingResults() {
        return List.copyOf(pendingResults);
    }
}
