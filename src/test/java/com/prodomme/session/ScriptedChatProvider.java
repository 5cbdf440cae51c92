package com.prodomme.session;

import com.prodomme.models.ContentItem;
import com.prodomme.models.Message;
import com.prodomme.models.ModelResponse;
import com.prodomme.models.TextContent;
import com.prodomme.providers.chat.ChatProvider;
import com.prodomme.providers.chat.InferenceException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Replays queued replies or failures and records every request.
 */
class ScriptedChatProvider implements ChatProvider {

    private final Deque<Object> script = new ArrayDeque<>();
    final List<List<Message>> requests = new ArrayList<>();
    final List<String> systemMessages = new ArrayList<>();

    ScriptedChatProvider reply(ContentItem... content) {
        script.add(new ModelResponse(List.of(content), "msg_" + script.size(), "scripted", "assistant", "end_turn", null));
        return this;
    }

    ScriptedChatProvider replyText(String text) {
        return reply(new TextContent(text));
    }

    ScriptedChatProvider fail(InferenceException e) {
        script.add(e);
        return this;
    }

    @Override
    public String getProviderName() {
        return "scripted";
    }

    @Override
    public ModelResponse query(List<Message> messages, String systemMessage) throws InferenceException {
        requests.add(List.copyOf(messages));
        systemMessages.add(systemMessage);
        Object next = script.poll();
        if (next == null) {
            throw new IllegalStateException("No scripted reply left");
        }
        if (next instanceof InferenceException) {
            throw (InferenceException) next;
        }
        return (ModelResponse) next;
    }

    List<Message> lastRequest() {
        return requests.get(requests.size() - 1);
    }
}
