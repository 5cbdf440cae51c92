package com.prodomme.session;

import com.prodomme.models.Message;
import com.prodomme.models.ToolUseContent;

/**
 * Callbacks for displaying a tool loop as it runs.
 */
public interface TurnListener {

    TurnListener NONE = new TurnListener() {
    };

    default void onAssistantMessage(Message message) {
    }

    default void onToolUse(ToolUseContent toolUse) {
    }

    default void onToolResult(ToolUseContent toolUse, String output) {
    }
}
