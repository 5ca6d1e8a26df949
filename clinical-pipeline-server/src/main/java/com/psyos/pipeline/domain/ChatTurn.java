package com.psyos.pipeline.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One chat-completion message: role is system, user or assistant.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChatTurn {

    public static final String SYSTEM = "system";
    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    private String role;
    private String content;

    public static ChatTurn system(String content) {
        return new ChatTurn(SYSTEM, content);
    }

    public static ChatTurn user(String content) {
        return new ChatTurn(USER, content);
    }

    public static ChatTurn assistant(String content) {
        return new ChatTurn(ASSISTANT, content);
    }
}
