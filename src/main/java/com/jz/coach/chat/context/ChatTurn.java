package com.jz.coach.chat.context;

/** 历史中的一轮发言：role 为 user / assistant */
public record ChatTurn(String role, String text) {

    public static ChatTurn user(String text) { return new ChatTurn("user", text); }

    public static ChatTurn assistant(String text) { return new ChatTurn("assistant", text); }

    public boolean isUser() {
        return "user".equalsIgnoreCase(role);
    }

    public String safeText() {
        return text == null ? "" : text;
    }
}
