package com.questrail.meshgate.irc;

import java.util.ArrayList;
import java.util.List;

/**
 * Test {@link ChatOutput} that records room lines and per-nickname notices.
 */
public final class RecordingChatOutput implements ChatOutput {

    public record Notice(String nickname, String text) {}

    private final List<String> room = new ArrayList<>();
    private final List<Notice> notices = new ArrayList<>();
    private int activeSessions;

    @Override
    public synchronized void sendToRoom(String text) {
        room.add(text);
    }

    @Override
    public synchronized void sendToSession(String nickname, String text) {
        notices.add(new Notice(nickname, text));
    }

    @Override
    public synchronized int activeSessionCount() {
        return activeSessions;
    }

    public synchronized void activeSessions(int count) {
        this.activeSessions = count;
    }

    public synchronized List<String> roomLines() {
        return new ArrayList<>(room);
    }

    public synchronized List<Notice> notices() {
        return new ArrayList<>(notices);
    }

    /** Text of every notice sent to {@code nickname}, in order. */
    public synchronized List<String> noticesTo(String nickname) {
        List<String> out = new ArrayList<>();
        for (Notice n : notices) {
            if (n.nickname().equals(nickname)) {
                out.add(n.text());
            }
        }
        return out;
    }

    public synchronized void clear() {
        room.clear();
        notices.clear();
    }
}
