package com.printshop_voice_backend.services;

import com.printshop_voice_backend.dto.ConversationMessage;

import java.util.ArrayList;
import java.util.List;

/**
 * Bounded, ordered conversation log of one session.
 * When full, the log is cut to its most recent {@code maxEntries - trimSlack} entries before appending.
 */
public class ConversationHistory {

    private final int maxEntries;
    private final int trimSlack;
    private final List<ConversationMessage> entries = new ArrayList<>();

    public ConversationHistory(int maxEntries, int trimSlack) {
        if (trimSlack < 1 || trimSlack >= maxEntries) {
            throw new IllegalArgumentException("trimSlack must be between 1 and maxEntries - 1");
        }
        this.maxEntries = maxEntries;
        this.trimSlack = trimSlack;
    }

    public synchronized void append(ConversationMessage message) {
        if (entries.size() >= maxEntries) {
            int keep = maxEntries - trimSlack;
            entries.subList(0, entries.size() - keep).clear();
        }
        entries.add(message);
    }

    /**
     * Detached working copy with the same bounds.
     */
    public synchronized ConversationHistory copy() {
        ConversationHistory copy = new ConversationHistory(maxEntries, trimSlack);
        copy.entries.addAll(entries);
        return copy;
    }

    public synchronized List<ConversationMessage> snapshot() {
        return new ArrayList<>(entries);
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }

    public int getMaxEntries() {
        return maxEntries;
    }
}
