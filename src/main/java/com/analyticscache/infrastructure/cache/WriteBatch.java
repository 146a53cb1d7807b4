package com.analyticscache.infrastructure.cache;

import lombok.Value;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Commands staged for one pipelined round trip.
 */
public class WriteBatch {

    public enum CommandType {
        SET,
        SADD,
        EXPIRE
    }

    @Value
    public static class Command {
        CommandType type;
        String key;
        String value;
        Duration ttl;
    }

    private final List<Command> commands = new ArrayList<>();
    private int entryCount;

    public WriteBatch set(String key, String value, Duration ttl) {
        commands.add(new Command(CommandType.SET, key, value, ttl));
        return this;
    }

    public WriteBatch addToSet(String setKey, String member) {
        commands.add(new Command(CommandType.SADD, setKey, member, null));
        return this;
    }

    public WriteBatch expire(String key, Duration ttl) {
        commands.add(new Command(CommandType.EXPIRE, key, null, ttl));
        return this;
    }

    void markEntry() {
        entryCount++;
    }

    /**
     * Cache entries staged so far (one entry spans several commands).
     */
    public int entryCount() {
        return entryCount;
    }

    public boolean isEmpty() {
        return commands.isEmpty();
    }

    public List<Command> commands() {
        return Collections.unmodifiableList(commands);
    }

    public void clear() {
        commands.clear();
        entryCount = 0;
    }
}
