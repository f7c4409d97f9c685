package org.muma.kv.command;

import org.muma.kv.command.impl.key.*;
import org.muma.kv.command.impl.server.CommandCommand;
import org.muma.kv.command.impl.server.EchoCommand;
import org.muma.kv.command.impl.server.PingCommand;
import org.muma.kv.command.impl.string.GetCommand;
import org.muma.kv.command.impl.string.SetCommand;
import org.muma.kv.command.impl.zset.*;
import org.muma.kv.exception.RedisException;
import org.muma.kv.protocol.ErrorMessage;
import org.muma.kv.protocol.RedisArray;
import org.muma.kv.protocol.RedisMessage;
import org.muma.kv.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Case-insensitive command table. Runs the command on the caller's thread and turns every failure
 * into an error reply; nothing thrown here ever reaches the channel.
 */
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private static final long DEFAULT_SLOW_LOG_MILLIS = 10;

    private final Map<String, RedisCommand> commandMap = new HashMap<>();
    private final StorageEngine storage;
    private final long slowLogThresholdMillis;

    public CommandDispatcher(StorageEngine storage) {
        this(storage, DEFAULT_SLOW_LOG_MILLIS);
    }

    public CommandDispatcher(StorageEngine storage, long slowLogThresholdMillis) {
        this.storage = storage;
        this.slowLogThresholdMillis = slowLogThresholdMillis;
        this.initCommandRegistry();
    }

    private void initCommandRegistry() {
        registerServerCommands();
        registerGenericCommands();
        registerStringCommands();
        registerZsetCommands();

        log.info("CommandDispatcher initialized. Total commands registered: {}", commandMap.size());
    }

    private void registerServerCommands() {
        commandMap.put("PING", new PingCommand());
        commandMap.put("ECHO", new EchoCommand());
        commandMap.put("COMMAND", new CommandCommand());
    }

    private void registerGenericCommands() {
        commandMap.put("DEL", new DelCommand());
        commandMap.put("EXISTS", new ExistsCommand());
        commandMap.put("EXPIRE", new ExpireCommand());
        commandMap.put("TTL", new TTLCommand());
        commandMap.put("PTTL", new PTTLCommand());
        commandMap.put("KEYS", new KeysCommand());
    }

    private void registerStringCommands() {
        commandMap.put("SET", new SetCommand());
        commandMap.put("GET", new GetCommand());
    }

    private void registerZsetCommands() {
        commandMap.put("ZADD", new ZAddCommand());
        commandMap.put("ZRANGE", new ZRangeCommand());
        commandMap.put("ZSCORE", new ZScoreCommand());
        commandMap.put("ZCARD", new ZCardCommand());
    }

    public RedisMessage dispatch(String commandName, RedisArray args) {
        String cmdUpper = commandName.toUpperCase(Locale.ROOT);
        RedisCommand command = commandMap.get(cmdUpper);

        if (command == null) {
            log.warn("Command not found: {}", commandName);
            return new ErrorMessage("ERR unknown command '" + commandName + "'");
        }

        long startTime = System.nanoTime();
        try {
            RedisMessage response = command.execute(storage, args);

            long duration = (System.nanoTime() - startTime) / 1_000_000;
            if (duration > slowLogThresholdMillis) {
                log.warn("Slow command detected: {} cost {}ms", cmdUpper, duration);
            } else if (log.isDebugEnabled()) {
                log.debug("Command executed: {} cost {}ms", cmdUpper, duration);
            }
            return response;

        } catch (RedisException e) {
            // engine / option errors: expected, reported to the client as-is
            log.warn("Command execution failed (Client Error): {} - {}", cmdUpper, e.toReply());
            return new ErrorMessage(e.toReply());

        } catch (IllegalArgumentException | IllegalStateException e) {
            log.warn("Command execution failed (Client Error): {} - {}", cmdUpper, e.getMessage());
            return new ErrorMessage("ERR " + e.getMessage());

        } catch (Exception e) {
            log.error("Internal Server Error processing command: {}", cmdUpper, e);
            return new ErrorMessage("ERR internal server error");
        }
    }
}
