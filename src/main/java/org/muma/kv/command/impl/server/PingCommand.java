package org.muma.kv.command.impl.server;

import org.muma.kv.command.RedisCommand;
import org.muma.kv.protocol.BulkString;
import org.muma.kv.protocol.RedisArray;
import org.muma.kv.protocol.RedisMessage;
import org.muma.kv.protocol.SimpleString;
import org.muma.kv.store.StorageEngine;

/**
 * PING [message]
 */
public class PingCommand implements RedisCommand {

    private static final SimpleString PONG = new SimpleString("PONG");

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        RedisMessage[] elements = args.elements();
        return switch (elements.length) {
            case 1 -> PONG;
            case 2 -> new BulkString(argBytes(elements, 1));
            default -> errorArgs("ping");
        };
    }
}
