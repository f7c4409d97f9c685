package org.muma.kv.command.impl.server;

import org.muma.kv.command.RedisCommand;
import org.muma.kv.protocol.RedisArray;
import org.muma.kv.protocol.RedisMessage;
import org.muma.kv.store.StorageEngine;

/**
 * COMMAND
 * redis-cli sends it on connect to fetch command docs; an empty array is enough to keep it happy.
 */
public class CommandCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        return RedisArray.EMPTY;
    }
}
