package org.muma.kv.command.impl.server;

import org.muma.kv.command.RedisCommand;
import org.muma.kv.protocol.BulkString;
import org.muma.kv.protocol.RedisArray;
import org.muma.kv.protocol.RedisMessage;
import org.muma.kv.store.StorageEngine;

public class EchoCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        RedisMessage[] elements = args.elements();
        if (elements.length != 2) return errorArgs("echo");
        return new BulkString(argBytes(elements, 1));
    }
}
