package org.muma.kv.command.impl.zset;

import org.muma.kv.command.RedisCommand;
import org.muma.kv.protocol.RedisArray;
import org.muma.kv.protocol.RedisInteger;
import org.muma.kv.protocol.RedisMessage;
import org.muma.kv.store.StorageEngine;

public class ZCardCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        if (args.elements().length != 2) return errorArgs("zcard");
        return new RedisInteger(storage.zCard(argString(args.elements(), 1)));
    }
}
