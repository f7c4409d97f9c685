package org.muma.kv.command.impl.key;

import org.muma.kv.command.RedisCommand;
import org.muma.kv.protocol.RedisArray;
import org.muma.kv.protocol.RedisInteger;
import org.muma.kv.protocol.RedisMessage;
import org.muma.kv.store.StorageEngine;

public class PTTLCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        if (args.elements().length != 2) return errorArgs("pttl");
        return new RedisInteger(storage.pttl(argString(args.elements(), 1)));
    }
}
