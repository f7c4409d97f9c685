package org.muma.kv.command.impl.key;

import org.muma.kv.command.RedisCommand;
import org.muma.kv.protocol.RedisArray;
import org.muma.kv.protocol.RedisInteger;
import org.muma.kv.protocol.RedisMessage;
import org.muma.kv.store.StorageEngine;

/**
 * TTL key: seconds left, -1 without expiry, -2 when the key is missing.
 */
public class TTLCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        if (args.elements().length != 2) return errorArgs("ttl");
        return new RedisInteger(storage.ttl(argString(args.elements(), 1)));
    }
}
