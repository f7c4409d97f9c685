package org.muma.kv.command.impl.key;

import org.muma.kv.command.RedisCommand;
import org.muma.kv.protocol.RedisArray;
import org.muma.kv.protocol.RedisMessage;
import org.muma.kv.store.StorageEngine;

/**
 * KEYS pattern
 * <p>
 * O(N) over the whole keyspace while holding the read lock.
 */
public class KeysCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        if (args.elements().length != 2) return errorArgs("keys");
        return RedisArray.ofStrings(storage.keys(argString(args.elements(), 1)));
    }
}
