package org.muma.kv.command.impl.key;

import org.muma.kv.command.RedisCommand;
import org.muma.kv.protocol.RedisArray;
import org.muma.kv.protocol.RedisInteger;
import org.muma.kv.protocol.RedisMessage;
import org.muma.kv.store.StorageEngine;

/**
 * EXISTS key [key ...]
 */
public class ExistsCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        RedisMessage[] elements = args.elements();
        if (elements.length < 2) {
            return errorArgs("exists");
        }

        String[] keys = new String[elements.length - 1];
        for (int i = 1; i < elements.length; i++) {
            keys[i - 1] = argString(elements, i);
        }
        return new RedisInteger(storage.exists(keys));
    }
}
