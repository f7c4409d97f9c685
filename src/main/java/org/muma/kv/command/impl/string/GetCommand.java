package org.muma.kv.command.impl.string;

import org.muma.kv.command.RedisCommand;
import org.muma.kv.common.RedisData;
import org.muma.kv.protocol.BulkString;
import org.muma.kv.protocol.RedisArray;
import org.muma.kv.protocol.RedisMessage;
import org.muma.kv.store.StorageEngine;

public class GetCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        if (args.elements().length != 2) {
            return errorArgs("get");
        }

        String key = argString(args.elements(), 1);
        RedisData<?> data = storage.get(key);
        if (data == null) {
            return BulkString.NULL;
        }
        // WRONGTYPE for sorted sets
        return new BulkString(data.asBytes());
    }
}
