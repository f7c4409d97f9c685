package org.muma.kv.command.impl.zset;

import org.muma.kv.command.RedisCommand;
import org.muma.kv.protocol.BulkString;
import org.muma.kv.protocol.RedisArray;
import org.muma.kv.protocol.RedisMessage;
import org.muma.kv.store.StorageEngine;

/**
 * ZSCORE key member, O(1) through the dict.
 */
public class ZScoreCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        RedisMessage[] elements = args.elements();
        if (elements.length != 3) return errorArgs("zscore");

        Double score = storage.zScore(argString(elements, 1), argString(elements, 2));
        return score == null ? BulkString.NULL : new BulkString(formatScore(score));
    }
}
