package org.muma.kv.command.impl.zset;

import org.muma.kv.command.RedisCommand;
import org.muma.kv.command.option.ZAddOptions;
import org.muma.kv.common.RedisZSet;
import org.muma.kv.exception.InvalidArgumentException;
import org.muma.kv.protocol.BulkString;
import org.muma.kv.protocol.RedisArray;
import org.muma.kv.protocol.RedisInteger;
import org.muma.kv.protocol.RedisMessage;
import org.muma.kv.store.StorageEngine;
import org.muma.kv.store.ZAddResult;

import java.util.ArrayList;
import java.util.List;

/**
 * ZADD key [NX | XX] [GT | LT] [CH] [INCR] score member [score member ...]
 * <p>
 * Time complexity O(K * log(N)), K pairs into a set of N members: each upsert is one dict lookup
 * plus a skip list delete / insert.
 * <p>
 * Replies the number of added members (added + updated with CH), or the new score with INCR.
 */
public class ZAddCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        RedisMessage[] elements = args.elements();
        if (elements.length < 4) {
            return errorArgs("zadd");
        }

        String key = argString(elements, 1);

        ZAddOptions options = new ZAddOptions();
        int i = 2;
        while (i < elements.length && options.accepts(argString(elements, i))) {
            options.activate(argString(elements, i));
            i++;
        }

        int remaining = elements.length - i;
        if (remaining == 0 || remaining % 2 != 0) {
            throw InvalidArgumentException.syntaxError();
        }

        List<RedisZSet.ZSetEntry> members = new ArrayList<>(remaining / 2);
        for (; i < elements.length; i += 2) {
            double score = parseScore(argString(elements, i));
            members.add(new RedisZSet.ZSetEntry(argString(elements, i + 1), score));
        }

        ZAddResult result = storage.zAdd(key, members, options);
        if (result.isIncr()) {
            return new BulkString(formatScore(result.score()));
        }
        return new RedisInteger(result.count());
    }
}
