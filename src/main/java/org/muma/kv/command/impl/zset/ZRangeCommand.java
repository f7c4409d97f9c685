package org.muma.kv.command.impl.zset;

import org.muma.kv.command.RedisCommand;
import org.muma.kv.command.option.ZRangeOptions;
import org.muma.kv.common.RedisZSet;
import org.muma.kv.exception.InvalidArgumentException;
import org.muma.kv.protocol.RedisArray;
import org.muma.kv.protocol.RedisMessage;
import org.muma.kv.store.StorageEngine;

import java.util.List;

/**
 * ZRANGE key start stop [BYSCORE | BYLEX] [REV] [LIMIT offset count] [WITHSCORES]
 * <p>
 * Time complexity O(log(N) + M), M returned elements: the first element is found by a skip list seek
 * (span sums for ranks, score / lex comparisons otherwise) and the rest by walking level 0.
 * With REV the walk follows backward links and score / lex bounds are given max first.
 */
public class ZRangeCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        RedisMessage[] elements = args.elements();
        if (elements.length < 4) {
            return errorArgs("zrange");
        }

        String key = argString(elements, 1);
        String start = argString(elements, 2);
        String stop = argString(elements, 3);

        ZRangeOptions options = new ZRangeOptions();
        for (int i = 4; i < elements.length; i++) {
            String opt = argUpper(elements, i);
            if (ZRangeOptions.LIMIT.equals(opt)) {
                if (i + 2 >= elements.length) {
                    throw InvalidArgumentException.syntaxError();
                }
                long offset = parseLong(argString(elements, ++i));
                long count = parseLong(argString(elements, ++i));
                options.setLimit(offset, count);
            } else {
                options.activate(opt);
            }
        }

        if (options.hasLimit() && options.rangeType() == ZRangeOptions.RangeType.RANK) {
            throw new InvalidArgumentException("syntax error, LIMIT is only supported in combination with either BYSCORE or BYLEX");
        }

        List<RedisZSet.ZSetEntry> range = storage.zRange(key, start, stop, options);
        return buildZSetResponse(range, options.isWithScores());
    }
}
