package org.muma.kv.command.impl.key;

import org.muma.kv.command.RedisCommand;
import org.muma.kv.command.option.ExpireOptions;
import org.muma.kv.exception.InvalidArgumentException;
import org.muma.kv.exception.NotFoundException;
import org.muma.kv.exception.PreconditionFailedException;
import org.muma.kv.protocol.RedisArray;
import org.muma.kv.protocol.RedisInteger;
import org.muma.kv.protocol.RedisMessage;
import org.muma.kv.store.StorageEngine;

/**
 * EXPIRE key seconds [NX | XX | GT | LT]
 * <p>
 * 1 when the timeout was set (or the key deleted by a non-positive one), 0 when the key is missing
 * or the guard did not hold.
 */
public class ExpireCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        RedisMessage[] elements = args.elements();
        if (elements.length < 3) {
            return errorArgs("expire");
        }

        String key = argString(elements, 1);
        long seconds = parseLong(argString(elements, 2));
        long ttlMillis;
        try {
            ttlMillis = Math.multiplyExact(seconds, 1000L);
        } catch (ArithmeticException e) {
            throw new InvalidArgumentException("invalid expire time in 'expire' command");
        }

        ExpireOptions options = new ExpireOptions();
        for (int i = 3; i < elements.length; i++) {
            options.activate(argUpper(elements, i));
        }

        try {
            storage.expire(key, ttlMillis, options);
            return new RedisInteger(1);
        } catch (NotFoundException | PreconditionFailedException e) {
            return new RedisInteger(0);
        }
    }
}
