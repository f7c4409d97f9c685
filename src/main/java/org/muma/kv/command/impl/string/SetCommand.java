package org.muma.kv.command.impl.string;

import org.muma.kv.command.RedisCommand;
import org.muma.kv.command.option.SetOptions;
import org.muma.kv.exception.InvalidArgumentException;
import org.muma.kv.exception.PreconditionFailedException;
import org.muma.kv.protocol.BulkString;
import org.muma.kv.protocol.RedisArray;
import org.muma.kv.protocol.RedisMessage;
import org.muma.kv.protocol.SimpleString;
import org.muma.kv.store.StorageEngine;

/**
 * SET key value [NX | XX] [GET] [EX seconds | PX milliseconds | EXAT unix-time-seconds | PXAT unix-time-milliseconds | KEEPTTL]
 * <p>
 * Replies OK, or nil when NX / XX blocked the write. With GET the reply is the old value instead.
 */
public class SetCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        RedisMessage[] elements = args.elements();
        if (elements.length < 3) {
            return errorArgs("set");
        }

        String key = argString(elements, 1);
        byte[] value = argBytes(elements, 2);

        SetOptions options = new SetOptions();
        for (int i = 3; i < elements.length; i++) {
            String opt = argUpper(elements, i);
            if (SetOptions.takesValue(opt)) {
                if (i + 1 >= elements.length) {
                    throw InvalidArgumentException.syntaxError();
                }
                options.setExpiry(opt, parseLong(argString(elements, ++i)));
            } else {
                options.activate(opt);
            }
        }

        try {
            byte[] previous = storage.set(key, value, options);
            return options.isGet() ? new BulkString(previous) : SimpleString.OK;
        } catch (PreconditionFailedException e) {
            return BulkString.NULL;
        }
    }
}
