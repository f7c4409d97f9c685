package org.muma.kv.protocol;

import java.util.List;

// *<count> - null elements encodes as *-1
public record RedisArray(RedisMessage[] elements) implements RedisMessage {

    public static final RedisArray EMPTY = new RedisArray(new RedisMessage[0]);

    // items are binary strings, see BulkString#ofBinary
    public static RedisArray ofStrings(List<String> items) {
        RedisMessage[] result = new RedisMessage[items.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = BulkString.ofBinary(items.get(i));
        }
        return new RedisArray(result);
    }

    public int size() {
        return elements == null ? 0 : elements.length;
    }
}
