package org.muma.kv.common;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.muma.kv.exception.WrongTypeException;

/**
 * Value stored under a key: a tag plus its payload.
 * STRING carries a byte[], ZSET carries a {@link RedisZSet}. Expiry lives in the engine, not here.
 */
@Getter
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class RedisData<T> {

    private final RedisDataType type;

    private final T data;

    public static RedisData<byte[]> ofString(byte[] value) {
        return new RedisData<>(RedisDataType.STRING, value);
    }

    public static RedisData<RedisZSet> ofZSet(RedisZSet zset) {
        return new RedisData<>(RedisDataType.ZSET, zset);
    }

    /**
     * @throws WrongTypeException when this value is not a string
     */
    public byte[] asBytes() {
        if (type != RedisDataType.STRING) {
            throw new WrongTypeException();
        }
        return (byte[]) data;
    }

    /**
     * @throws WrongTypeException when this value is not a sorted set
     */
    public RedisZSet asZSet() {
        if (type != RedisDataType.ZSET) {
            throw new WrongTypeException();
        }
        return (RedisZSet) data;
    }
}
