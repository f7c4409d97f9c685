package org.muma.kv.store;

import org.muma.kv.command.option.ExpireOptions;
import org.muma.kv.command.option.SetOptions;
import org.muma.kv.command.option.ZAddOptions;
import org.muma.kv.command.option.ZRangeOptions;
import org.muma.kv.common.RedisData;
import org.muma.kv.common.RedisZSet;

import java.util.List;

/**
 * The keyspace. Each call is atomic with respect to every other call, including the lazy deletion
 * of an expired key it may trigger.
 * <p>
 * Errors are reported as {@link org.muma.kv.exception.RedisException} subclasses.
 */
public interface StorageEngine {

    long NO_EXPIRY = -1;
    long KEY_MISSING = -2;

    /**
     * @return the live value, or null when absent or expired
     */
    RedisData<?> get(String key);

    /**
     * Stores a string value under the NX / XX / GET / expiry rules of {@code options}.
     *
     * @return the previous string when GET is set (null if there was none), otherwise null
     * @throws org.muma.kv.exception.PreconditionFailedException NX / XX did not hold and GET is not set
     * @throws org.muma.kv.exception.WrongTypeException          GET is set and the key holds a non-string
     */
    byte[] set(String key, byte[] value, SetOptions options);

    /**
     * @return how many of the keys existed
     */
    int del(String... keys);

    /**
     * @return how many of the keys exist, a key named twice counts twice
     */
    int exists(String... keys);

    /**
     * Sets a relative expiry; a non-positive ttl deletes the key.
     *
     * @throws org.muma.kv.exception.NotFoundException           key is absent
     * @throws org.muma.kv.exception.PreconditionFailedException NX / XX / GT / LT did not hold
     */
    void expire(String key, long ttlMillis, ExpireOptions options);

    /**
     * @return remaining seconds (rounded), {@link #NO_EXPIRY} or {@link #KEY_MISSING}
     */
    long ttl(String key);

    /**
     * @return remaining milliseconds, {@link #NO_EXPIRY} or {@link #KEY_MISSING}
     */
    long pttl(String key);

    /**
     * Live keys matching a glob pattern, in no particular order.
     */
    List<String> keys(String pattern);

    /**
     * @throws org.muma.kv.exception.WrongTypeException       key holds a string
     * @throws org.muma.kv.exception.NotFoundException        INCR on an absent member
     * @throws org.muma.kv.exception.InvalidArgumentException INCR with more than one pair
     */
    ZAddResult zAdd(String key, List<RedisZSet.ZSetEntry> members, ZAddOptions options);

    /**
     * start / stop are ranks, scores or lex bounds depending on {@link ZRangeOptions#rangeType()}.
     *
     * @return empty when the key is absent
     */
    List<RedisZSet.ZSetEntry> zRange(String key, String start, String stop, ZRangeOptions options);

    Double zScore(String key, String member);

    long zCard(String key);

    void flush();

    int size();
}
