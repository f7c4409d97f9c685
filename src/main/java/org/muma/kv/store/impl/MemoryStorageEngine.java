package org.muma.kv.store.impl;

import org.muma.kv.command.option.ExpireOptions;
import org.muma.kv.command.option.SetOptions;
import org.muma.kv.command.option.ZAddOptions;
import org.muma.kv.command.option.ZRangeOptions;
import org.muma.kv.common.RedisData;
import org.muma.kv.common.RedisZSet;
import org.muma.kv.exception.InvalidArgumentException;
import org.muma.kv.exception.NotFoundException;
import org.muma.kv.exception.PreconditionFailedException;
import org.muma.kv.store.StorageEngine;
import org.muma.kv.store.ZAddResult;
import org.muma.kv.store.structure.zset.LexRangeSpec;
import org.muma.kv.store.structure.zset.RangeSpec;
import org.muma.kv.utils.GlobMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory keyspace guarded by one reader-writer lock.
 * <p>
 * The lock covers the value map, the expiry map and every sorted set reachable from them, so a key's
 * value, its expiry and its type check always change together. Expiry is lazy: nothing sweeps in the
 * background, an expired key is removed by the next call that touches it. A read that finds its key
 * expired drops the read lock, takes the write lock and checks again before deleting, so a value
 * written in between is never lost.
 */
public class MemoryStorageEngine implements StorageEngine {

    private static final Logger log = LoggerFactory.getLogger(MemoryStorageEngine.class);

    // key -> value
    private final Map<String, RedisData<?>> memoryDb = new HashMap<>();

    // key -> absolute expiry (epoch millis); only keys present in memoryDb
    private final Map<String, Long> ttlMap = new HashMap<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final Clock clock;

    // level source for new sorted sets
    private final Random random;

    public MemoryStorageEngine() {
        this(Clock.systemUTC(), new Random());
    }

    public MemoryStorageEngine(Clock clock, Random random) {
        this.clock = clock;
        this.random = random;
    }

    @Override
    public RedisData<?> get(String key) {
        // 1. fast path under the read lock
        lock.readLock().lock();
        try {
            if (!isExpired(key, now())) {
                return memoryDb.get(key);
            }
        } finally {
            lock.readLock().unlock();
        }
        // 2. expired: a read lock cannot be upgraded, so re-take as writer and delete if still expired
        purgeIfExpired(key);
        return null;
    }

    @Override
    public byte[] set(String key, byte[] value, SetOptions options) {
        if (options == null) options = new SetOptions();

        lock.writeLock().lock();
        try {
            long now = now();
            expireIfNeeded(key, now);
            RedisData<?> existing = memoryDb.get(key);

            byte[] previous = null;
            if (options.isGet() && existing != null) {
                previous = existing.asBytes();
            }

            if (options.isNx() && existing != null) {
                if (options.isGet()) return previous;
                throw new PreconditionFailedException("key already exists");
            }
            if (options.isXx() && existing == null) {
                if (options.isGet()) return null;
                throw new PreconditionFailedException("key does not exist");
            }

            // resolve before touching the maps so a bad expiry leaves the old value in place
            long expireAt = options.isKeepTtl() ? -1 : options.resolveExpireAt(now);

            memoryDb.put(key, RedisData.ofString(value));
            if (!options.isKeepTtl()) {
                if (expireAt == -1) {
                    ttlMap.remove(key);
                } else {
                    ttlMap.put(key, expireAt);
                }
            }
            return previous;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int del(String... keys) {
        lock.writeLock().lock();
        try {
            long now = now();
            int deleted = 0;
            for (String key : keys) {
                expireIfNeeded(key, now);
                if (removeKey(key)) {
                    deleted++;
                }
            }
            return deleted;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int exists(String... keys) {
        lock.readLock().lock();
        try {
            long now = now();
            int count = 0;
            for (String key : keys) {
                if (memoryDb.containsKey(key) && !isExpired(key, now)) {
                    count++;
                }
            }
            return count;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void expire(String key, long ttlMillis, ExpireOptions options) {
        if (options == null) options = new ExpireOptions();

        lock.writeLock().lock();
        try {
            long now = now();
            expireIfNeeded(key, now);
            if (!memoryDb.containsKey(key)) {
                throw NotFoundException.noSuchKey();
            }

            Long current = ttlMap.get(key);
            long newExpireAt;
            try {
                newExpireAt = Math.addExact(now, ttlMillis);
            } catch (ArithmeticException e) {
                throw new InvalidArgumentException("invalid expire time in 'expire' command");
            }

            // GT / LT only compare against an existing expiry
            if (options.isNx() && current != null) {
                throw new PreconditionFailedException("key already has an expiry");
            }
            if (options.isXx() && current == null) {
                throw new PreconditionFailedException("key has no expiry");
            }
            if (options.isGt() && current != null && newExpireAt <= current) {
                throw new PreconditionFailedException("new expiry is not greater than the current one");
            }
            if (options.isLt() && current != null && newExpireAt >= current) {
                throw new PreconditionFailedException("new expiry is not less than the current one");
            }

            if (ttlMillis <= 0) {
                removeKey(key);
                log.debug("Key '{}' deleted by non-positive expire", key);
                return;
            }
            ttlMap.put(key, newExpireAt);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public long ttl(String key) {
        long ms = pttl(key);
        if (ms < 0) return ms;
        return (ms + 500) / 1000;
    }

    @Override
    public long pttl(String key) {
        lock.readLock().lock();
        try {
            long now = now();
            if (!isExpired(key, now)) {
                if (!memoryDb.containsKey(key)) return KEY_MISSING;
                Long expireAt = ttlMap.get(key);
                return expireAt == null ? NO_EXPIRY : expireAt - now;
            }
        } finally {
            lock.readLock().unlock();
        }
        purgeIfExpired(key);
        return KEY_MISSING;
    }

    @Override
    public List<String> keys(String pattern) {
        GlobMatcher matcher = GlobMatcher.compile(pattern);

        lock.readLock().lock();
        try {
            long now = now();
            List<String> result = new ArrayList<>();
            for (String key : memoryDb.keySet()) {
                if (!isExpired(key, now) && matcher.matches(key)) {
                    result.add(key);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public ZAddResult zAdd(String key, List<RedisZSet.ZSetEntry> members, ZAddOptions options) {
        if (options == null) options = new ZAddOptions();
        if (members == null || members.isEmpty()) {
            throw new InvalidArgumentException("wrong number of arguments for 'zadd' command");
        }
        if (options.isIncr() && members.size() != 1) {
            throw new InvalidArgumentException("INCR option supports a single increment-element pair");
        }

        lock.writeLock().lock();
        try {
            expireIfNeeded(key, now());
            RedisData<?> data = memoryDb.get(key);
            RedisZSet zset = data == null ? new RedisZSet(random) : data.asZSet();

            if (options.isIncr()) {
                RedisZSet.ZSetEntry entry = members.get(0);
                return ZAddResult.ofScore(zset.incr(entry.score(), entry.member()));
            }

            long added = 0;
            long updated = 0;
            for (RedisZSet.ZSetEntry entry : members) {
                Double current = zset.getScore(entry.member());
                if (current == null) {
                    if (options.isXx()) continue;
                    zset.add(entry.score(), entry.member());
                    added++;
                } else {
                    if (options.isNx()) continue;
                    if (options.isGt() && !(entry.score() > current)) continue;
                    if (options.isLt() && !(entry.score() < current)) continue;
                    if (entry.score() != current) {
                        zset.add(entry.score(), entry.member());
                        updated++;
                    }
                }
            }

            // XX against a missing key must not create an empty set
            if (data == null && zset.size() > 0) {
                memoryDb.put(key, RedisData.ofZSet(zset));
            }
            return ZAddResult.ofCount(options.isCh() ? added + updated : added);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<RedisZSet.ZSetEntry> zRange(String key, String start, String stop, ZRangeOptions options) {
        if (options == null) options = new ZRangeOptions();
        boolean rev = options.isRev();
        ZRangeOptions.RangeType rangeType = options.rangeType();

        // bounds are parsed before taking the lock; REV takes score / lex bounds max first
        long startIndex = 0, stopIndex = 0;
        RangeSpec scoreRange = null;
        LexRangeSpec lexRange = null;
        switch (rangeType) {
            case RANK -> {
                startIndex = parseIndex(start);
                stopIndex = parseIndex(stop);
            }
            case SCORE -> scoreRange = rev ? RangeSpec.parse(stop, start) : RangeSpec.parse(start, stop);
            case LEX -> lexRange = rev ? LexRangeSpec.parse(stop, start) : LexRangeSpec.parse(start, stop);
        }

        lock.readLock().lock();
        try {
            if (!isExpired(key, now())) {
                RedisData<?> data = memoryDb.get(key);
                if (data == null) {
                    return Collections.emptyList();
                }
                RedisZSet zset = data.asZSet();
                return switch (rangeType) {
                    case RANK -> rev ? zset.revRange(startIndex, stopIndex) : zset.range(startIndex, stopIndex);
                    case SCORE -> zset.rangeByScore(scoreRange, rev, options.getOffset(), options.getCount());
                    case LEX -> zset.rangeByLex(lexRange, rev, options.getOffset(), options.getCount());
                };
            }
        } finally {
            lock.readLock().unlock();
        }
        purgeIfExpired(key);
        return Collections.emptyList();
    }

    @Override
    public Double zScore(String key, String member) {
        lock.readLock().lock();
        try {
            if (!isExpired(key, now())) {
                RedisData<?> data = memoryDb.get(key);
                return data == null ? null : data.asZSet().getScore(member);
            }
        } finally {
            lock.readLock().unlock();
        }
        purgeIfExpired(key);
        return null;
    }

    @Override
    public long zCard(String key) {
        lock.readLock().lock();
        try {
            if (!isExpired(key, now())) {
                RedisData<?> data = memoryDb.get(key);
                return data == null ? 0 : data.asZSet().size();
            }
        } finally {
            lock.readLock().unlock();
        }
        purgeIfExpired(key);
        return 0;
    }

    @Override
    public void flush() {
        lock.writeLock().lock();
        try {
            memoryDb.clear();
            ttlMap.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            long now = now();
            int count = 0;
            for (String key : memoryDb.keySet()) {
                if (!isExpired(key, now)) count++;
            }
            return count;
        } finally {
            lock.readLock().unlock();
        }
    }

    // --- internals, callers hold the lock ---

    private long now() {
        return clock.millis();
    }

    // an expiry equal to now already counts as expired
    private boolean isExpired(String key, long now) {
        Long expireAt = ttlMap.get(key);
        return expireAt != null && now >= expireAt;
    }

    // write lock held
    private boolean expireIfNeeded(String key, long now) {
        if (isExpired(key, now)) {
            removeKey(key);
            log.debug("Lazy expire: key '{}' removed", key);
            return true;
        }
        return false;
    }

    // write lock held; value and expiry always leave together
    private boolean removeKey(String key) {
        ttlMap.remove(key);
        return memoryDb.remove(key) != null;
    }

    // no lock held on entry
    private void purgeIfExpired(String key) {
        lock.writeLock().lock();
        try {
            // another writer may have replaced or refreshed the key since the read lock was dropped
            expireIfNeeded(key, now());
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static long parseIndex(String s) {
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw InvalidArgumentException.notAnInteger();
        }
    }
}
