package org.muma.kv.common;

public enum RedisDataType {
    STRING,
    ZSET
}
