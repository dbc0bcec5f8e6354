package com.drawpool.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.exceptions.JedisException;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link TaskQueue} stored in a Redis list: {@code RPUSH} to enqueue, {@code BLPOP} to consume.
 * Entries are JSON so that producers in other processes can feed the same list.
 */
public final class RedisTaskQueue<T> implements TaskQueue<T> {

    private static final Logger log = LoggerFactory.getLogger(RedisTaskQueue.class);

    private final JedisPool pool;
    private final String key;
    private final JsonCodec<T> codec;

    public RedisTaskQueue(JedisPool pool, String key, JsonCodec<T> codec) {
        this.pool = Objects.requireNonNull(pool, "pool");
        this.key = Objects.requireNonNull(key, "key");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public String getKey() {
        return key;
    }

    @Override
    public void push(T item) {
        String json = codec.encode(Objects.requireNonNull(item, "item"));
        try (var jedis = pool.getResource()) {
            jedis.rpush(key, json);
            log.debug("Pushed entry to Redis list key={}", key);
        } catch (JedisException e) {
            throw new QueueException("RPUSH failed for key=" + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<T> pop(Duration timeout) {
        // BLPOP treats 0 as "wait forever"
        int seconds = (int) Math.max(1, timeout.toSeconds());
        List<String> entry;
        try (var jedis = pool.getResource()) {
            entry = jedis.blpop(seconds, key);
        } catch (JedisException e) {
            throw new QueueException("BLPOP failed for key=" + key + ": " + e.getMessage(), e);
        }
        if (entry == null || entry.size() < 2) {
            return Optional.empty();
        }
        return Optional.of(codec.decode(entry.get(1)));
    }

    @Override
    public long size() {
        try (var jedis = pool.getResource()) {
            return jedis.llen(key);
        } catch (JedisException e) {
            throw new QueueException("LLEN failed for key=" + key + ": " + e.getMessage(), e);
        }
    }
}
