package com.autonomous.treasury.store;

import com.autonomous.treasury.exception.StoreException;
import lombok.extern.slf4j.Slf4j;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.Pipeline;
import redis.clients.jedis.Response;
import redis.clients.jedis.exceptions.JedisException;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link CacheStore} on Redis. Each versioned key is a hash of {@code data} and {@code ver};
 * compare-and-set is WATCH / MULTI / EXEC, so a concurrent writer aborts the transaction.
 */
@Slf4j
public class RedisCacheStore implements CacheStore {

    private static final String DATA = "data";
    private static final String VERSION = "ver";

    private final JedisPool pool;

    public RedisCacheStore(JedisPool pool) {
        this.pool = pool;
    }

    public RedisCacheStore(String host, int port) {
        this(new JedisPool(host, port));
    }

    @Override
    public Optional<Versioned<String>> get(String key) {
        try (Jedis jedis = pool.getResource()) {
            List<String> fields = jedis.hmget(key, DATA, VERSION);
            if (fields.get(0) == null) {
                return Optional.empty();
            }
            return Optional.of(new Versioned<>(fields.get(0), parseVersion(fields.get(1))));
        } catch (JedisException e) {
            throw new StoreException("Redis read failed for " + key, e);
        }
    }

    @Override
    public boolean compareAndSet(String key, long expectedVersion, String value, Duration ttl) {
        try (Jedis jedis = pool.getResource()) {
            jedis.watch(key);
            long current = jedis.exists(key) ? parseVersion(jedis.hget(key, VERSION)) : 0;
            if (current != expectedVersion) {
                jedis.unwatch();
                return false;
            }
            redis.clients.jedis.Transaction multi = jedis.multi();
            multi.hset(key, Map.of(DATA, value, VERSION, Long.toString(current + 1)));
            if (ttl != null) {
                multi.pexpire(key, ttl.toMillis());
            } else {
                multi.persist(key);
            }
            List<Object> result = multi.exec();
            return result != null && !result.isEmpty();
        } catch (JedisException e) {
            throw new StoreException("Redis compare-and-set failed for " + key, e);
        }
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        try (Jedis jedis = pool.getResource()) {
            redis.clients.jedis.Transaction multi = jedis.multi();
            multi.hset(key, DATA, value);
            multi.hincrBy(key, VERSION, 1);
            if (ttl != null) {
                multi.pexpire(key, ttl.toMillis());
            } else {
                multi.persist(key);
            }
            multi.exec();
        } catch (JedisException e) {
            throw new StoreException("Redis write failed for " + key, e);
        }
    }

    @Override
    public long increment(String key, Duration ttl) {
        try (Jedis jedis = pool.getResource()) {
            // same data/ver hash as every other key
            redis.clients.jedis.Transaction multi = jedis.multi();
            Response<Long> value = multi.hincrBy(key, DATA, 1);
            multi.hincrBy(key, VERSION, 1);
            multi.exec();
            if (value.get() == 1 && ttl != null) {
                jedis.pexpire(key, ttl.toMillis());
            }
            return value.get();
        } catch (JedisException e) {
            throw new StoreException("Redis increment failed for " + key, e);
        }
    }

    @Override
    public void pushRecent(String key, String value, int maxEntries, Duration ttl) {
        try (Jedis jedis = pool.getResource()) {
            Pipeline pipeline = jedis.pipelined();
            pipeline.lpush(key, value);
            pipeline.ltrim(key, 0, maxEntries - 1L);
            if (ttl != null) {
                pipeline.pexpire(key, ttl.toMillis());
            }
            pipeline.sync();
        } catch (JedisException e) {
            throw new StoreException("Redis list push failed for " + key, e);
        }
    }

    @Override
    public List<String> recent(String key, int limit) {
        try (Jedis jedis = pool.getResource()) {
            return jedis.lrange(key, 0, limit - 1L);
        } catch (JedisException e) {
            throw new StoreException("Redis list read failed for " + key, e);
        }
    }

    public void close() {
        pool.close();
        log.info("Redis cache store closed");
    }

    private static long parseVersion(String raw) {
        return raw == null ? 0 : Long.parseLong(raw);
    }
}
