package com.autonomous.treasury.store;

import com.autonomous.treasury.exception.StoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.Transaction;
import redis.clients.jedis.exceptions.JedisConnectionException;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedisCacheStoreTest {

    @Mock
    private JedisPool pool;

    @Mock
    private Jedis jedis;

    @Mock
    private Transaction multi;

    private RedisCacheStore store;

    @BeforeEach
    void setUp() {
        store = new RedisCacheStore(pool);
    }

    @Test
    void shouldReadVersionedValue() {
        when(pool.getResource()).thenReturn(jedis);
        when(jedis.hmget("budget:a", "data", "ver")).thenReturn(Arrays.asList("{}", "4"));

        Versioned<String> value = store.get("budget:a").orElseThrow();

        assertEquals("{}", value.getValue());
        assertEquals(4, value.getVersion());
        verify(jedis).close();
    }

    @Test
    void shouldTreatMissingHashAsAbsent() {
        when(pool.getResource()).thenReturn(jedis);
        when(jedis.hmget("budget:a", "data", "ver")).thenReturn(Arrays.asList(null, null));

        assertTrue(store.get("budget:a").isEmpty());
    }

    @Test
    void shouldRefuseWriteOnVersionMismatch() {
        when(pool.getResource()).thenReturn(jedis);
        when(jedis.exists("budget:a")).thenReturn(true);
        when(jedis.hget("budget:a", "ver")).thenReturn("3");

        assertFalse(store.compareAndSet("budget:a", 2, "{}", null));

        verify(jedis).watch("budget:a");
        verify(jedis).unwatch();
        verify(jedis, never()).multi();
    }

    @Test
    void shouldInsertWhenAbsentAndExpectingZero() {
        when(pool.getResource()).thenReturn(jedis);
        when(jedis.exists("budget:a")).thenReturn(false);
        when(jedis.multi()).thenReturn(multi);
        when(multi.exec()).thenReturn(List.of(2L, 0L));

        assertTrue(store.compareAndSet("budget:a", 0, "{}", null));

        verify(multi).hset("budget:a", Map.of("data", "{}", "ver", "1"));
        verify(multi).persist("budget:a");
    }

    @Test
    void shouldReportLostRaceWhenExecAborts() {
        when(pool.getResource()).thenReturn(jedis);
        when(jedis.exists("budget:a")).thenReturn(true);
        when(jedis.hget("budget:a", "ver")).thenReturn("1");
        when(jedis.multi()).thenReturn(multi);
        when(multi.exec()).thenReturn(null);

        assertFalse(store.compareAndSet("budget:a", 1, "{}", null));
    }

    @Test
    void shouldWrapConnectionFailures() {
        when(pool.getResource()).thenThrow(new JedisConnectionException("connection refused"));

        assertThrows(StoreException.class, () -> store.get("budget:a"));
    }
}
