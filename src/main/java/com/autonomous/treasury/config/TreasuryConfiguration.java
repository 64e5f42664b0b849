package com.autonomous.treasury.config;

import com.autonomous.treasury.store.CacheStore;
import com.autonomous.treasury.store.FileLedgerStore;
import com.autonomous.treasury.store.InMemoryCacheStore;
import com.autonomous.treasury.store.LedgerStore;
import com.autonomous.treasury.store.RedisCacheStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.time.Clock;

@Slf4j
@Configuration
public class TreasuryConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "treasury.cache.type", havingValue = "memory", matchIfMissing = true)
    public CacheStore inMemoryCacheStore(Clock clock) {
        log.info("Using in-process cache store");
        return new InMemoryCacheStore(clock);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(name = "treasury.cache.type", havingValue = "redis")
    public CacheStore redisCacheStore(@Value("${treasury.redis.host:localhost}") String host,
                                      @Value("${treasury.redis.port:6379}") int port) {
        log.info("Using Redis cache store at {}:{}", host, port);
        return new RedisCacheStore(host, port);
    }

    @Bean
    public LedgerStore ledgerStore(@Value("${treasury.data.path:data}") String dataPath) {
        log.info("Ledger store rooted at {}", Paths.get(dataPath).toAbsolutePath());
        return new FileLedgerStore(Paths.get(dataPath));
    }
}
