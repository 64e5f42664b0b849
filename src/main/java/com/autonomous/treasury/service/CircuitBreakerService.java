package com.autonomous.treasury.service;

import com.autonomous.treasury.config.TreasuryJson;
import com.autonomous.treasury.exception.StoreException;
import com.autonomous.treasury.model.AdminEvent;
import com.autonomous.treasury.model.AdminEventType;
import com.autonomous.treasury.model.CircuitBreakerState;
import com.autonomous.treasury.store.CacheStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

/**
 * System-wide emergency stop. The flag lives in the shared cache store so every process
 * sees the same value; it is read on every authorization and never cached in-process.
 *
 * <p>Freezing blocks new authorizations only. Spends that already committed stand.</p>
 */
@Slf4j
@Service
public class CircuitBreakerService {

    static final String STATE_KEY = "treasury:circuit-breaker";

    private final CacheStore cacheStore;
    private final AdminLogService adminLog;
    private final OpsAlertService opsAlert;
    private final Clock clock;
    private final ObjectMapper mapper = TreasuryJson.mapper();

    public CircuitBreakerService(CacheStore cacheStore, AdminLogService adminLog,
                                 OpsAlertService opsAlert, Clock clock) {
        this.cacheStore = cacheStore;
        this.adminLog = adminLog;
        this.opsAlert = opsAlert;
        this.clock = clock;
    }

    /**
     * Brings back the last freeze/unfreeze from the admin log when the cache has no state,
     * e.g. after the cache was flushed.
     */
    @PostConstruct
    public void restore() {
        if (cacheStore.get(STATE_KEY).isPresent()) {
            return;
        }
        Optional<AdminEvent> last = adminLog.lastBreakerEvent();
        if (last.isEmpty()) {
            return;
        }
        AdminEvent event = last.get();
        CircuitBreakerState state = CircuitBreakerState.builder()
            .frozen(event.getType() == AdminEventType.FREEZE)
            .reason(event.getReason())
            .actor(event.getActor())
            .timestamp(event.getTimestamp())
            .build();
        cacheStore.compareAndSet(STATE_KEY, 0, encode(state), null);
        log.info("Restored circuit breaker state from admin log: frozen={} by {}", state.isFrozen(), state.getActor());
    }

    public boolean isFrozen() {
        return getState().isFrozen();
    }

    public CircuitBreakerState getState() {
        return cacheStore.get(STATE_KEY)
            .map(v -> decode(v.getValue()))
            .orElseGet(CircuitBreakerState::open);
    }

    public CircuitBreakerState freeze(String reason, String actor) {
        CircuitBreakerState state = transition(true, reason, actor);
        log.warn("Emergency freeze activated by {}: {}", actor, reason);
        opsAlert.alert(String.format("Emergency freeze activated by %s: %s", actor, reason));
        return state;
    }

    public CircuitBreakerState unfreeze(String reason, String actor) {
        CircuitBreakerState state = transition(false, reason, actor);
        log.info("Emergency freeze lifted by {}: {}", actor, reason);
        opsAlert.alert(String.format("Emergency freeze lifted by %s: %s", actor, reason));
        return state;
    }

    private CircuitBreakerState transition(boolean frozen, String reason, String actor) {
        requireText(reason, "reason");
        requireText(actor, "actor");
        CircuitBreakerState state = CircuitBreakerState.builder()
            .frozen(frozen)
            .reason(reason)
            .actor(actor)
            .timestamp(clock.instant())
            .build();
        // the flag takes effect first; the audit entry must not be able to delay a stop
        cacheStore.put(STATE_KEY, encode(state), null);
        adminLog.record(frozen ? AdminEventType.FREEZE : AdminEventType.UNFREEZE, null, actor, reason, null);
        return state;
    }

    private String encode(CircuitBreakerState state) {
        try {
            return mapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new StoreException("Cannot encode circuit breaker state", e);
        }
    }

    private CircuitBreakerState decode(String json) {
        try {
            return mapper.readValue(json, CircuitBreakerState.class);
        } catch (JsonProcessingException e) {
            throw new StoreException("Corrupt circuit breaker state", e);
        }
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
