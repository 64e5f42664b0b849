package com.autonomous.treasury.service;

import com.autonomous.treasury.exception.StoreException;
import com.autonomous.treasury.model.AdminEvent;
import com.autonomous.treasury.model.AdminEventType;
import com.autonomous.treasury.store.LedgerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Administrative log: freezes, provisioning, status changes, limit rescales. Separate from
 * the spend ledger but just as durable.
 */
@Slf4j
@Service
public class AdminLogService {

    private static final Set<AdminEventType> BREAKER_EVENTS = EnumSet.of(AdminEventType.FREEZE, AdminEventType.UNFREEZE);

    private final LedgerStore ledgerStore;
    private final DurableWriteQueue writeQueue;
    private final Clock clock;

    public AdminLogService(LedgerStore ledgerStore, DurableWriteQueue writeQueue, Clock clock) {
        this.ledgerStore = ledgerStore;
        this.writeQueue = writeQueue;
        this.clock = clock;
    }

    public AdminEvent record(AdminEventType type, String agentId, String actor, String reason, String details) {
        AdminEvent event = AdminEvent.builder()
            .eventId(UUID.randomUUID().toString())
            .type(type)
            .agentId(agentId)
            .actor(actor)
            .reason(reason)
            .details(details)
            .timestamp(clock.instant())
            .build();
        try {
            ledgerStore.appendAdminEvent(event);
        } catch (StoreException e) {
            log.error("Admin event {} ({}) not durable yet, buffering", event.getEventId(), type, e);
            writeQueue.enqueue("admin:" + event.getEventId(), () -> ledgerStore.appendAdminEvent(event));
        }
        return event;
    }

    public List<AdminEvent> getEvents(Instant from, Instant to) {
        return ledgerStore.findAdminEvents(from, to);
    }

    public Optional<AdminEvent> lastBreakerEvent() {
        List<AdminEvent> events = ledgerStore.findAdminEvents(null, null);
        for (int i = events.size() - 1; i >= 0; i--) {
            if (BREAKER_EVENTS.contains(events.get(i).getType())) {
                return Optional.of(events.get(i));
            }
        }
        return Optional.empty();
    }
}
