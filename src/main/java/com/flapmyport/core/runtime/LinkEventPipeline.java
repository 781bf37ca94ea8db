package com.flapmyport.core.runtime;

import com.flapmyport.core.classify.LinkEventClassifier;
import com.flapmyport.core.classify.LinkFieldExtractor;
import com.flapmyport.core.model.LinkEvent;
import com.flapmyport.core.model.TrapNotification;
import com.flapmyport.core.spi.EventStore;
import com.flapmyport.core.spi.StoreException;
import com.flapmyport.core.spi.TrapListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Turns a link trap into a stored, enriched {@link LinkEvent}:
 * classify, extract, insert, resolve metadata, update by sid.
 * <p>
 * The insert happens before any enrichment so the event survives a failed lookup. If the
 * insert fails the trap is abandoned; if the update fails the inserted row stands as is.
 */
public class LinkEventPipeline implements TrapListener {
    private static final Logger log = LoggerFactory.getLogger(LinkEventPipeline.class);

    private final LinkEventClassifier classifier;
    private final LinkFieldExtractor extractor;
    private final MetadataResolver resolver;
    private final EventStore store;
    private final Clock clock;
    private final Supplier<String> sids;

    public LinkEventPipeline(MetadataResolver resolver, EventStore store) {
        this(new LinkEventClassifier(), new LinkFieldExtractor(), resolver, store,
                Clock.systemDefaultZone(), () -> UUID.randomUUID().toString());
    }

    public LinkEventPipeline(LinkEventClassifier classifier, LinkFieldExtractor extractor,
                             MetadataResolver resolver, EventStore store,
                             Clock clock, Supplier<String> sids) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sids = Objects.requireNonNull(sids, "sids");
    }

    @Override
    public void onTrap(TrapNotification trap) {
        if (!classifier.isLinkEvent(trap)) {
            return;
        }
        handle(trap);
    }

    /** Runs the whole lifecycle for one accepted trap and returns the event as last persisted. */
    LinkEvent handle(TrapNotification trap) {
        LinkEvent event = new LinkEvent(sids.get(), trap.sourceAddress(), LocalDateTime.now(clock));
        extractor.extract(trap, event);
        log.debug("{} trap received: {}", event.sid(), event);

        if (event.timeTicks() == 0) {
            log.info("{} SNMP trap has no timeTicks: {}", event.sid(), event);
        }

        try {
            store.insertEvent(event);
        } catch (StoreException | RuntimeException e) {
            log.error("{} unable to save link event: {}", event.sid(), e.getMessage(), e);
            return event;
        }

        resolver.resolve(event);

        try {
            store.updateEvent(event.sid(), event.hostName(), event.ifName(), event.ifAlias());
            log.info("{} link event saved: {}", event.sid(), event);
        } catch (StoreException | RuntimeException e) {
            log.error("{} unable to update link event: {}", event.sid(), e.getMessage(), e);
        }
        return event;
    }
}
