package com.example.jsonecho;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/** Holds the route store currently being served; reloads swap it whole. */
public final class ReloadableRouteStore {
    private static final Logger log = LoggerFactory.getLogger(ReloadableRouteStore.class);

    private final AtomicReference<RouteStore> current;

    public ReloadableRouteStore() {
        this(RouteStore.empty());
    }

    public ReloadableRouteStore(RouteStore initial) {
        this.current = new AtomicReference<>(Objects.requireNonNull(initial, "initial"));
    }

    public RouteStore current() {
        return current.get();
    }

    /** Publishes {@code store} and returns the one it replaced. */
    public RouteStore replace(RouteStore store) {
        return current.getAndSet(Objects.requireNonNull(store, "store"));
    }

    /**
     * Loads {@code path}, builds a store from it and publishes it. If loading or populating fails the
     * previously published store stays in place and the failure is rethrown.
     */
    public RouteStore reload(ConfigLoader loader, String path) {
        RouteStore next;
        try {
            next = RouteStore.populate(loader.load(path).routes());
        } catch (JsonEchoException ex) {
            log.warn("Reload of {} rejected, keeping {} routes: {}", path, current().size(), ex.getMessage());
            throw ex;
        }
        RouteStore previous = replace(next);
        log.info("Reloaded {}: {} routes (previously {})", path, next.size(), previous.size());
        return next;
    }
}
