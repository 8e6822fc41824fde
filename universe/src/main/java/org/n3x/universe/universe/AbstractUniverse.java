package org.n3x.universe.universe;

import com.google.common.annotations.VisibleForTesting;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
public abstract class AbstractUniverse implements Universe {
    @Getter
    @NonNull
    protected final UniverseParams universeParams;

    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    private Thread shutdownHook;

    protected AbstractUniverse(@NonNull UniverseParams universeParams) {
        this.universeParams = universeParams;
    }

    /**
     * Destroys the fleet if the JVM exits mid-run. Registered once fleet resources exist.
     */
    protected synchronized void registerShutdownHook() {
        if (!universeParams.isCleanUpEnabled() || shutdownHook != null) {
            return;
        }

        shutdownHook = new Thread(this::shutdown, "shutdown-" + universeParams.getRunId());
        Runtime.getRuntime().addShutdownHook(shutdownHook);
    }

    private synchronized void removeShutdownHook() {
        if (shutdownHook == null) {
            return;
        }

        if (Thread.currentThread() != shutdownHook) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException ex) {
                log.debug("JVM is shutting down, hook of {} is already running", universeParams.getRunId());
            }
        }
        shutdownHook = null;
    }

    @VisibleForTesting
    synchronized boolean isShutdownHookRegistered() {
        return shutdownHook != null;
    }

    @Override
    public void shutdown() {
        removeShutdownHook();

        if (!universeParams.isCleanUpEnabled()) {
            log.info("Shutdown is disabled, nodes of {} are kept", universeParams.getRunId());
            return;
        }

        if (!shutdown.compareAndSet(false, true)) {
            log.trace("Universe {} already shut down", universeParams.getRunId());
            return;
        }

        log.info("Shutdown universe: {}", universeParams.getRunId());
        shutdownNodes();
    }

    protected abstract void shutdownNodes();
}
