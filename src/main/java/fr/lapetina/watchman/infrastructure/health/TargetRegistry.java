package fr.lapetina.watchman.infrastructure.health;

import fr.lapetina.watchman.domain.model.DeploymentTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Desired set of deployment targets: the source of truth for what should exist.
 *
 * Writers (API handlers, config reload) copy the current map, modify the copy
 * and swap it in under a short lock. Readers never lock: {@link #snapshot()}
 * returns the immutable map that was current at the time of the call, so a
 * registration arriving mid-round never affects the round.
 */
public final class TargetRegistry {

    private static final Logger log = LoggerFactory.getLogger(TargetRegistry.class);

    private final AtomicReference<Map<String, DeploymentTarget>> targets =
            new AtomicReference<>(Collections.emptyMap());
    private final Object writeLock = new Object();

    /**
     * Registers a new target or replaces an existing one with the same name.
     *
     * @return the accepted target
     */
    public DeploymentTarget register(DeploymentTarget target) {
        synchronized (writeLock) {
            Map<String, DeploymentTarget> next = new LinkedHashMap<>(targets.get());
            DeploymentTarget previous = next.put(target.getName(), target);
            targets.set(Collections.unmodifiableMap(next));

            if (previous == null) {
                log.info("Target registered: {}", target);
            } else if (!previous.equals(target)) {
                log.info("Target replaced: previous={}, current={}", previous, target);
            } else {
                log.debug("Target re-registered unchanged: {}", target);
            }
        }
        return target;
    }

    /**
     * Removes a target by name. No-op if absent.
     *
     * @return true if a target was removed
     */
    public boolean deregister(String name) {
        synchronized (writeLock) {
            Map<String, DeploymentTarget> current = targets.get();
            if (!current.containsKey(name)) {
                log.debug("Deregister ignored, target not registered: name={}", name);
                return false;
            }
            Map<String, DeploymentTarget> next = new LinkedHashMap<>(current);
            DeploymentTarget removed = next.remove(name);
            targets.set(Collections.unmodifiableMap(next));
            log.info("Target deregistered: {}", removed);
            return true;
        }
    }

    /**
     * Replaces every target of the given source with a new set.
     * Targets registered from other sources are left untouched.
     * Used for configuration reload.
     */
    public void replaceAll(DeploymentTarget.Source source, Collection<DeploymentTarget> newTargets) {
        synchronized (writeLock) {
            Map<String, DeploymentTarget> next = new LinkedHashMap<>(targets.get());
            Set<String> newNames = newTargets.stream()
                    .map(DeploymentTarget::getName)
                    .collect(Collectors.toSet());

            List<String> removed = new ArrayList<>();
            next.values().removeIf(existing -> {
                boolean drop = existing.getSource() == source && !newNames.contains(existing.getName());
                if (drop) {
                    removed.add(existing.getName());
                }
                return drop;
            });
            for (DeploymentTarget target : newTargets) {
                next.put(target.getName(), target);
            }
            targets.set(Collections.unmodifiableMap(next));

            log.info("Targets replaced: source={}, registered={}, removed={}, total={}",
                    source, newTargets.size(), removed, next.size());
        }
    }

    /**
     * Immutable point-in-time view of the registry, keyed by name.
     */
    public Map<String, DeploymentTarget> snapshot() {
        return targets.get();
    }

    public Optional<DeploymentTarget> get(String name) {
        return Optional.ofNullable(targets.get().get(name));
    }

    public boolean contains(String name) {
        return targets.get().containsKey(name);
    }

    /**
     * Returns the number of registered targets.
     */
    public int size() {
        return targets.get().size();
    }
}
