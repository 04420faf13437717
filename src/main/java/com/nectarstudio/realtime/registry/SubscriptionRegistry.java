package com.nectarstudio.realtime.registry;

import com.nectarstudio.realtime.model.dto.TableFilters;
import com.nectarstudio.realtime.polling.PollingJob;
import com.nectarstudio.realtime.polling.PollingJobKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Maps channels to deduplicated polling jobs and back.
 * <p>
 * All mutations of one job key run inside {@link ConcurrentHashMap#compute}, which serialises
 * them per key. Each entry holds an immutable channel map, so routing reads never lock.
 * The registry only keeps state; starting and stopping jobs is up to the caller.
 */
@Slf4j
@Component
public class SubscriptionRegistry {

    private record JobEntry(PollingJob job, Map<ChannelRef, Subscription> channels) { }

    private final ConcurrentHashMap<PollingJobKey, JobEntry> jobs = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ChannelRef, Subscription> subscriptions = new ConcurrentHashMap<>();
    private final Clock clock;

    public SubscriptionRegistry(Clock clock) {
        this.clock = clock;
    }

    /**
     * Binds {@code channel} to the job for (service, entity, filters), creating the job with
     * {@code jobFactory} when none exists. The factory runs inside the key's critical section,
     * so it should only construct the job from values resolved beforehand. Exceptions from the
     * factory propagate and leave the registry unchanged.
     */
    public BindResult subscribe(ChannelRef channel, String serviceName, String entityName, TableFilters filters,
                                long pollingInterval, boolean enableDatabaseTriggers,
                                Function<PollingJobKey, PollingJob> jobFactory) {
        PollingJobKey key = PollingJobKey.of(serviceName, entityName, filters);
        return bind(channel, key, pollingInterval, enableDatabaseTriggers, jobFactory)
                .orElseThrow(() -> new IllegalStateException("Job factory returned no job for " + key));
    }

    /**
     * Binds {@code channel} to the job for {@code key} if that job already exists.
     */
    public Optional<BindResult> join(ChannelRef channel, PollingJobKey key, long pollingInterval,
                                     boolean enableDatabaseTriggers) {
        return bind(channel, key, pollingInterval, enableDatabaseTriggers, k -> null);
    }

    private Optional<BindResult> bind(ChannelRef channel, PollingJobKey key, long pollingInterval,
                                      boolean enableDatabaseTriggers, Function<PollingJobKey, PollingJob> jobFactory) {
        Subscription subscription = new Subscription(channel, key, key.toFilters(), pollingInterval,
                enableDatabaseTriggers, Instant.now(clock));
        AtomicBoolean created = new AtomicBoolean();

        JobEntry entry = jobs.compute(key, (k, existing) -> {
            PollingJob job;
            Map<ChannelRef, Subscription> channels = new LinkedHashMap<>();
            if (existing == null) {
                job = jobFactory.apply(k);
                if (job == null) {
                    return null;
                }
                created.set(true);
            } else {
                job = existing.job();
                channels.putAll(existing.channels());
            }
            channels.put(channel, subscription);
            job.setTriggersEnabled(channels.values().stream().anyMatch(Subscription::enableDatabaseTriggers));
            subscriptions.put(channel, subscription);
            return new JobEntry(job, Map.copyOf(channels));
        });
        if (entry == null) {
            return Optional.empty();
        }

        log.debug("🔗 Channel {} bound to {} ({} channels, created={})",
                channel, key, entry.channels().size(), created.get());
        return Optional.of(new BindResult(entry.job(), subscription, created.get(), floorOf(entry.channels().values())));
    }

    /**
     * Unbinds {@code channel}. When it was the job's last channel the job is removed.
     */
    public Optional<UnbindResult> unsubscribe(ChannelRef channel) {
        Subscription subscription = subscriptions.get(channel);
        if (subscription == null) {
            return Optional.empty();
        }
        AtomicReference<UnbindResult> result = new AtomicReference<>();
        jobs.computeIfPresent(subscription.jobKey(), (k, existing) -> {
            if (!existing.channels().containsKey(channel)) {
                return existing;
            }
            subscriptions.remove(channel, subscription);
            Map<ChannelRef, Subscription> channels = new LinkedHashMap<>(existing.channels());
            channels.remove(channel);
            PollingJob job = existing.job();
            if (channels.isEmpty()) {
                result.set(new UnbindResult(job, subscription, true, Long.MAX_VALUE));
                return null;
            }
            job.setTriggersEnabled(channels.values().stream().anyMatch(Subscription::enableDatabaseTriggers));
            result.set(new UnbindResult(job, subscription, false, floorOf(channels.values())));
            return new JobEntry(job, Map.copyOf(channels));
        });
        if (result.get() == null) {
            subscriptions.remove(channel, subscription);
        }
        return Optional.ofNullable(result.get());
    }

    /**
     * Channels currently bound to the job, empty once it is gone.
     */
    public Set<ChannelRef> routeUpdate(PollingJobKey key) {
        JobEntry entry = jobs.get(key);
        return entry != null ? entry.channels().keySet() : Set.of();
    }

    public Collection<Subscription> subscriptionsOf(PollingJobKey key) {
        JobEntry entry = jobs.get(key);
        return entry != null ? entry.channels().values() : List.of();
    }

    public Optional<Subscription> subscription(ChannelRef channel) {
        return Optional.ofNullable(subscriptions.get(channel));
    }

    public List<ChannelRef> channelsOf(String connectionId) {
        return subscriptions.keySet().stream()
                .filter(channel -> channel.connectionId().equals(connectionId))
                .toList();
    }

    public Optional<PollingJob> job(PollingJobKey key) {
        JobEntry entry = jobs.get(key);
        return entry != null ? Optional.of(entry.job()) : Optional.empty();
    }

    /**
     * Jobs watching the given entity, whatever their filters.
     */
    public List<PollingJob> jobsFor(String serviceName, String entityName) {
        return jobs.values().stream()
                .map(JobEntry::job)
                .filter(job -> job.getKey().serviceName().equalsIgnoreCase(serviceName)
                        && (job.getKey().entityName().equalsIgnoreCase(entityName)
                        || job.getTable().table().equalsIgnoreCase(entityName)))
                .toList();
    }

    public List<PollingJob> activeJobs() {
        return jobs.values().stream().map(JobEntry::job).toList();
    }

    public int channelCount() {
        return subscriptions.size();
    }

    private static long floorOf(Collection<Subscription> channels) {
        return channels.stream()
                .mapToLong(Subscription::requestedPollingInterval)
                .min()
                .orElse(Long.MAX_VALUE);
    }
}
