package com.phillippitts.sermonflow.service.queue;

import com.phillippitts.sermonflow.domain.ProcessingJob;
import com.phillippitts.sermonflow.domain.ProgressUpdate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans job progress out to every subscriber of a sermon.
 *
 * <p>Progress per sermon never decreases: a lower value is raised to the highest value already
 * published. {@link #complete} ends all streams for the sermon and resets its high-water mark.
 */
@Component
public class ProgressPublisher {

    private static final Logger LOG = LogManager.getLogger(ProgressPublisher.class);

    private final Map<UUID, List<ProgressSubscription>> subscribers = new ConcurrentHashMap<>();
    private final Map<UUID, Double> highWater = new ConcurrentHashMap<>();

    public ProgressSubscription subscribe(UUID sermonId) {
        ProgressSubscription s = new ProgressSubscription(sermonId, this::remove);
        subscribers.computeIfAbsent(sermonId, id -> new CopyOnWriteArrayList<>()).add(s);
        LOG.debug("Subscriber added for sermon {} ({} total)", sermonId, subscriberCount(sermonId));
        return s;
    }

    public void publish(ProcessingJob job, double progress) {
        UUID sermonId = job.sermonId();
        double value = highWater.merge(sermonId, clamp(progress), Math::max);
        ProgressUpdate update = new ProgressUpdate(job, value);
        for (ProgressSubscription s : subscribers.getOrDefault(sermonId, List.of())) {
            s.deliver(update);
        }
    }

    /** Ends every stream of the sermon. */
    public void complete(UUID sermonId) {
        List<ProgressSubscription> list = subscribers.remove(sermonId);
        highWater.remove(sermonId);
        if (list != null) {
            list.forEach(ProgressSubscription::end);
            LOG.debug("Completed {} stream(s) for sermon {}", list.size(), sermonId);
        }
    }

    public int subscriberCount(UUID sermonId) {
        return subscribers.getOrDefault(sermonId, List.of()).size();
    }

    private void remove(ProgressSubscription s) {
        subscribers.computeIfPresent(s.sermonId(), (id, list) -> {
            list.remove(s);
            return list.isEmpty() ? null : list;
        });
    }

    private static double clamp(double p) {
        return Double.isNaN(p) ? 0.0 : Math.max(0.0, Math.min(1.0, p));
    }
}
