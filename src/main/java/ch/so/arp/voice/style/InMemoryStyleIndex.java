package ch.so.arp.voice.style;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link StyleIndex} keeping fragments in memory. Each profile has a
 * copy-on-write list, so queries iterate a snapshot and never wait for an
 * append. Appends to the same profile are serialised through the map.
 */
public class InMemoryStyleIndex implements StyleIndex {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryStyleIndex.class);

    private final Map<Long, CopyOnWriteArrayList<StyleFragment>> fragmentsByProfile = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public int append(long voiceProfileId, long sampleId, List<EmbeddedFragment> fragments) {
        if (fragments.isEmpty()) {
            return 0;
        }
        int dimensions = fragments.get(0).vector().length;
        fragmentsByProfile.compute(voiceProfileId, (id, existing) -> {
            CopyOnWriteArrayList<StyleFragment> target = existing != null ? existing : new CopyOnWriteArrayList<>();
            int expected = target.isEmpty() ? dimensions : target.get(0).vector().length;
            for (EmbeddedFragment fragment : fragments) {
                if (fragment.vector().length != expected) {
                    throw new IllegalArgumentException("Vector has " + fragment.vector().length
                            + " dimensions but profile " + voiceProfileId + " stores " + expected);
                }
            }
            target.addAll(fragments.stream()
                    .map(fragment -> {
                        long next = sequence.incrementAndGet();
                        return new StyleFragment(next, voiceProfileId, sampleId, fragment.text(),
                                fragment.vector().clone(), next);
                    })
                    .toList());
            return target;
        });
        LOGGER.debug("Stored {} fragments for profile {} (sample {})", fragments.size(), voiceProfileId, sampleId);
        return fragments.size();
    }

    @Override
    public List<ScoredFragment> topK(long voiceProfileId, float[] queryVector, int k) {
        List<StyleFragment> fragments = fragmentsByProfile.get(voiceProfileId);
        if (fragments == null) {
            return List.of();
        }
        return VectorMath.rank(fragments.stream(), queryVector, k);
    }

    @Override
    public int deleteByProfile(long voiceProfileId) {
        List<StyleFragment> removed = fragmentsByProfile.remove(voiceProfileId);
        return removed != null ? removed.size() : 0;
    }

    @Override
    public int deleteBySample(long voiceProfileId, long sampleId) {
        AtomicInteger removed = new AtomicInteger();
        fragmentsByProfile.computeIfPresent(voiceProfileId, (id, fragments) -> {
            int before = fragments.size();
            fragments.removeIf(fragment -> fragment.sampleId() == sampleId);
            removed.set(before - fragments.size());
            return fragments.isEmpty() ? null : fragments;
        });
        return removed.get();
    }

    @Override
    public int count(long voiceProfileId) {
        List<StyleFragment> fragments = fragmentsByProfile.get(voiceProfileId);
        return fragments != null ? fragments.size() : 0;
    }
}
