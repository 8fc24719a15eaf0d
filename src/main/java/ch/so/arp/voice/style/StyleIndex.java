package ch.so.arp.voice.style;

import java.util.List;

/**
 * Append-only store of style fragments, partitioned by voice profile.
 */
public interface StyleIndex {

    int DEFAULT_TOP_K = 3;

    /**
     * Appends embedded fragments of a sample to the profile's partition.
     *
     * @return number of fragments stored
     * @throws IllegalArgumentException if a vector's dimensionality differs from
     *                                  the vectors already stored for the profile
     */
    int append(long voiceProfileId, long sampleId, List<EmbeddedFragment> fragments);

    /**
     * Returns at most {@code k} fragments of the profile ranked by cosine
     * similarity, best first, ties in insertion order.
     */
    List<ScoredFragment> topK(long voiceProfileId, float[] queryVector, int k);

    int deleteByProfile(long voiceProfileId);

    int deleteBySample(long voiceProfileId, long sampleId);

    int count(long voiceProfileId);
}
