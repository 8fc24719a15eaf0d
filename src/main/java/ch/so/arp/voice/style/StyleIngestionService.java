package ch.so.arp.voice.style;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import ch.so.arp.voice.InvalidRequestException;
import ch.so.arp.voice.ResourceNotFoundException;
import ch.so.arp.voice.persistence.VoiceProfile;
import ch.so.arp.voice.persistence.VoiceProfileRepository;
import ch.so.arp.voice.persistence.WritingSample;
import ch.so.arp.voice.persistence.WritingSampleRepository;

/**
 * Turns uploaded writing samples into searchable style fragments: the sample is
 * stored, split into overlapping chunks, embedded and appended to the index.
 */
@Service
public class StyleIngestionService {

    private static final Logger LOGGER = LoggerFactory.getLogger(StyleIngestionService.class);

    private final VoiceProfileRepository profileRepository;
    private final WritingSampleRepository sampleRepository;
    private final TextChunker chunker;
    private final StyleEmbedder embedder;
    private final StyleIndex styleIndex;

    public StyleIngestionService(VoiceProfileRepository profileRepository, WritingSampleRepository sampleRepository,
            TextChunker chunker, StyleEmbedder embedder, StyleIndex styleIndex) {
        this.profileRepository = Objects.requireNonNull(profileRepository, "profileRepository");
        this.sampleRepository = Objects.requireNonNull(sampleRepository, "sampleRepository");
        this.chunker = Objects.requireNonNull(chunker, "chunker");
        this.embedder = Objects.requireNonNull(embedder, "embedder");
        this.styleIndex = Objects.requireNonNull(styleIndex, "styleIndex");
    }

    /**
     * Stores a writing sample and indexes its fragments. Fragments that fail to
     * embed are skipped without failing the upload.
     */
    public UploadResult upload(String ownerId, long voiceProfileId, String fileName, String content) {
        VoiceProfile profile = requireOwnedProfile(ownerId, voiceProfileId);
        if (fileName == null || fileName.isBlank()) {
            throw new InvalidRequestException("fileName must not be blank");
        }
        if (content == null || content.isBlank()) {
            throw new InvalidRequestException("Sample content must not be blank");
        }

        WritingSample sample = sampleRepository.create(profile.id(), fileName.strip(), content);
        List<String> chunks = chunker.chunk(content);
        List<EmbeddedFragment> embedded = embedder.embedBatch(chunks);
        int indexed;
        try {
            indexed = styleIndex.append(profile.id(), sample.id(), embedded);
        } catch (IllegalArgumentException ex) {
            sampleRepository.delete(profile.id(), sample.id());
            throw new InvalidRequestException("Sample embeddings do not match the existing fragments of voice profile "
                    + profile.id() + ": " + ex.getMessage());
        }
        LOGGER.info("Indexed sample {} ('{}') for profile {}: {} of {} fragments", sample.id(), sample.fileName(),
                profile.id(), indexed, chunks.size());
        return new UploadResult(sample.id(), indexed);
    }

    public void deleteSample(String ownerId, long voiceProfileId, long sampleId) {
        requireOwnedProfile(ownerId, voiceProfileId);
        int fragments = styleIndex.deleteBySample(voiceProfileId, sampleId);
        if (!sampleRepository.delete(voiceProfileId, sampleId)) {
            throw new ResourceNotFoundException("Writing sample", sampleId);
        }
        LOGGER.info("Deleted sample {} of profile {} with {} fragments", sampleId, voiceProfileId, fragments);
    }

    public void deleteProfile(String ownerId, long voiceProfileId) {
        requireOwnedProfile(ownerId, voiceProfileId);
        int fragments = styleIndex.deleteByProfile(voiceProfileId);
        profileRepository.delete(ownerId, voiceProfileId);
        LOGGER.info("Deleted profile {} with {} fragments", voiceProfileId, fragments);
    }

    public List<WritingSample> samples(long voiceProfileId) {
        return sampleRepository.findByProfile(voiceProfileId);
    }

    private VoiceProfile requireOwnedProfile(String ownerId, long voiceProfileId) {
        return profileRepository.findById(voiceProfileId)
                .filter(profile -> profile.isOwnedBy(ownerId))
                .orElseThrow(() -> new ResourceNotFoundException("Voice profile", voiceProfileId));
    }

    public record UploadResult(long sampleId, int fragmentsIndexed) {
    }
}
