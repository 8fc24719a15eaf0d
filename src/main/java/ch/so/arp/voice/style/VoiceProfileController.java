package ch.so.arp.voice.style;

import java.util.List;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import ch.so.arp.voice.ResourceNotFoundException;
import ch.so.arp.voice.persistence.VoiceProfile;
import ch.so.arp.voice.persistence.VoiceProfileRepository;
import jakarta.validation.Valid;

/**
 * Voice profile endpoints the chat pipeline relies on: creating a profile,
 * uploading and removing writing samples, and selecting the active profile.
 */
@RestController
@RequestMapping(path = "/api/voice-profiles", produces = MediaType.APPLICATION_JSON_VALUE)
public class VoiceProfileController {

    static final String USER_HEADER = "X-User-Id";

    private final VoiceProfileRepository profileRepository;
    private final StyleIngestionService ingestionService;

    public VoiceProfileController(VoiceProfileRepository profileRepository, StyleIngestionService ingestionService) {
        this.profileRepository = profileRepository;
        this.ingestionService = ingestionService;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public VoiceProfile create(@RequestHeader(USER_HEADER) String userId,
            @Valid @RequestBody VoiceProfileRequest request) {
        return profileRepository.create(request.toProfile(userId));
    }

    @GetMapping
    public List<VoiceProfile> list(@RequestHeader(USER_HEADER) String userId) {
        return profileRepository.findByOwner(userId);
    }

    @DeleteMapping("/{profileId}")
    public ResponseEntity<Void> delete(@RequestHeader(USER_HEADER) String userId, @PathVariable long profileId) {
        ingestionService.deleteProfile(userId, profileId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping(path = "/{profileId}/samples", consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public StyleIngestionService.UploadResult upload(@RequestHeader(USER_HEADER) String userId,
            @PathVariable long profileId, @Valid @RequestBody SampleUploadRequest request) {
        return ingestionService.upload(userId, profileId, request.fileName(), request.content());
    }

    @DeleteMapping("/{profileId}/samples/{sampleId}")
    public ResponseEntity<Void> deleteSample(@RequestHeader(USER_HEADER) String userId,
            @PathVariable long profileId, @PathVariable long sampleId) {
        ingestionService.deleteSample(userId, profileId, sampleId);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/{profileId}/active")
    public Map<String, Object> activate(@RequestHeader(USER_HEADER) String userId, @PathVariable long profileId) {
        if (!profileRepository.setActive(userId, profileId)) {
            throw new ResourceNotFoundException("Voice profile", profileId);
        }
        return Map.of("activeProfileId", profileId);
    }
}
