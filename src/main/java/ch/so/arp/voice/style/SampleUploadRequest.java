package ch.so.arp.voice.style;

import jakarta.validation.constraints.NotBlank;

public record SampleUploadRequest(@NotBlank String fileName, @NotBlank String content) {
}
