package net.ogimage.support.s3;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import net.ogimage.domain.render.Artifact;
import net.ogimage.exception.StorageUnavailableException;
import net.ogimage.test.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class S3ArtifactStoreTest {

    private static final Instant NOW = Instant.parse("2026-04-10T10:15:30.250Z");

    @Mock
    private S3ObjectStorageGateway gateway;

    private S3ArtifactStore store;

    @BeforeEach
    void setUp() {
        store = new S3ArtifactStore(gateway, "og_images/", new MutableClock(NOW));
    }

    @Test
    void put_UploadsWithFreshnessMetadata() {
        when(gateway.uploadBytesAsync(eq("og_images/fp.png"), any(byte[].class), eq("image/png"), anyMap()))
            .thenReturn(CompletableFuture.completedFuture("https://cdn.example.com/og_images/fp.png"));

        Artifact artifact = store.put("fp", new byte[] {1, 2}, Duration.ofHours(2));

        assertThat(artifact.url()).isEqualTo("https://cdn.example.com/og_images/fp.png");
        assertThat(artifact.storedAt()).isEqualTo(Instant.parse("2026-04-10T10:15:30Z"));
        assertThat(artifact.ttlSeconds()).isEqualTo(7200);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, String>> metadata = ArgumentCaptor.forClass(Map.class);
        verify(gateway).uploadBytesAsync(anyString(), any(byte[].class), anyString(), metadata.capture());
        assertThat(metadata.getValue())
            .containsEntry(S3ArtifactStore.STORED_AT_METADATA, Long.toString(NOW.getEpochSecond()))
            .containsEntry(S3ArtifactStore.TTL_METADATA, "7200");
    }

    @Test
    void put_UploadFailure_SurfacesStorageUnavailable() {
        when(gateway.uploadBytesAsync(anyString(), any(byte[].class), anyString(), anyMap()))
            .thenReturn(CompletableFuture.failedFuture(new StorageUnavailableException("s3", "S3 error uploading key")));

        assertThatThrownBy(() -> store.put("fp", new byte[] {1}, Duration.ofHours(1)))
            .isInstanceOf(StorageUnavailableException.class)
            .hasMessage("S3 error uploading key");
    }

    @Test
    void lookup_MissingObject_ReturnsEmpty() {
        when(gateway.headObject("og_images/fp.png")).thenReturn(Optional.empty());

        assertThat(store.lookup("fp")).isEmpty();
    }

    @Test
    void lookup_MapsMetadataToArtifact() {
        S3ObjectStorageGateway.ObjectMetadata metadata = new S3ObjectStorageGateway.ObjectMetadata(
            "og_images/fp.png",
            Map.of(S3ArtifactStore.STORED_AT_METADATA, "1767225600", S3ArtifactStore.TTL_METADATA, "86400"),
            Instant.parse("2026-01-01T00:00:05Z"));
        when(gateway.headObject("og_images/fp.png")).thenReturn(Optional.of(metadata));
        when(gateway.resolvePublicUrl("og_images/fp.png")).thenReturn("https://cdn.example.com/og_images/fp.png");

        Artifact artifact = store.lookup("fp").orElseThrow();

        assertThat(artifact.storedAt()).isEqualTo(Instant.ofEpochSecond(1767225600L));
        assertThat(artifact.ttlSeconds()).isEqualTo(86400);
        assertThat(artifact.url()).isEqualTo("https://cdn.example.com/og_images/fp.png");
    }

    @Test
    void lookup_WithoutTtlMetadata_IsAlreadyStale() {
        Instant modified = Instant.parse("2026-04-10T09:00:00Z");
        when(gateway.headObject("og_images/fp.png"))
            .thenReturn(Optional.of(new S3ObjectStorageGateway.ObjectMetadata("og_images/fp.png", Map.of(), modified)));
        when(gateway.resolvePublicUrl("og_images/fp.png")).thenReturn("https://cdn.example.com/og_images/fp.png");

        Artifact artifact = store.lookup("fp").orElseThrow();

        assertThat(artifact.storedAt()).isEqualTo(modified);
        assertThat(artifact.isFreshAt(modified)).isFalse();
    }

    @Test
    void lookup_HeadFailure_Propagates() {
        when(gateway.headObject("og_images/fp.png"))
            .thenThrow(new StorageUnavailableException("s3", "S3 error reading key og_images/fp.png"));

        assertThatThrownBy(() -> store.lookup("fp")).isInstanceOf(StorageUnavailableException.class);
    }
}
