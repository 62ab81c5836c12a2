package com.socialnet.jobs;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JobHandlerRegistry Unit Tests")
class JobHandlerRegistryTest {

    @Test
    @DisplayName("dispatch should route each kind to its handler")
    void testDispatch_RoutesByKind() {
        // Arrange
        RecordingHandler<CreatePostPayload> createPost = new RecordingHandler<>(JobKind.CREATE_POST, CreatePostPayload.class);
        RecordingHandler<CleanupTokensPayload> cleanup = new RecordingHandler<>(JobKind.CLEANUP_TOKENS, CleanupTokensPayload.class);
        JobHandlerRegistry registry = new JobHandlerRegistry(List.of(createPost, cleanup));
        CleanupTokensPayload payload = new CleanupTokensPayload("nightly");

        // Act
        registry.dispatch(JobKind.CLEANUP_TOKENS, payload);

        // Assert
        assertEquals(List.of(payload), cleanup.received);
        assertTrue(createPost.received.isEmpty());
    }

    @Test
    @DisplayName("dispatch should reject a payload of another kind")
    void testDispatch_PayloadMismatch() {
        JobHandlerRegistry registry = new JobHandlerRegistry(List.of(
                new RecordingHandler<>(JobKind.CREATE_POST, CreatePostPayload.class),
                new RecordingHandler<>(JobKind.CLEANUP_TOKENS, CleanupTokensPayload.class)));

        assertThrows(IllegalArgumentException.class,
                () -> registry.dispatch(JobKind.CREATE_POST, new CleanupTokensPayload("x")));
    }

    @Test
    @DisplayName("construction should fail when a kind has no handler")
    void testMissingHandler() {
        List<JobHandler<? extends JobPayload>> handlers =
                List.of(new RecordingHandler<>(JobKind.CREATE_POST, CreatePostPayload.class));

        assertThrows(IllegalStateException.class, () -> new JobHandlerRegistry(handlers));
    }

    @Test
    @DisplayName("construction should fail when a kind has two handlers")
    void testDuplicateHandler() {
        List<JobHandler<? extends JobPayload>> handlers = List.of(
                new RecordingHandler<>(JobKind.CREATE_POST, CreatePostPayload.class),
                new RecordingHandler<>(JobKind.CLEANUP_TOKENS, CleanupTokensPayload.class),
                new RecordingHandler<>(JobKind.CLEANUP_TOKENS, CleanupTokensPayload.class));

        assertThrows(IllegalStateException.class, () -> new JobHandlerRegistry(handlers));
    }

    @Test
    @DisplayName("construction should fail when a handler's payload class does not match its kind")
    void testPayloadTypeMismatch() {
        List<JobHandler<? extends JobPayload>> handlers = List.of(
                new RecordingHandler<>(JobKind.CREATE_POST, CleanupTokensPayload.class),
                new RecordingHandler<>(JobKind.CLEANUP_TOKENS, CleanupTokensPayload.class));

        assertThrows(IllegalStateException.class, () -> new JobHandlerRegistry(handlers));
    }

    private static final class RecordingHandler<P extends JobPayload> implements JobHandler<P> {

        private final JobKind kind;
        private final Class<P> payloadType;
        private final List<P> received = new ArrayList<>();

        private RecordingHandler(JobKind kind, Class<P> payloadType) {
            this.kind = kind;
            this.payloadType = payloadType;
        }

        @Override
        public JobKind kind() {
            return kind;
        }

        @Override
        public Class<P> payloadType() {
            return payloadType;
        }

        @Override
        public void handle(P payload) {
            received.add(payload);
        }
    }
}
