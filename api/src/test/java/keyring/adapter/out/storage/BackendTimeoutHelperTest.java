package keyring.adapter.out.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import keyring.spi.BackendTimeoutException;
import keyring.spi.KeyStoreException;

@DisplayName("BackendTimeoutHelper")
class BackendTimeoutHelperTest {

    private static final Duration TIMEOUT = Duration.ofMillis(50);
    private static final String BACKEND_NAME = "test-backend";
    private static final String OPERATION_NAME = "testOperation";

    private BackendTimeoutHelper helper;

    @BeforeEach
    void setUp() {
        helper = new BackendTimeoutHelper(TIMEOUT, BACKEND_NAME);
    }

    @Nested
    @DisplayName("withTimeout()")
    class WithTimeoutTests {

        @Test
        @DisplayName("should return result when operation completes within timeout")
        void shouldReturnResultWithinTimeout() {
            final var result = helper.withTimeout(Uni.createFrom().item("success"), OPERATION_NAME)
                    .await()
                    .indefinitely();

            assertEquals("success", result);
        }

        @Test
        @DisplayName("should throw BackendTimeoutException when operation times out")
        void shouldThrowOnTimeout() {
            final var operation = Uni.createFrom().<String>nothing();

            final var exception = assertThrows(
                    BackendTimeoutException.class,
                    () -> helper.withTimeout(operation, OPERATION_NAME).await().indefinitely());

            assertEquals(OPERATION_NAME, exception.getOperation());
            assertEquals(BACKEND_NAME, exception.getBackend());
            assertTrue(exception.getMessage().contains(OPERATION_NAME));
        }

        @Test
        @DisplayName("should propagate other failures unchanged")
        void shouldPropagateOtherFailures() {
            final var failure = new KeyStoreException("boom");
            final var operation = Uni.createFrom().<String>failure(failure);

            final var exception = assertThrows(
                    KeyStoreException.class,
                    () -> helper.withTimeout(operation, OPERATION_NAME).await().indefinitely());

            assertSame(failure, exception);
        }
    }

    @Nested
    @DisplayName("withTimeoutSilent()")
    class WithTimeoutSilentTests {

        @Test
        @DisplayName("should complete when operation times out")
        void shouldCompleteOnTimeout() {
            final var result = helper.withTimeoutSilent(Uni.createFrom().<Void>nothing(), OPERATION_NAME)
                    .await()
                    .indefinitely();

            assertNull(result);
        }

        @Test
        @DisplayName("should complete when operation fails")
        void shouldCompleteOnFailure() {
            final var operation = Uni.createFrom().<Void>failure(new KeyStoreException("boom"));

            final var result = helper.withTimeoutSilent(operation, OPERATION_NAME).await().indefinitely();

            assertNull(result);
        }
    }

    @Test
    @DisplayName("should expose the configured timeout")
    void shouldExposeTimeout() {
        assertEquals(TIMEOUT, helper.timeout());
    }
}
