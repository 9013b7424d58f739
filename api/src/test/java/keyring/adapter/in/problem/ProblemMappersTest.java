package keyring.adapter.in.problem;

import static org.junit.jupiter.api.Assertions.assertEquals;

import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import keyring.spi.BackendTimeoutException;
import keyring.spi.KeyStoreException;
import keyring.spi.NoActiveKeyException;
import keyring.spi.RotationConflictException;
import keyring.spi.RotationInProgressException;
import keyring.spi.VersionConflictException;

@DisplayName("ProblemMappers")
class ProblemMappersTest {

    private ProblemMappers mappers;

    @BeforeEach
    void setUp() {
        mappers = new ProblemMappers();
    }

    @Test
    @DisplayName("rotation contention should map to 409")
    void rotationContentionShouldMapTo409() {
        assertStatus(409, mappers.mapRotationInProgress(new RotationInProgressException("held")));
        assertStatus(
                409,
                mappers.mapRotationConflict(
                        new RotationConflictException("lost", new VersionConflictException("active-kid"))));
    }

    @Test
    @DisplayName("missing active key and backend timeouts should map to 503")
    void unavailabilityShouldMapTo503() {
        assertStatus(503, mappers.mapNoActiveKey(new NoActiveKeyException("none")));
        assertStatus(503, mappers.mapBackendTimeout(new BackendTimeoutException("getKey", "redis")));
    }

    @Test
    @DisplayName("other key store failures should map to 500 without internal details")
    void otherFailuresShouldMapTo500() {
        final var response = mappers.mapKeyStoreException(new KeyStoreException("redis password wrong"));

        assertStatus(500, response);
        assertEquals("Key store failure", ((HttpProblem) response.getEntity()).getDetail());
    }

    @Test
    @DisplayName("invalid input should map to 400 with the message")
    void invalidInputShouldMapTo400() {
        final var response = mappers.mapIllegalArgumentException(new IllegalArgumentException("email is required"));

        assertStatus(400, response);
        assertEquals("email is required", ((HttpProblem) response.getEntity()).getDetail());
    }

    private static void assertStatus(int expected, Response response) {
        assertEquals(expected, response.getStatus());
        assertEquals("application/problem+json", response.getMediaType().toString());
    }
}
