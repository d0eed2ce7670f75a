package com.flagship.mpesa_bridge.health;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HealthControllerTest {

    private static final Instant NOW = Instant.parse("2024-01-15T09:30:00Z");

    @Mock
    private DataSource dataSource;

    @Mock
    private Connection connection;

    private HealthController controller;

    @BeforeEach
    void setUp() {
        controller = new HealthController(dataSource, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Healthy when the database answers")
    void healthy() throws SQLException {
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.isValid(2)).thenReturn(true);

        ResponseEntity<Map<String, Object>> response = controller.health();

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals("healthy", response.getBody().get("status"));
        assertEquals("UP", response.getBody().get("database"));
        assertEquals("2024-01-15T09:30:00Z", response.getBody().get("timestamp"));
        verify(connection).close();
    }

    @Test
    @DisplayName("Unhealthy with 503 when no connection can be obtained")
    void unhealthy() throws SQLException {
        when(dataSource.getConnection()).thenThrow(new SQLException("Connection refused"));

        ResponseEntity<Map<String, Object>> response = controller.health();

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
        assertEquals("unhealthy", response.getBody().get("status"));
        assertEquals("DOWN", response.getBody().get("database"));
    }
}
