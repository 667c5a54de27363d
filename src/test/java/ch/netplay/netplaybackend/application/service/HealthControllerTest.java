package ch.netplay.netplaybackend.application.service;

import ch.netplay.netplaybackend.repository.ConnectionRegistry;
import ch.netplay.netplaybackend.repository.RoomRegistry;
import ch.netplay.netplaybackend.web.api.controller.HealthController;
import ch.netplay.netplaybackend.web.api.dto.HealthDto;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HealthControllerTest {

    @Mock
    RoomRegistry roomRegistry;

    @Mock
    ConnectionRegistry connectionRegistry;

    @InjectMocks
    HealthController healthController;

    @Test
    void health_shouldReportOk_withRegistryCounts() {
        when(roomRegistry.count()).thenReturn(3);
        when(connectionRegistry.count()).thenReturn(7);

        HealthDto health = healthController.health();

        assertThat(health.status()).isEqualTo("OK");
        assertThat(health.activeRooms()).isEqualTo(3);
        assertThat(health.liveConnections()).isEqualTo(7);
    }
}
