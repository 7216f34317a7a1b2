package com.lpradar.monitor;

import com.lpradar.cache.EntityNotFoundUpstreamException;
import com.lpradar.domain.PoolWatch;
import com.lpradar.domain.PoolWatchRepository;
import com.lpradar.domain.PositionWatch;
import com.lpradar.domain.PositionWatchRepository;
import com.lpradar.monitor.config.MonitorProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WatchRestorerTest {

    @Mock
    private MonitorEngine monitorEngine;
    @Mock
    private PoolWatchRepository poolWatchRepository;
    @Mock
    private PositionWatchRepository positionWatchRepository;

    private static PoolWatch poolWatch(String id) {
        PoolWatch watch = new PoolWatch();
        watch.setId(id);
        return watch;
    }

    @Test
    void restoreAll_failedWatchLoggedOthersRestored() {
        PoolWatch ok = poolWatch("42161:0xc6962004f452be9203591991d15f6b388e09e8d0#chat-1");
        PoolWatch broken = poolWatch("42161:0x0000000000000000000000000000000000000001#chat-1");
        PositionWatch position = new PositionWatch();
        position.setId("42161:0x46a15b0b27311cedf172ab29e4f4766fbe7f4364:7#chat-1");
        when(poolWatchRepository.findAll()).thenReturn(List.of(broken, ok));
        when(positionWatchRepository.findAll()).thenReturn(List.of(position));
        doThrow(new EntityNotFoundUpstreamException("pool", "42161:0x0000000000000000000000000000000000000001", "execution reverted"))
                .when(monitorEngine).restore(broken);

        WatchRestorer restorer = new WatchRestorer(monitorEngine, poolWatchRepository, positionWatchRepository, new MonitorProperties());

        assertThat(restorer.restoreAll()).isEqualTo(2);
        verify(monitorEngine).restore(ok);
        verify(monitorEngine).restore(position);
    }

    @Test
    void onApplicationReady_restoreDisabled_doesNothing() {
        MonitorProperties properties = new MonitorProperties();
        properties.setRestoreOnStartup(false);

        new WatchRestorer(monitorEngine, poolWatchRepository, positionWatchRepository, properties).onApplicationReady();

        verifyNoInteractions(monitorEngine, poolWatchRepository, positionWatchRepository);
    }
}
