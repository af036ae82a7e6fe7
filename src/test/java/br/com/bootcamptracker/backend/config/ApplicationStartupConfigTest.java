package br.com.bootcamptracker.backend.config;

import br.com.bootcamptracker.backend.config.properties.RiotApiProperties;
import br.com.bootcamptracker.backend.jobs.WorkerBootstrapService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.core.env.Environment;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.*;

class ApplicationStartupConfigTest {

    private AppProperties appProperties;
    private WorkerBootstrapService workerBootstrapService;
    private ApplicationStartupConfig startupConfig;

    @BeforeEach
    void setup() {
        appProperties = new AppProperties();
        workerBootstrapService = mock(WorkerBootstrapService.class);
        RiotApiProperties riotApiProperties = new RiotApiProperties();
        riotApiProperties.setKey("RGAPI-test");

        startupConfig = new ApplicationStartupConfig(mock(Environment.class), appProperties, riotApiProperties,
                workerBootstrapService);
    }

    @Test
    void testWorkersStartWhenEnabled() {
        // act
        startupConfig.onApplicationEvent(mock(ApplicationReadyEvent.class));

        // assert
        verify(workerBootstrapService).initializeWorkers();
    }

    @Test
    void testWorkersStayDownWhenDisabled() {
        // given
        appProperties.getScheduler().setEnabled(false);

        // act
        startupConfig.onApplicationEvent(mock(ApplicationReadyEvent.class));

        // assert
        verifyNoInteractions(workerBootstrapService);
    }

    @Test
    void testBootstrapFailureIsContained() {
        // given
        doThrow(new IllegalStateException("redis down")).when(workerBootstrapService).initializeWorkers();

        // act & assert
        assertThatCode(() -> startupConfig.onApplicationEvent(mock(ApplicationReadyEvent.class)))
                .doesNotThrowAnyException();
    }
}
