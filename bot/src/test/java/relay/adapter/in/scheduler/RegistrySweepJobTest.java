package relay.adapter.in.scheduler;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import relay.core.port.out.Metrics;
import relay.core.port.out.RegistrationRepository;
import relay.support.MutableClock;

@DisplayName("RegistrySweepJob")
@ExtendWith(MockitoExtension.class)
class RegistrySweepJobTest {

    private static final Instant NOW = Instant.parse("2026-03-01T08:30:00Z");

    @Mock
    private RegistrationRepository repository;

    @Mock
    private Metrics metrics;

    private RegistrySweepJob job;

    @BeforeEach
    void setUp() {
        job = new RegistrySweepJob(repository, metrics, new MutableClock(NOW));
    }

    @Test
    @DisplayName("should sweep at the current instant and record the removed count")
    void shouldSweepAndRecord() {
        when(repository.sweep(NOW)).thenReturn(3);

        job.sweep();

        verify(repository).sweep(NOW);
        verify(metrics).recordSwept(3);
    }

    @Test
    @DisplayName("should still report an empty sweep")
    void shouldReportEmptySweep() {
        when(repository.sweep(NOW)).thenReturn(0);

        job.sweep();

        verify(metrics).recordSwept(0);
    }
}
