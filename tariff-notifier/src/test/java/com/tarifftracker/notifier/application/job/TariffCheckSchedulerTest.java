package com.tarifftracker.notifier.application.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;

import com.tarifftracker.notifier.domain.notification.DispatchOutcome;
import com.tarifftracker.notifier.domain.notification.DispatchReport;
import com.tarifftracker.notifier.domain.notification.NotificationDispatcher;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.persistence.EntityManager;
import jakarta.persistence.Query;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TariffCheckSchedulerTest {

    @Mock
    private NotificationDispatcher dispatcher;

    @Mock
    private EntityManager entityManager;

    @Mock
    private Query lockQuery;

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private Counter sent;
    private Counter failed;
    private Counter skipped;
    private TariffCheckScheduler scheduler;

    @BeforeEach
    void setUp() {
        sent = registry.counter("sent");
        failed = registry.counter("failed");
        skipped = registry.counter("skipped");
        scheduler = new TariffCheckScheduler(dispatcher, entityManager, sent, failed, skipped);
        given(entityManager.createNativeQuery(anyString())).willReturn(lockQuery);
        given(lockQuery.setParameter(anyString(), any())).willReturn(lockQuery);
    }

    @Test
    void shouldDispatchAndCountOutcomesWhenLockAcquired() {
        // given
        given(lockQuery.getSingleResult()).willReturn(true);
        given(dispatcher.dispatch()).willReturn(DispatchReport.of("cycle", List.of(
                DispatchOutcome.SENT, DispatchOutcome.SENT, DispatchOutcome.FAILED,
                DispatchOutcome.ALREADY_NOTIFIED, DispatchOutcome.NO_SAVINGS)));

        // when
        scheduler.checkTariffs();

        // then
        assertThat(sent.count()).isEqualTo(2.0);
        assertThat(failed.count()).isEqualTo(1.0);
        assertThat(skipped.count()).isEqualTo(1.0);
    }

    @Test
    void shouldSkipSweepWhenAnotherInstanceHoldsLock() {
        // given
        given(lockQuery.getSingleResult()).willReturn(false);

        // when
        scheduler.checkTariffs();

        // then
        then(dispatcher).should(never()).dispatch();
    }

    @Test
    void shouldNotCountAbortedSweep() {
        // given
        given(lockQuery.getSingleResult()).willReturn(true);
        given(dispatcher.dispatch()).willReturn(DispatchReport.aborted("cycle"));

        // when
        scheduler.checkTariffs();

        // then
        assertThat(sent.count()).isZero();
        assertThat(failed.count()).isZero();
    }
}
