package kr.jemi.zseat.inventory.infrastructure.in.scheduler;

import kr.jemi.zseat.inventory.application.port.in.ExpireHoldsUseCase;
import net.javacrumbs.shedlock.core.LockConfiguration;
import net.javacrumbs.shedlock.core.LockingTaskExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * 만료 선점을 주기적으로 정리한다. 여러 인스턴스 중 하나만 실행하도록 분산 락을 잡는다.
 * 정리가 늦어도 선점/판매 시점에 만료를 다시 확인하므로 정합성에는 영향이 없다.
 */
@Component
public class ExpirySweepScheduler implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ExpirySweepScheduler.class);
    private static final String LOCK_NAME = "expireHolds";

    private final ExpireHoldsUseCase expireHoldsUseCase;
    private final TaskScheduler taskScheduler;
    private final LockingTaskExecutor lockingTaskExecutor;
    private final Clock clock;
    private final boolean enabled;
    private final Duration interval;
    private final Duration lockAtMostFor;
    private final Duration lockAtLeastFor;

    private volatile ScheduledFuture<?> future;

    public ExpirySweepScheduler(ExpireHoldsUseCase expireHoldsUseCase,
                                TaskScheduler taskScheduler,
                                LockingTaskExecutor lockingTaskExecutor,
                                Clock clock,
                                @Value("${zseat.sweep.enabled}") boolean enabled,
                                @Value("${zseat.sweep.interval}") Duration interval,
                                @Value("${zseat.sweep.lock-at-most-for}") Duration lockAtMostFor,
                                @Value("${zseat.sweep.lock-at-least-for}") Duration lockAtLeastFor) {
        this.expireHoldsUseCase = expireHoldsUseCase;
        this.taskScheduler = taskScheduler;
        this.lockingTaskExecutor = lockingTaskExecutor;
        this.clock = clock;
        this.enabled = enabled;
        this.interval = interval;
        this.lockAtMostFor = lockAtMostFor;
        this.lockAtLeastFor = lockAtLeastFor;
    }

    public void sweep() {
        try {
            LockConfiguration lock = new LockConfiguration(clock.instant(), LOCK_NAME, lockAtMostFor, lockAtLeastFor);
            lockingTaskExecutor.executeWithLock((Runnable) expireHoldsUseCase::expireOverdueHolds, lock);
        } catch (Exception e) {
            log.error("만료 선점 정리 스케줄러 실패", e);
        }
    }

    @Override
    public synchronized void start() {
        if (future == null) {
            future = taskScheduler.scheduleWithFixedDelay(this::sweep, interval);
            log.info("만료 선점 정리 시작: interval={}", interval);
        }
    }

    @Override
    public synchronized void stop() {
        if (future != null) {
            future.cancel(false);
            future = null;
            log.info("만료 선점 정리 중지");
        }
    }

    @Override
    public boolean isRunning() {
        return future != null;
    }

    @Override
    public boolean isAutoStartup() {
        return enabled;
    }
}
