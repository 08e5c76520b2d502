package kr.jemi.zseat.common.scheduler;

import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.modulith.events.IncompleteEventPublications;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class EventResubmitScheduler {

    private static final Logger log = LoggerFactory.getLogger(EventResubmitScheduler.class);

    private final IncompleteEventPublications incompleteEventPublications;
    private final Duration olderThan;

    public EventResubmitScheduler(IncompleteEventPublications incompleteEventPublications,
                                  @Value("${zseat.event-resubmit.older-than}") Duration olderThan) {
        this.incompleteEventPublications = incompleteEventPublications;
        this.olderThan = olderThan;
    }

    @Scheduled(cron = "${zseat.event-resubmit.cron}")
    @SchedulerLock(name = "resubmitIncompleteEvents",
            lockAtMostFor = "${zseat.event-resubmit.lock-at-most-for}",
            lockAtLeastFor = "${zseat.event-resubmit.lock-at-least-for}")
    public void resubmitIncompleteEvents() {
        try {
            incompleteEventPublications.resubmitIncompletePublicationsOlderThan(olderThan);
        } catch (Exception e) {
            log.error("미완료 이벤트 재발행 스케줄러 실패", e);
        }
    }
}
