package kr.jemi.zseat.inventory.infrastructure.in.scheduler;

import kr.jemi.zseat.inventory.application.port.in.RepairSoldSeatsUseCase;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class LedgerRepairScheduler {

    private static final Logger log = LoggerFactory.getLogger(LedgerRepairScheduler.class);

    private final RepairSoldSeatsUseCase repairSoldSeatsUseCase;

    public LedgerRepairScheduler(RepairSoldSeatsUseCase repairSoldSeatsUseCase) {
        this.repairSoldSeatsUseCase = repairSoldSeatsUseCase;
    }

    @Scheduled(cron = "${zseat.ledger-repair.cron}")
    @SchedulerLock(name = "repairSoldSeatLedger",
            lockAtMostFor = "${zseat.ledger-repair.lock-at-most-for}",
            lockAtLeastFor = "${zseat.ledger-repair.lock-at-least-for}")
    public void repair() {
        try {
            repairSoldSeatsUseCase.repairUnrecordedSales();
        } catch (Exception e) {
            log.error("판매 원장 복구 스케줄러 실패", e);
        }
    }
}
