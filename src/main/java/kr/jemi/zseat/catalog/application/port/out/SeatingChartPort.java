package kr.jemi.zseat.catalog.application.port.out;

import kr.jemi.zseat.catalog.domain.EventOverrides;
import kr.jemi.zseat.catalog.domain.SeatingChart;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

public interface SeatingChartPort {

    Optional<SeatingChart> findChart(long chartId);

    EventOverrides findOverrides(long eventId, long chartId);

    /**
     * 좌석 ID로 소속 배치도 ID를 찾는다. 없는 좌석은 결과 맵에 포함되지 않는다.
     */
    Map<Long, Long> findChartIds(Collection<Long> seatIds);
}
