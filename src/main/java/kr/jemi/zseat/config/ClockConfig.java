package kr.jemi.zseat.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 선점 만료 판단은 모두 이 Clock을 기준으로 한다. 테스트에서는 시각을 직접 옮길 수 있는 Clock으로 교체한다.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
