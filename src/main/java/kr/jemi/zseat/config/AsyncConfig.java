package kr.jemi.zseat.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.List;

/**
 * 비동기 리스너에서 빠져나온 예외를 로그로 남긴다.
 * 판매 원장 리스너가 실패한 판매는 미완료 이벤트 재발행과 원장 복구 작업이 다시 기록하므로 여기서는 기록만 한다.
 */
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    private static final Logger log = LoggerFactory.getLogger(AsyncConfig.class);

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return AsyncConfig::logFailure;
    }

    static void logFailure(Throwable ex, Method method, Object... params) {
        List<String> paramTypes = Arrays.stream(params)
                .map(param -> param == null ? "null" : param.getClass().getSimpleName())
                .toList();
        // 이벤트 record의 toString에 주문 ID와 좌석 목록이 들어 있다
        log.error("비동기 리스너 실패, 재발행 대기: listener={}.{}, paramTypes={}, params={}",
                method.getDeclaringClass().getSimpleName(), method.getName(), paramTypes,
                Arrays.toString(params), ex);
    }
}
