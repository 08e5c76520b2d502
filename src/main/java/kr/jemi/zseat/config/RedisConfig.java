package kr.jemi.zseat.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.scripting.support.ResourceScriptSource;

@Configuration
public class RedisConfig {

    @Bean
    public DefaultRedisScript<Long> acquireHoldScript() {
        return script("scripts/acquire-hold.lua", Long.class);
    }

    @Bean
    public DefaultRedisScript<Long> releaseHoldScript() {
        return script("scripts/release-hold.lua", Long.class);
    }

    @Bean
    public DefaultRedisScript<Long> extendHoldScript() {
        return script("scripts/extend-hold.lua", Long.class);
    }

    @Bean
    public DefaultRedisScript<Long> expireHoldsScript() {
        return script("scripts/expire-holds.lua", Long.class);
    }

    @Bean
    public DefaultRedisScript<String> commitSaleScript() {
        return script("scripts/commit-sale.lua", String.class);
    }

    private static <T> DefaultRedisScript<T> script(String path, Class<T> resultType) {
        DefaultRedisScript<T> script = new DefaultRedisScript<>();
        script.setScriptSource(new ResourceScriptSource(new ClassPathResource(path)));
        script.setResultType(resultType);
        return script;
    }
}
