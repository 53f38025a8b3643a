package com.sneaklink.shared.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 時鐘注入
 *
 * 所有「現在時間」都從這個 Clock 取得，測試時換成 Clock.fixed / 可推進的時鐘。
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
