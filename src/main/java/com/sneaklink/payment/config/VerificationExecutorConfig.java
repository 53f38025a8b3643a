package com.sneaklink.payment.config;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 閘道查詢線程池
 *
 * PaymentVerificationCoordinator 把閘道呼叫丟到這裡，自己用 Future.get(deadline) 控制逾時。
 * - coreSize=4 / maxSize=16：驗證是短請求，同 reference 會合併
 * - SynchronousQueue + AbortPolicy：滿載時直接拒絕，由協調器當成暫時性錯誤在期限內退避重試。
 *   不能用 CallerRunsPolicy，呼叫者自己跑閘道呼叫就沒有 Future 可以限時。
 */
@Slf4j
@Configuration
public class VerificationExecutorConfig {

    private ExecutorService gatewayExecutor;

    @Bean(name = "gatewayExecutor")
    public ExecutorService gatewayExecutor() {
        AtomicInteger seq = new AtomicInteger();
        this.gatewayExecutor = new ThreadPoolExecutor(
                4,
                16,
                60L, TimeUnit.SECONDS,
                new SynchronousQueue<>(),
                r -> {
                    Thread t = new Thread(r, "gateway-" + seq.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy()
        );
        log.info("閘道查詢線程池已初始化: core=4, max=16, keepAlive=60s");
        return this.gatewayExecutor;
    }

    @PreDestroy
    public void shutdown() {
        if (gatewayExecutor != null) {
            log.info("正在關閉閘道查詢線程池...");
            gatewayExecutor.shutdown();
            try {
                if (!gatewayExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                    log.warn("線程池未在 10 秒內關閉，強制終止");
                    gatewayExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                gatewayExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("閘道查詢線程池已關閉");
        }
    }
}
