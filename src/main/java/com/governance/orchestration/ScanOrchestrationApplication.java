package com.governance.orchestration;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 扫描规则编排服务启动类
 */
@SpringBootApplication
@EnableScheduling
public class ScanOrchestrationApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScanOrchestrationApplication.class, args);
    }
}
