package com.work.almanac;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Spring Boot 启动入口：按 indexer.chains 为每条链启动摄取循环，状态与消息通过 REST 轮询。
 */
@SpringBootApplication
@EnableScheduling
public class AlmanacIndexerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AlmanacIndexerApplication.class, args);
    }
}
