package com.work.orderlock;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Spring Boot 启动入口：订单编辑锁服务（acquire / renew / release / inspect + 过期清理）。
 */
@SpringBootApplication
@EnableScheduling
@MapperScan("com.work.orderlock.repository.mapper")
public class OrderLockApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrderLockApplication.class, args);
    }
}
