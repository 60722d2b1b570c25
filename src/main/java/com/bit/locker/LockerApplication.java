package com.bit.locker;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@Slf4j
@SpringBootApplication(scanBasePackages = "com.bit.locker")
public class LockerApplication {
    public static void main(String[] args) {
        SpringApplication.run(LockerApplication.class, args);
        log.info("锁仓账本服务已启动");
    }
    //金额统一为最小单位整数，时间统一为秒
}
