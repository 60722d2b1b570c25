package com.bit.locker.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

@Slf4j
@Data
@Component
@Order(0)
@ConfigurationProperties(prefix = "locker")
public class LockerConfig {
    private String administrator;//管理员地址 0x...
    private String tokenAddress;//代币账本地址
    private String stakeAddress;//质押账本地址
    private String vestingAddress;//归属账本地址
    private boolean bindOnStart = true;//启动时绑定 归属 -> 质押

    private Token token = new Token();

    @Data
    public static class Token {
        private String name = "Mateico";
        private String symbol = "MATE";
        private Integer decimals = 18;
        private BigInteger initialSupply = BigInteger.TEN.pow(27);//最小单位
    }

    @PostConstruct
    public void init() {
        log.info("管理员:{} 质押账本:{} 归属账本:{} 代币:{}({})",
                administrator, stakeAddress, vestingAddress, token.getName(), token.getSymbol());
    }
}
