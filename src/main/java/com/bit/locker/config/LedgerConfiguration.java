package com.bit.locker.config;

import com.bit.locker.common.Address;
import com.bit.locker.event.impl.MemoryEventLog;
import com.bit.locker.owner.impl.SingleOwner;
import com.bit.locker.stake.StakeService;
import com.bit.locker.stake.impl.StakeServiceImpl;
import com.bit.locker.token.impl.MemoryTokenLedger;
import com.bit.locker.vesting.VestingService;
import com.bit.locker.vesting.impl.VestingServiceImpl;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 账本装配：一个代币账本、一个质押账本、一个归属账本
 */
@Slf4j
@Configuration
public class LedgerConfiguration {

    @Autowired
    private LockerConfig config;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MemoryEventLog eventLog() {
        return new MemoryEventLog();
    }

    @Bean
    public SingleOwner administration() {
        return new SingleOwner(resolve(config.getAdministrator(), "administrator"));
    }

    @Bean
    public MemoryTokenLedger tokenLedger() {
        LockerConfig.Token token = config.getToken();
        return new MemoryTokenLedger(resolve(config.getTokenAddress(), "token"), token.getName(), token.getSymbol(),
                token.getDecimals(), resolve(config.getAdministrator(), "administrator"), token.getInitialSupply());
    }

    @Bean
    public StakeService stakeService(MemoryTokenLedger tokenLedger, SingleOwner administration,
                                     MemoryEventLog eventLog, Clock clock) {
        return new StakeServiceImpl(resolve(config.getStakeAddress(), "stake"), tokenLedger,
                resolve(config.getVestingAddress(), "vesting"), administration, eventLog, clock);
    }

    @Bean
    public VestingService vestingService(MemoryTokenLedger tokenLedger, SingleOwner administration,
                                         MemoryEventLog eventLog, Clock clock, StakeService stakeService) {
        VestingServiceImpl vesting = new VestingServiceImpl(resolve(config.getVestingAddress(), "vesting"),
                tokenLedger, administration, eventLog, clock);
        if (config.isBindOnStart()) {
            vesting.setStakeAddress(administration.owner(), stakeService);
        }
        return vesting;
    }

    // 未配置时由角色名派生固定地址
    private static Address resolve(String hex, String role) {
        if (hex == null || hex.isBlank()) {
            Address derived = Address.derive("locker." + role);
            log.info("{} 地址未配置，使用派生地址 {}", role, derived);
            return derived;
        }
        return Address.fromHex(hex);
    }
}
