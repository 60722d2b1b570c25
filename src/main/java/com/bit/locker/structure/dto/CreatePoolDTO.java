package com.bit.locker.structure.dto;

import lombok.Data;

import java.math.BigInteger;

@Data
public class CreatePoolDTO {
    private String caller;
    private BigInteger minStake;
    private BigInteger maxStake;
    private long startTime;
    private long endTime;
    private long rewardPermill;
    private long lockPeriod;
    private BigInteger maxTotalStaked;
}
