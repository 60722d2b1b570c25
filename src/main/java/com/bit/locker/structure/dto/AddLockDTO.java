package com.bit.locker.structure.dto;

import lombok.Data;

import java.math.BigInteger;

@Data
public class AddLockDTO {
    private String caller;
    private String beneficiary;
    private BigInteger startAmount;
    private BigInteger totalAmount;
    private long startDate;
    private long endDate;
}
