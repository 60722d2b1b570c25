package com.bit.locker.structure.stake;

import com.bit.locker.common.PoolHash;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 归属合约代存的目标池：记住下标和当时的池哈希
 */
@Getter
@ToString
@EqualsAndHashCode
public class BridgeTarget {

    private final int poolIndex;

    private final PoolHash poolHash;

    public BridgeTarget(int poolIndex, PoolHash poolHash) {
        this.poolIndex = poolIndex;
        this.poolHash = poolHash;
    }
}
