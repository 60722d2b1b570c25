package com.bit.locker.api;

import com.bit.locker.common.Address;
import com.bit.locker.common.PoolHash;
import com.bit.locker.result.Result;
import com.bit.locker.stake.StakeService;
import com.bit.locker.structure.dto.CreatePoolDTO;
import com.bit.locker.structure.stake.BridgeTarget;
import com.bit.locker.structure.stake.Pool;
import com.bit.locker.structure.stake.Position;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.List;

@Slf4j
@RestController
@RequestMapping("/stake")
public class StakeApi {

    @Autowired
    private StakeService stakeService;

    //管理员建池
    @PostMapping("/createPool")
    public Result<Pool> createPool(@RequestBody CreatePoolDTO dto) {
        return Result.OK(stakeService.createPool(Address.fromHex(dto.getCaller()), dto.getMinStake(), dto.getMaxStake(),
                dto.getStartTime(), dto.getEndTime(), dto.getRewardPermill(), dto.getLockPeriod(), dto.getMaxTotalStaked()));
    }

    //回收过期池
    @PostMapping("/reclaim")
    public Result<BigInteger> reclaim(@RequestParam String caller) {
        return Result.OK(stakeService.reclaimExpiredPools(Address.fromHex(caller)));
    }

    @PostMapping("/deposit")
    public Result<Position> deposit(@RequestParam String caller, @RequestParam int poolId, @RequestParam BigInteger amount) {
        return Result.OK(stakeService.deposit(Address.fromHex(caller), poolId, amount));
    }

    // 领取全部到期仓位
    @PostMapping("/claimAll")
    public Result<BigInteger> claimAll(@RequestParam String caller) {
        return Result.OK(stakeService.claimAll(Address.fromHex(caller)));
    }

    @PostMapping("/claimOne")
    public Result<BigInteger> claimOne(@RequestParam String caller, @RequestParam int index) {
        return Result.OK(stakeService.claimOne(Address.fromHex(caller), index));
    }

    @PostMapping("/bridgePool")
    public Result<BridgeTarget> updateBridgePool(@RequestParam String caller, @RequestParam int poolIndex) {
        return Result.OK(stakeService.updateBridgePool(Address.fromHex(caller), poolIndex));
    }

    @GetMapping("/pools")
    public Result<List<Pool>> pools() {
        return Result.OK(stakeService.getPools());
    }

    @GetMapping("/pool")
    public Result<Pool> pool(@RequestParam int index) {
        return Result.OK(stakeService.poolInfo(index));
    }

    // 按池哈希查下标，不存在返回 -1
    @GetMapping("/poolIndex")
    public Result<Integer> poolIndex(@RequestParam String poolHash) {
        return Result.OK(stakeService.poolIndexOf(PoolHash.fromHex(poolHash)).orElse(-1));
    }

    @GetMapping("/rewardsAvailable")
    public Result<BigInteger> rewardsAvailable() {
        return Result.OK(stakeService.rewardsAvailable());
    }

    @GetMapping("/totalStaked")
    public Result<BigInteger> totalStaked() {
        return Result.OK(stakeService.totalStakedTokens());
    }

    @GetMapping("/stakes")
    public Result<List<Position>> stakes(@RequestParam String user) {
        return Result.OK(stakeService.getUserStakes(Address.fromHex(user)));
    }

    @GetMapping("/claimable")
    public Result<BigInteger> claimable(@RequestParam String user) {
        return Result.OK(stakeService.claimable(Address.fromHex(user)));
    }

    @GetMapping("/stakedWithRewards")
    public Result<BigInteger> stakedWithRewards(@RequestParam String user) {
        return Result.OK(stakeService.stakedWithRewards(Address.fromHex(user)));
    }
}
