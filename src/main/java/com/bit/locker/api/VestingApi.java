package com.bit.locker.api;

import com.bit.locker.common.Address;
import com.bit.locker.result.Result;
import com.bit.locker.structure.dto.AddLockDTO;
import com.bit.locker.structure.vesting.Vest;
import com.bit.locker.vesting.VestingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.List;

@Slf4j
@RestController
@RequestMapping("/vesting")
public class VestingApi {

    @Autowired
    private VestingService vestingService;

    //管理员新增授予
    @PostMapping("/addLock")
    public Result<Vest> addLock(@RequestBody AddLockDTO dto) {
        return Result.OK(vestingService.addLock(Address.fromHex(dto.getCaller()), Address.fromHex(dto.getBeneficiary()),
                dto.getStartAmount(), dto.getTotalAmount(), dto.getStartDate(), dto.getEndDate()));
    }

    @PostMapping("/claim")
    public Result<BigInteger> claim(@RequestParam String caller) {
        return Result.OK(vestingService.claimAll(Address.fromHex(caller)));
    }

    //领取后直接质押
    @PostMapping("/claim2stake")
    public Result<BigInteger> claim2stake(@RequestParam String caller) {
        return Result.OK(vestingService.claim2stake(Address.fromHex(caller)));
    }

    @GetMapping("/vestings")
    public Result<List<Vest>> vestings(@RequestParam String user) {
        return Result.OK(vestingService.getVestings(Address.fromHex(user)));
    }

    @GetMapping("/claimable")
    public Result<BigInteger> claimable(@RequestParam String user) {
        return Result.OK(vestingService.claimable(Address.fromHex(user)));
    }

    @GetMapping("/balance")
    public Result<BigInteger> balance(@RequestParam String user) {
        return Result.OK(vestingService.balanceOf(Address.fromHex(user)));
    }

    @GetMapping("/vested")
    public Result<BigInteger> vested() {
        return Result.OK(vestingService.vested());
    }
}
