package com.bit.locker.api;

import com.bit.locker.common.Address;
import com.bit.locker.exception.ErrorType;
import com.bit.locker.exception.LedgerException;
import com.bit.locker.result.Result;
import com.bit.locker.stake.StakeService;
import com.bit.locker.token.TokenLedger;
import com.bit.locker.vesting.VestingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;

@Slf4j
@RestController
@RequestMapping("/token")
public class TokenApi {

    @Autowired
    private TokenLedger tokenLedger;

    @Autowired
    private StakeService stakeService;

    @Autowired
    private VestingService vestingService;

    @GetMapping("/balance")
    public Result<BigInteger> balance(@RequestParam String owner) {
        return Result.OK(tokenLedger.balanceOf(Address.fromHex(owner)));
    }

    @GetMapping("/allowance")
    public Result<BigInteger> allowance(@RequestParam String owner, @RequestParam String spender) {
        return Result.OK(tokenLedger.allowance(Address.fromHex(owner), Address.fromHex(spender)));
    }

    @PostMapping("/approve")
    public Result<Boolean> approve(@RequestParam String caller, @RequestParam String spender, @RequestParam BigInteger amount) {
        Address from = Address.fromHex(caller);
        rejectLedgerAccount(from);
        return Result.OK(tokenLedger.approve(from, Address.fromHex(spender), amount));
    }

    @PostMapping("/transfer")
    public Result<Boolean> transfer(@RequestParam String caller, @RequestParam String to, @RequestParam BigInteger amount) {
        Address from = Address.fromHex(caller);
        rejectLedgerAccount(from);
        if (!tokenLedger.transfer(from, Address.fromHex(to), amount)) {
            throw new LedgerException(ErrorType.TRANSFER_FAILED, "转账 " + amount + " 至 " + to);
        }
        return Result.OK(true);
    }

    // 托管账户只能由账本自身动用
    private void rejectLedgerAccount(Address caller) {
        if (caller.equals(stakeService.address()) || caller.equals(vestingService.address())) {
            log.warn("拒绝以账本托管账户 {} 发起操作", caller);
            throw new LedgerException(ErrorType.LEDGER_ACCOUNT, "caller=" + caller);
        }
    }
}
