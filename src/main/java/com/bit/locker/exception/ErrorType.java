package com.bit.locker.exception;

/**
 * 账本层错误类型，desc 为对外暴露的原始拒绝信息
 */
public enum ErrorType {
    // 输入校验（调用方可修正）
    WRONG_POOL_INDEX(Category.INPUT, "Wrong pool index"),
    WRONG_STAKE_INDEX(Category.INPUT, "Wrong stake index"),
    WRONG_VEST_INDEX(Category.INPUT, "Wrong vest index"),
    POOL_MIN_STAKE(Category.INPUT, "Pool min stake per user"),
    POOL_MAX_STAKE(Category.INPUT, "Pool max stake per user"),
    POOL_IS_FULL(Category.INPUT, "Pool is full"),
    POOL_NOT_YET_OPEN(Category.INPUT, "Pool not yet open"),
    ALREADY_CLOSED(Category.INPUT, "Already closed"),
    ZERO_AMOUNT(Category.INPUT, "Zero amount"),
    ZERO_ADDRESS(Category.INPUT, "Zero address"),
    TIMESTAMPS_MISCONFIGURED(Category.INPUT, "Timestamps missconfigured"),
    STAKE_LIMITS_MISCONFIGURED(Category.INPUT, "Stake limits missconfigured"),
    START_DATE_IN_PAST(Category.INPUT, "startDate below current time"),
    START_AMOUNT_EXCEEDS_TOTAL(Category.INPUT, "startAmount above totalAmount"),

    // 状态前置条件
    NO_STAKES_FOR_CALLER(Category.STATE, "No stakes for user"),
    NO_LOCKS_FOR_CALLER(Category.STATE, "No locks for user"),
    NOTHING_TO_CLAIM(Category.STATE, "Nothing to claim"),
    NOTHING_TO_RECLAIM(Category.STATE, "Nothing to reclaim"),
    POOL_HASH_MISMATCH(Category.STATE, "Pool hash mismatch"),
    BRIDGE_POOL_NOT_SET(Category.STATE, "Claim2stake pool not set"),
    STAKE_CONTRACT_NOT_SET(Category.STATE, "Stake contract not set"),
    CONTRACT_ALREADY_SET(Category.STATE, "Contract already set"),
    COUNTERPART_MISMATCH(Category.STATE, "Stake contract points other vesting"),

    // 权限
    ONLY_ADMINISTRATOR(Category.AUTHORIZATION, "Only for Owner"),
    ONLY_PENDING_OWNER(Category.AUTHORIZATION, "Only newOwner"),
    ONLY_VESTING_CONTRACT(Category.AUTHORIZATION, "Only vesting contract"),
    LEDGER_ACCOUNT(Category.AUTHORIZATION, "Ledger escrow is not callable"),

    // 代币协作方失败
    TRANSFER_FAILED(Category.COLLABORATOR, "Token transfer failed");

    public enum Category {
        INPUT(400),
        STATE(409),
        AUTHORIZATION(403),
        COLLABORATOR(502);

        private final int code;

        Category(int code) {
            this.code = code;
        }

        public int getCode() {
            return code;
        }
    }

    private final Category category;
    private final String desc;

    ErrorType(Category category, String desc) {
        this.category = category;
        this.desc = desc;
    }

    public Category getCategory() {
        return category;
    }

    public String getDesc() {
        return desc;
    }
}
