package com.bit.locker.owner;

import com.bit.locker.common.Address;

/**
 * 管理员权限判定
 */
public interface Administration {

    boolean isAdministrator(Address caller);
}
