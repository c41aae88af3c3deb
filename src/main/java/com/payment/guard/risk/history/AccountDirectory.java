package com.payment.guard.risk.history;

import com.payment.guard.domain.UserAccount;

import java.util.Optional;

/**
 * Read-only view of storefront accounts: role and creation time per user.
 */
public interface AccountDirectory {

    Optional<UserAccount> find(String userId);
}
