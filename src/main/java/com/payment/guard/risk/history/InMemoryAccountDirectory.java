package com.payment.guard.risk.history;

import com.payment.guard.domain.UserAccount;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Account directory for the memory sink. Accounts are registered programmatically; unknown users get
 * the unknown-account daily limit and never the new_user factor.
 */
@Component
@ConditionalOnProperty(name = "guard.sink.type", havingValue = "memory")
public class InMemoryAccountDirectory implements AccountDirectory {

    private final Map<String, UserAccount> accounts = new ConcurrentHashMap<>();

    public void register(UserAccount account) {
        accounts.put(account.getUserId(), account);
    }

    @Override
    public Optional<UserAccount> find(String userId) {
        return userId == null ? Optional.empty() : Optional.ofNullable(accounts.get(userId));
    }
}
