package com.payment.guard.persistence.service;

import com.payment.guard.domain.UserAccount;
import com.payment.guard.persistence.repository.UserAccountRepository;
import com.payment.guard.risk.history.AccountDirectory;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Account directory over the storefront's {@code user_accounts} table.
 */
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "guard.sink.type", havingValue = "jpa", matchIfMissing = true)
public class JpaAccountDirectory implements AccountDirectory {

    private final UserAccountRepository accountRepository;

    @Override
    public Optional<UserAccount> find(String userId) {
        if (userId == null) {
            return Optional.empty();
        }
        return accountRepository.findById(userId)
                .map(entity -> UserAccount.builder()
                        .userId(entity.getUserId())
                        .role(entity.getRole())
                        .createdAt(entity.getCreatedAt())
                        .build());
    }
}
