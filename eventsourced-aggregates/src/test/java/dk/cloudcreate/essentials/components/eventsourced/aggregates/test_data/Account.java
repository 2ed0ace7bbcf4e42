package dk.cloudcreate.essentials.components.eventsourced.aggregates.test_data;

import dk.cloudcreate.essentials.components.eventsourced.aggregates.EventDrivenStateMachine;
import dk.cloudcreate.essentials.components.eventsourced.aggregates.test_data.AccountEvents.*;

import java.math.BigDecimal;
import java.util.UUID;

import static dk.cloudcreate.essentials.shared.FailFast.*;

public class Account extends EventDrivenStateMachine {
    private String     owner;
    private BigDecimal balance = BigDecimal.ZERO;

    public Account() {
        register(AccountOpened.class, e -> {
            initializeAggregateId(e.getAccountId());
            owner = e.getOwner();
            balance = BigDecimal.ZERO;
        });
        register(AmountDeposited.class, e -> balance = balance.add(e.getAmount()));
        register(AmountWithdrawn.class, e -> balance = balance.subtract(e.getAmount()));
    }

    public Account(UUID accountId, String owner) {
        this();
        requireNonNull(accountId, "No accountId provided");
        requireNonNull(owner, "No owner provided");
        raise(new AccountOpened(accountId, owner));
    }

    public void deposit(BigDecimal amount) {
        requireTrue(amount.signum() > 0, "amount must be positive");
        raise(new AmountDeposited(amount));
    }

    public void withdraw(BigDecimal amount) {
        requireTrue(amount.signum() > 0, "amount must be positive");
        if (balance.compareTo(amount) < 0) {
            throw new IllegalStateException("Insufficient funds");
        }
        raise(new AmountWithdrawn(amount));
    }

    public void freeze() {
        raise(new AccountFrozen());
    }

    public String owner() {
        return owner;
    }

    public BigDecimal balance() {
        return balance;
    }
}
