package dk.cloudcreate.essentials.components.eventsourced.aggregates.test_data;

import java.math.BigDecimal;
import java.util.UUID;

public final class AccountEvents {
    public static class AccountOpened {
        private UUID   accountId;
        private String owner;

        public AccountOpened() {
        }

        public AccountOpened(UUID accountId, String owner) {
            this.accountId = accountId;
            this.owner = owner;
        }

        public UUID getAccountId() {
            return accountId;
        }

        public String getOwner() {
            return owner;
        }
    }

    public static class AmountDeposited {
        private BigDecimal amount;

        public AmountDeposited() {
        }

        public AmountDeposited(BigDecimal amount) {
            this.amount = amount;
        }

        public BigDecimal getAmount() {
            return amount;
        }
    }

    public static class AmountWithdrawn {
        private BigDecimal amount;

        public AmountWithdrawn() {
        }

        public AmountWithdrawn(BigDecimal amount) {
            this.amount = amount;
        }

        public BigDecimal getAmount() {
            return amount;
        }
    }

    /**
     * Not registered by {@link Account}
     */
    public static class AccountFrozen {
        public AccountFrozen() {
        }
    }
}
