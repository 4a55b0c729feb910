package com.resellerhub.credits.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables bound from the {@code credit-ledger.*} namespace.
 */
@Data
@ConfigurationProperties(prefix = "credit-ledger")
public class LedgerProperties {

    private Transfer transfer = new Transfer();
    private Pagination pagination = new Pagination();

    @Data
    public static class Transfer {
        /**
         * Upper bound for one transfer unit, lock waits included. Exceeding it rolls the
         * unit back and reports a transient failure.
         */
        private int timeoutSeconds = 5;
    }

    @Data
    public static class Pagination {
        private int defaultPageSize = 100;
        private int maxPageSize = 1000;

        public int clamp(Integer requested) {
            if (requested == null || requested < 1) {
                return defaultPageSize;
            }
            return Math.min(requested, maxPageSize);
        }
    }
}
