package org.crmjobs.stats;

import java.math.BigDecimal;
import java.util.Objects;

public record CrmStats(long customerCount, long orderCount, BigDecimal totalRevenue) {

    public CrmStats {
        Objects.requireNonNull(totalRevenue, "totalRevenue");
    }
}
