package com.labbackup.api.model.entity;

import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Grandfather-father-son tier counts. Each value is "keep this many"; 0 disables the tier.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetentionConfig {

    @Min(0)
    private int daily;

    @Min(0)
    private int weekly;

    @Min(0)
    private int monthly;

    @Min(0)
    private int yearly;

    public static RetentionConfig of(int daily, int weekly, int monthly, int yearly) {
        return new RetentionConfig(daily, weekly, monthly, yearly);
    }

    /**
     * Tier-wise maximum of two configs. Used when several schedules protect the same source.
     */
    public RetentionConfig union(RetentionConfig other) {
        if (other == null) {
            return this;
        }
        return new RetentionConfig(
                Math.max(daily, other.daily),
                Math.max(weekly, other.weekly),
                Math.max(monthly, other.monthly),
                Math.max(yearly, other.yearly));
    }

    public void validate() {
        if (daily < 0 || weekly < 0 || monthly < 0 || yearly < 0) {
            throw new IllegalArgumentException("Retention counts must be >= 0");
        }
    }
}
