package com.querygate.repair;

/**
 * Repair client used when no repair gateway is configured. Always returns the input, so a logic
 * error is retried unchanged until the repair budget is spent.
 */
public class NoOpRepairClient implements RepairClient {

    @Override
    public String repair(String brokenQuery, String errorMessage) {
        return brokenQuery;
    }
}
