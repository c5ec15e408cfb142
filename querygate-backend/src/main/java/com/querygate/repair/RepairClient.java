package com.querygate.repair;

/**
 * External service that rewrites a query the warehouse rejected.
 *
 * <p>Implementations are best-effort and total: on any internal failure they return
 * {@code brokenQuery} unchanged rather than throwing.
 */
public interface RepairClient {

    /**
     * Rewrite a failing query.
     *
     * @param brokenQuery query text that failed
     * @param errorMessage warehouse error for that query
     * @return corrected query text, or {@code brokenQuery} when no repair could be produced
     */
    String repair(String brokenQuery, String errorMessage);
}
