package org.crmjobs.stats;

/**
 * Source of CRM-wide aggregates for the report job.
 */
public interface StatsFetcher {

    CrmStats getStats() throws FetchException;
}
