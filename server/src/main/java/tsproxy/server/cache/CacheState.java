package tsproxy.server.cache;

/**
 * Freshness of a query's cached data, decided once per request.
 */
public enum CacheState {

    /** nothing cached for the query */
    COLD,
    /** cached and within the staleness threshold */
    HOT,
    /** cached but stale, only the delta is fetched */
    WARM

}
