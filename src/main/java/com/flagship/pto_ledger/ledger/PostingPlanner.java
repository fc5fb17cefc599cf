package com.flagship.pto_ledger.ledger;

import java.util.List;

/**
 * Decides what to post once the balance is locked.
 *
 * Writers whose amounts depend on the current balance (bank cap clamping, carryover,
 * expiration) compute them here, against the locked snapshot, rather than from an earlier read.
 */
@FunctionalInterface
public interface PostingPlanner {

    List<LedgerPosting> plan(BalanceSnapshot locked);
}
