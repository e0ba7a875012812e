package com.tradeledger.api.dto;

import com.tradeledger.api.validation.WalletAddress;

/**
 * Query parameters shared by the wallet endpoints: ?wallet=0x...&since=epochMillis.
 * since is an optional inclusive lower bound; absent = full history.
 */
public record LedgerQuery(
        @WalletAddress String wallet,
        Long since
) {
}
