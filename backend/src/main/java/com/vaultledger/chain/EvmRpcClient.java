package com.vaultledger.chain;

import reactor.core.publisher.Mono;

/**
 * EVM JSON-RPC transport. Retries and endpoint rotation are handled by {@link EvmContractReader}.
 */
public interface EvmRpcClient {

    /**
     * Perform a single JSON-RPC call.
     *
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "eth_call"
     * @param params      method params
     * @return response body (JSON); errors with {@link RpcException} on HTTP failure
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}
