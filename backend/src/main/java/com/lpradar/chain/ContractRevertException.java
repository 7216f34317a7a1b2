package com.lpradar.chain;

/**
 * The node executed the call and the contract reverted. Not retried: the same call reverts again.
 */
public class ContractRevertException extends RpcException {

    public ContractRevertException(String message) {
        super(message);
    }
}
