package com.tpcc.gateway.service.tpcc;

import com.tpcc.gateway.domain.ErrorKind;
import com.tpcc.gateway.domain.TransactionPhase;

/**
 * Common view of the five protocol outcomes, used by the REST layer to pick
 * a status code.
 */
public interface ProtocolOutcome {

    boolean success();

    TransactionPhase phase();

    /** Null on success. */
    ErrorKind errorKind();

    String error();
}
