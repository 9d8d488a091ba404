package com.flagship.bill_settlement.settlement;

import com.flagship.bill_settlement.trace.ReasoningTrace;
import lombok.Value;

import java.util.List;

/**
 * Everything one run of {@link SettlementEngine#settle} produces. The engine
 * always returns the verdict with the settlement; callers decide whether to
 * reject an invalid one.
 */
@Value
public class SettlementOutcome {
    Settlement settlement;
    ReasoningTrace trace;
    ValidationResult validationResult;
    List<ReconciliationWarning> warnings;
}
