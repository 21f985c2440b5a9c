package com.jay.valuation.layer4_models;

import com.jay.valuation.model.NormalizedMetrics;
import com.jay.valuation.model.ValuationAssumptions;
import com.jay.valuation.model.enums.ModelType;
import org.springframework.stereotype.Component;

import java.util.OptionalDouble;

/**
 * Free cash flow to equity, discounted at the cost of equity.
 * fcfe = net income + non-cash charges + net borrowing − Δworking capital + fixed capital investment
 */
@Component
public class FcfeModel extends DiscountedCashFlowModel {

    @Override
    public ModelType type() {
        return ModelType.FCFE;
    }

    @Override
    protected OptionalDouble baseCashFlow(NormalizedMetrics m, ValuationAssumptions a) {
        OptionalDouble netIncome = CashFlowInputs.netIncome(m);
        if (netIncome.isEmpty()) return OptionalDouble.empty();
        return OptionalDouble.of(netIncome.getAsDouble()
            + CashFlowInputs.nonCashCharges(m)
            + CashFlowInputs.netBorrowing(m)
            - CashFlowInputs.workingCapitalChange(m)
            + CashFlowInputs.fixedCapitalInvestment(m));
    }

    @Override
    protected double discountRate(ValuationAssumptions a) {
        return a.getCostOfEquity();
    }

    @Override
    protected String discountRateName() {
        return "cost_of_equity";
    }
}
