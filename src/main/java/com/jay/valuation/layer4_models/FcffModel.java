package com.jay.valuation.layer4_models;

import com.jay.valuation.model.NormalizedMetrics;
import com.jay.valuation.model.ValuationAssumptions;
import com.jay.valuation.model.enums.ModelType;
import org.springframework.stereotype.Component;

import java.util.OptionalDouble;

/**
 * Free cash flow to the firm, discounted at WACC. Same build-up as FCFE with after-tax
 * interest in place of net borrowing.
 */
@Component
public class FcffModel extends DiscountedCashFlowModel {

    @Override
    public ModelType type() {
        return ModelType.FCFF;
    }

    @Override
    protected OptionalDouble baseCashFlow(NormalizedMetrics m, ValuationAssumptions a) {
        OptionalDouble netIncome = CashFlowInputs.netIncome(m);
        if (netIncome.isEmpty()) return OptionalDouble.empty();
        return OptionalDouble.of(netIncome.getAsDouble()
            + CashFlowInputs.nonCashCharges(m)
            + CashFlowInputs.afterTaxInterest(m, a.getTaxRate())
            - CashFlowInputs.workingCapitalChange(m)
            + CashFlowInputs.fixedCapitalInvestment(m));
    }

    @Override
    protected double discountRate(ValuationAssumptions a) {
        return a.getWacc();
    }

    @Override
    protected String discountRateName() {
        return "wacc";
    }
}
