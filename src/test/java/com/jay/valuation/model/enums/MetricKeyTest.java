package com.jay.valuation.model.enums;

import com.jay.valuation.model.FinancialStatements;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class MetricKeyTest {

    private Locale saved;

    @BeforeEach
    void useTurkishLocale() {
        saved = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
    }

    @AfterEach
    void restoreLocale() {
        Locale.setDefault(saved);
    }

    @Test
    void canonicalNamesResolveRegardlessOfDefaultLocale() {
        assertThat(MetricKey.fromCanonicalName(" NET_INCOME_TTM ")).contains(MetricKey.NET_INCOME_TTM);
        assertThat(MetricKey.fromCanonicalName("DIVIDEND_PER_SHARE")).contains(MetricKey.DIVIDEND_PER_SHARE);
    }

    @Test
    void unknownNamesAreEmpty() {
        assertThat(MetricKey.fromCanonicalName("price_to_sales")).isEmpty();
        assertThat(MetricKey.fromCanonicalName(null)).isEmpty();
    }

    @Test
    void statementSymbolsUpperCaseRegardlessOfDefaultLocale() {
        assertThat(new FinancialStatements("vib", null, null, null).symbol())
            .isEqualTo("VIB");
    }
}
