package com.loanorigination.quality;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

/**
 * Product limits per loan type. Unknown loan types fall back to the
 * personal loan policy.
 */
public enum LoanProductPolicy {
    PERSONAL_LOAN("personal_loan", 25_000, 650, 60, "10.0", "24.0", 84, Documents.STANDARD),
    HOME_LOAN("home_loan", 40_000, 700, 120, "7.0", "12.0", 360, Documents.PROPERTY),
    CAR_LOAN("car_loan", 30_000, 650, 80, "8.0", "15.0", 84, Documents.STANDARD),
    EDUCATION_LOAN("education_loan", 20_000, 600, 100, "8.5", "16.0", 180, Documents.STANDARD),
    BUSINESS_LOAN("business_loan", 50_000, 700, 80, "11.0", "20.0", 120, Documents.BUSINESS),
    LOAN_AGAINST_PROPERTY("loan_against_property", 35_000, 650, 100, "9.0", "16.0", 240, Documents.STANDARD);

    public record RequiredDocument(String type, String name, boolean mandatory) {
    }

    private static final class Documents {
        static final List<RequiredDocument> STANDARD = List.of(
                new RequiredDocument("identity_proof", "Identity Proof", true),
                new RequiredDocument("address_proof", "Address Proof", true),
                new RequiredDocument("income_proof", "Income Proof", true),
                new RequiredDocument("bank_statement", "Bank Statement", true));

        // GST returns are requested but a missing one only warns
        static final List<RequiredDocument> BUSINESS = List.of(
                new RequiredDocument("identity_proof", "Identity Proof", true),
                new RequiredDocument("address_proof", "Address Proof", true),
                new RequiredDocument("income_proof", "Income Proof", true),
                new RequiredDocument("bank_statement", "Bank Statement", true),
                new RequiredDocument("gst_returns", "GST Returns", false));

        static final List<RequiredDocument> PROPERTY = List.of(
                new RequiredDocument("identity_proof", "Identity Proof", true),
                new RequiredDocument("address_proof", "Address Proof", true),
                new RequiredDocument("income_proof", "Income Proof", true),
                new RequiredDocument("bank_statement", "Bank Statement", true),
                new RequiredDocument("property_documents", "Property Documents", true),
                new RequiredDocument("property_valuation", "Property Valuation", true));
    }

    private final String value;
    private final BigDecimal minMonthlyIncome;
    private final int minCreditScore;
    private final BigDecimal incomeMultiple;
    private final BigDecimal minInterestRate;
    private final BigDecimal maxInterestRate;
    private final int maxTenureMonths;
    private final List<RequiredDocument> requiredDocuments;

    LoanProductPolicy(String value, long minMonthlyIncome, int minCreditScore, int incomeMultiple,
                      String minInterestRate, String maxInterestRate, int maxTenureMonths,
                      List<RequiredDocument> requiredDocuments) {
        this.value = value;
        this.minMonthlyIncome = BigDecimal.valueOf(minMonthlyIncome);
        this.minCreditScore = minCreditScore;
        this.incomeMultiple = BigDecimal.valueOf(incomeMultiple);
        this.minInterestRate = new BigDecimal(minInterestRate);
        this.maxInterestRate = new BigDecimal(maxInterestRate);
        this.maxTenureMonths = maxTenureMonths;
        this.requiredDocuments = requiredDocuments;
    }

    public static LoanProductPolicy forLoanType(String loanType) {
        if (loanType != null) {
            String normalized = loanType.trim().toLowerCase(Locale.ROOT);
            for (LoanProductPolicy policy : values()) {
                if (policy.value.equals(normalized)) {
                    return policy;
                }
            }
        }
        return PERSONAL_LOAN;
    }

    public String getValue() {
        return value;
    }

    public BigDecimal getMinMonthlyIncome() {
        return minMonthlyIncome;
    }

    public int getMinCreditScore() {
        return minCreditScore;
    }

    /**
     * Largest amount the policy allows for the given monthly income.
     */
    public BigDecimal maxLoanAmount(BigDecimal monthlyIncome) {
        return monthlyIncome.multiply(incomeMultiple);
    }

    public boolean isRateWithinRange(BigDecimal rate) {
        return rate.compareTo(minInterestRate) >= 0 && rate.compareTo(maxInterestRate) <= 0;
    }

    public BigDecimal getMinInterestRate() {
        return minInterestRate;
    }

    public BigDecimal getMaxInterestRate() {
        return maxInterestRate;
    }

    public int getMaxTenureMonths() {
        return maxTenureMonths;
    }

    public List<RequiredDocument> getRequiredDocuments() {
        return requiredDocuments;
    }
}
