package com.loanorigination.rules.domain;

import com.loanorigination.rules.Rule;
import com.loanorigination.rules.RuleEngine;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static com.loanorigination.rules.RuleAction.APPROVE;
import static com.loanorigination.rules.RuleAction.CONDITIONAL;
import static com.loanorigination.rules.RuleAction.FLAG;
import static com.loanorigination.rules.RuleAction.REJECT;
import static com.loanorigination.rules.Severity.CRITICAL;
import static com.loanorigination.rules.Severity.HIGH;
import static com.loanorigination.rules.Severity.LOW;
import static com.loanorigination.rules.Severity.MEDIUM;
import static com.loanorigination.rules.Severity.POSITIVE;

/**
 * Document, digital identity, age and screening rules.
 */
public final class KycRuleSet {

    public static final String ENGINE_NAME = "kyc";

    private static final Set<EmploymentType> SUPPORTED_EMPLOYMENT =
            EnumSet.of(EmploymentType.SALARIED, EmploymentType.SELF_EMPLOYED, EmploymentType.PROFESSIONAL);

    private KycRuleSet() {
    }

    public static RuleEngine<KycSnapshot> create(KycThresholds thresholds) {
        return new RuleEngine<>(ENGINE_NAME, rules(thresholds));
    }

    static List<Rule<KycSnapshot>> rules(KycThresholds t) {
        return List.of(
                Rule.of("KYC_001", "PAN Verified", APPROVE, POSITIVE, 20,
                        "PAN verified against the income tax database",
                        "pan_verified == true"),
                Rule.of("KYC_002", "PAN Not Verified", REJECT, CRITICAL, -40,
                        "PAN could not be verified",
                        "pan_verified != true"),
                Rule.of("KYC_003", "Aadhaar Verified", APPROVE, POSITIVE, 15,
                        "Aadhaar verified",
                        "aadhaar_verified == true"),
                Rule.of("KYC_004", "Aadhaar Pending", CONDITIONAL, MEDIUM, -5,
                        "Aadhaar verification pending, collect before disbursal",
                        "aadhaar_verified != true"),
                Rule.of("KYC_005", "DigiLocker Verified", APPROVE, POSITIVE, 10,
                        "Identity documents fetched from DigiLocker",
                        "digilocker_verified == true"),
                Rule.of("KYC_006", "Address Proof Missing", CONDITIONAL, MEDIUM, -5,
                        "Address proof not provided",
                        "address_proof_present == false"),
                Rule.of("KYC_007", "Below Minimum Age", REJECT, CRITICAL, -50,
                        "Applicant is younger than " + t.minAge(),
                        s -> s.age() != null && s.age() < t.minAge()),
                Rule.of("KYC_008", "Above Maximum Age", REJECT, HIGH, -50,
                        "Applicant is older than " + t.maxAge(),
                        s -> s.age() != null && s.age() > t.maxAge()),
                Rule.of("KYC_009", "Age Within Bounds", APPROVE, POSITIVE, 10,
                        "Applicant age within " + t.minAge() + "-" + t.maxAge(),
                        s -> s.age() != null && s.age() >= t.minAge() && s.age() <= t.maxAge()),
                Rule.of("KYC_010", "Unsupported Employment Type", FLAG, LOW, 0,
                        "Employment type outside standard categories",
                        s -> s.employmentType() != null && !SUPPORTED_EMPLOYMENT.contains(s.employmentType())),
                Rule.of("KYC_011", "Name Mismatch", CONDITIONAL, MEDIUM, -10,
                        "Name on PAN does not match the application",
                        "name_match == false"),
                Rule.of("KYC_012", "Sanctions List Match", REJECT, CRITICAL, -100,
                        "Applicant matches a sanctions list entry",
                        "sanctions_hit == true"),
                Rule.of("KYC_013", "AML Screening Not Clear", CONDITIONAL, MEDIUM, -10,
                        "AML screening pending or inconclusive",
                        "aml_clear != true && sanctions_hit != true"),
                Rule.of("KYC_014", "Politically Exposed Person", FLAG, MEDIUM, 0,
                        "Applicant is a politically exposed person, enhanced due diligence required",
                        "politically_exposed == true")
        );
    }
}
