package com.loanorigination.rules.domain;

import com.loanorigination.rules.RuleSnapshot;
import lombok.Builder;

import java.util.Map;

/**
 * Identity and screening facts gathered for KYC. Unset fields are unknown.
 */
@Builder
public record KycSnapshot(
        Integer age,
        Boolean panVerified,
        Boolean aadhaarVerified,
        Boolean digilockerVerified,
        Boolean addressProofPresent,
        Boolean nameMatch,
        EmploymentType employmentType,
        Boolean amlClear,
        Boolean sanctionsHit,
        Boolean politicallyExposed
) implements RuleSnapshot {

    @Override
    public Map<String, Object> fields() {
        return SnapshotFields.builder()
                .put("age", age)
                .put("pan_verified", panVerified)
                .put("aadhaar_verified", aadhaarVerified)
                .put("digilocker_verified", digilockerVerified)
                .put("address_proof_present", addressProofPresent)
                .put("name_match", nameMatch)
                .put("employment_type", employmentType)
                .put("aml_clear", amlClear)
                .put("sanctions_hit", sanctionsHit)
                .put("politically_exposed", politicallyExposed)
                .build();
    }
}
