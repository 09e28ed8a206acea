package com.loanorigination.repository;

import com.loanorigination.model.QualityReportRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface QualityReportRecordRepository extends JpaRepository<QualityReportRecord, Long> {

    Optional<QualityReportRecord> findFirstByApplicationIdOrderByCheckedAtDescIdDesc(String applicationId);

    List<QualityReportRecord> findByApplicationIdOrderByCheckedAtAscIdAsc(String applicationId);
}
