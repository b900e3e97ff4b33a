package com.flamingo.ai.distillate.domain.repository;

import com.flamingo.ai.distillate.domain.entity.Report;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Report entities. */
@Repository
public interface ReportRepository extends JpaRepository<Report, Long> {

  /** Finds the most recently generated report. */
  Optional<Report> findFirstByOrderByGeneratedAtDescIdDesc();
}
