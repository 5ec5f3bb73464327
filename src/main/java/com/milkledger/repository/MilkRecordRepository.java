package com.milkledger.repository;

import com.milkledger.domain.MilkRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for MilkRecord entity.
 *
 * Every finder takes the owning user id. There is no query that
 * reaches a record by id alone, so one user can never read or change another
 * user's deliveries through this interface.
 *
 * Ordering is not imposed here; MonthlyReportCalculator sorts records.
 */
@Repository
public interface MilkRecordRepository extends JpaRepository<MilkRecord, Long> {

    /**
     * All records owned by a user, in no particular order.
     *
     * Backed by idx_milk_user_id.
     */
    List<MilkRecord> findByUserId(Long userId);

    /**
     * A single record, only if it belongs to the given user.
     *
     * @return empty when the record does not exist or has another owner
     */
    Optional<MilkRecord> findByIdAndUserId(Long id, Long userId);
}
