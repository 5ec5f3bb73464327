package com.milkledger.service;

import com.milkledger.domain.MilkRecord;
import com.milkledger.repository.MilkRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Per-user CRUD for milk delivery records.
 *
 * OWNERSHIP:
 *   Every operation takes the owning user id and looks records up with
 *   findByIdAndUserId. A record owned by someone else is reported exactly
 *   like a missing one (404), so ids of other users' records are not revealed.
 *
 * Quantity rules (present, non-negative) live in MilkRecord itself.
 */
@Service
@Transactional
public class MilkRecordService {

    private static final Logger log = LoggerFactory.getLogger(MilkRecordService.class);

    private final MilkRecordRepository recordRepository;
    private final Clock                clock;

    public MilkRecordService(MilkRecordRepository recordRepository, Clock clock) {
        this.recordRepository = recordRepository;
        this.clock            = clock;
    }

    /**
     * Record a delivery.
     *
     * @param date delivery day; today (per the injected clock) when null
     * @throws IllegalArgumentException if quantity is null or negative
     */
    public MilkRecord create(Long userId, LocalDate date, BigDecimal quantity) {
        LocalDate day = date != null ? date : LocalDate.now(clock);
        MilkRecord record = recordRepository.save(new MilkRecord(userId, day, quantity));
        log.info("✓ Milk record created - recordId={}, userId={}, date={}, quantity={}",
                record.getId(), userId, day, quantity);
        return record;
    }

    /**
     * @throws NoSuchElementException if the record does not exist or belongs to another user
     */
    @Transactional(readOnly = true)
    public MilkRecord get(Long userId, Long recordId) {
        return recordRepository.findByIdAndUserId(recordId, userId)
                .orElseThrow(() -> new NoSuchElementException("Record not found: " + recordId));
    }

    /** All of the user's records, unordered. */
    @Transactional(readOnly = true)
    public List<MilkRecord> listAll(Long userId) {
        return recordRepository.findByUserId(userId);
    }

    /**
     * Change date and/or quantity. Null arguments keep the current value.
     *
     * @throws NoSuchElementException   if the record does not exist or belongs to another user
     * @throws IllegalArgumentException if quantity is negative
     */
    public MilkRecord update(Long userId, Long recordId, LocalDate date, BigDecimal quantity) {
        MilkRecord record = get(userId, recordId);
        if (date != null) {
            record.changeDate(date);
        }
        if (quantity != null) {
            record.changeQuantity(quantity);
        }
        record = recordRepository.save(record);
        log.info("✓ Milk record updated - recordId={}, userId={}", recordId, userId);
        return record;
    }

    /**
     * @throws NoSuchElementException if the record does not exist or belongs to another user
     */
    public void delete(Long userId, Long recordId) {
        MilkRecord record = get(userId, recordId);
        recordRepository.delete(record);
        log.info("✓ Milk record deleted - recordId={}, userId={}", recordId, userId);
    }
}
