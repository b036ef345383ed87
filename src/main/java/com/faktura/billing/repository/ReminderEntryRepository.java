package com.faktura.billing.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.faktura.billing.domain.ReminderEntry;
import com.faktura.billing.domain.ReminderEntry.ReminderStatus;

/** Repository for reminder history entries. */
@Repository
public interface ReminderEntryRepository extends JpaRepository<ReminderEntry, Long> {

  List<ReminderEntry> findByStatusOrderBySentDateAsc(ReminderStatus status);

  /** History of one invoice in issue order. */
  @Query(
      "SELECT r FROM ReminderEntry r WHERE r.dunningState.invoice.id = :invoiceId ORDER BY r.id ASC")
  List<ReminderEntry> findByInvoiceId(@Param("invoiceId") Long invoiceId);
}
